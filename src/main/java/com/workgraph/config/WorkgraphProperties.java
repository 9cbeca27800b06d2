package com.workgraph.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Storage and index settings, bound from {@code workgraph.*} in application YAML.
 * Analytics tuning lives in {@link com.workgraph.core.analytics.AnalyticsProperties}.
 */
@ConfigurationProperties(prefix = "workgraph")
public class WorkgraphProperties {

    private Store store = new Store();
    private Index index = new Index();

    public Store getStore() {
        return store;
    }

    public void setStore(Store store) {
        this.store = store;
    }

    public Index getIndex() {
        return index;
    }

    public void setIndex(Index index) {
        this.index = index;
    }

    public static class Store {
        /** One JSON document per work item lives here. */
        private String directory = ".workgraph/items";

        public String getDirectory() {
            return directory;
        }

        public void setDirectory(String directory) {
            this.directory = directory;
        }
    }

    public static class Index {
        private boolean rebuildOnStartup = true;

        public boolean isRebuildOnStartup() {
            return rebuildOnStartup;
        }

        public void setRebuildOnStartup(boolean rebuildOnStartup) {
            this.rebuildOnStartup = rebuildOnStartup;
        }
    }
}
