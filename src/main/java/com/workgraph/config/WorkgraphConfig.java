package com.workgraph.config;

import com.workgraph.core.analytics.AnalyticsProperties;
import com.workgraph.core.analytics.DependencyAnalytics;
import com.workgraph.core.events.EventBus;
import com.workgraph.core.index.GraphIndex;
import com.workgraph.core.index.RebuildTrigger;
import com.workgraph.core.metrics.WorkgraphMetrics;
import com.workgraph.core.store.FileWorkItemStore;
import com.workgraph.core.store.WorkItemStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Wires the document store, the graph index built over it and the analytics engine.
 * <p>
 * The index is populated from the store when the context starts unless
 * {@code workgraph.index.rebuild-on-startup} is false, in which case it starts empty
 * until the first write or an explicit rebuild.
 */
@Configuration
@EnableConfigurationProperties(WorkgraphProperties.class)
public class WorkgraphConfig {

    private static final Logger log = LoggerFactory.getLogger(WorkgraphConfig.class);

    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean(WorkItemStore.class)
    public WorkItemStore workItemStore(WorkgraphProperties properties) {
        Path directory = Path.of(properties.getStore().getDirectory()).toAbsolutePath();
        log.info("Using work item store at {}", directory);
        return new FileWorkItemStore(directory);
    }

    @Bean
    public GraphIndex graphIndex(WorkItemStore store, EventBus eventBus, WorkgraphMetrics metrics,
                                 WorkgraphProperties properties) {
        var index = new GraphIndex(store, eventBus, metrics);
        if (properties.getIndex().isRebuildOnStartup()) {
            index.rebuild(RebuildTrigger.STARTUP);
        } else {
            log.info("Startup rebuild disabled; index starts empty");
        }
        return index;
    }

    @Bean
    public DependencyAnalytics dependencyAnalytics(AnalyticsProperties properties) {
        return new DependencyAnalytics(properties);
    }
}
