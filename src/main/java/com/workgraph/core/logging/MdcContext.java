package com.workgraph.core.logging;

import org.slf4j.MDC;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Utility for managing Workgraph-specific MDC keys for structured logging.
 * <p>
 * Keys are set for the lifetime of a {@link Scope}; closing it puts back whatever the
 * caller had under those keys, so nested scopes and request-level keys survive.
 */
public final class MdcContext {

    public static final String ITEM_ID = "itemId";
    public static final String OPERATION = "operation";
    public static final String INDEX_VERSION = "indexVersion";

    private MdcContext() {}

    public static Scope item(String itemId) {
        var values = new LinkedHashMap<String, String>();
        values.put(ITEM_ID, itemId);
        return push(values);
    }

    public static Scope operation(String operation, long indexVersion) {
        var values = new LinkedHashMap<String, String>();
        values.put(OPERATION, operation);
        values.put(INDEX_VERSION, String.valueOf(indexVersion));
        return push(values);
    }

    private static Scope push(Map<String, String> values) {
        var previous = new LinkedHashMap<String, String>();
        values.forEach((key, value) -> {
            previous.put(key, MDC.get(key));
            MDC.put(key, value);
        });
        return new Scope(previous);
    }

    /**
     * Keys set by {@link #item} or {@link #operation}. Closing restores the earlier values.
     */
    public static final class Scope implements AutoCloseable {

        private final Map<String, String> previous;

        private Scope(Map<String, String> previous) {
            this.previous = previous;
        }

        @Override
        public void close() {
            previous.forEach((key, value) -> {
                if (value == null) {
                    MDC.remove(key);
                } else {
                    MDC.put(key, value);
                }
            });
        }
    }
}
