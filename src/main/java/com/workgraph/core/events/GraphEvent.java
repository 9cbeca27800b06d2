package com.workgraph.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted by the index as the graph changes.
 *
 * @param eventType event type (e.g. "index.applied", "index.apply.failed", "index.rebuilt")
 * @param itemId    the work item this event relates to (nullable for graph-wide events)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record GraphEvent(
    String eventType,
    String itemId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static final String APPLIED = "index.applied";
    public static final String APPLY_FAILED = "index.apply.failed";
    public static final String REBUILT = "index.rebuilt";

    public static GraphEvent of(String eventType, String itemId, Map<String, Object> payload) {
        return new GraphEvent(eventType, itemId, payload, Instant.now());
    }
}
