package com.workgraph.core.health;

import java.util.Collection;
import java.util.Map;

/**
 * Result of one component check: the document store, the live index or its snapshot.
 */
public record HealthStatus(
    String component,
    Status status,
    String detail,
    Map<String, String> metadata
) {
    /** Declared from best to worst. */
    public enum Status { UP, DEGRADED, DOWN }

    public static HealthStatus up(String component, String detail, Map<String, String> metadata) {
        return new HealthStatus(component, Status.UP, detail, metadata);
    }

    /** Serving, but out of step with the store until the next rebuild. */
    public static HealthStatus degraded(String component, String detail, Map<String, String> metadata) {
        return new HealthStatus(component, Status.DEGRADED, detail, metadata);
    }

    public static HealthStatus down(String component, String detail) {
        return new HealthStatus(component, Status.DOWN, detail, Map.of());
    }

    /** Worst status among the checks; UP when there are none. */
    public static Status overall(Collection<HealthStatus> checks) {
        Status worst = Status.UP;
        for (HealthStatus check : checks) {
            if (check.status().compareTo(worst) > 0) {
                worst = check.status();
            }
        }
        return worst;
    }
}
