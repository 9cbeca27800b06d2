package com.workgraph.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.workgraph.core.error.ValidationException;

import java.io.Serializable;
import java.time.Instant;

/**
 * A trackable unit of work: a node of the dependency graph.
 *
 * @param id                   opaque stable identifier, never reused
 * @param title                human readable title
 * @param status               lifecycle status
 * @param priority             priority, drives scoring weights
 * @param itemType             feature, bug, track or epic
 * @param estimatedEffortHours optional non-negative effort estimate (nullable)
 * @param createdAt            creation time
 * @param updatedAt            last modification time, never before {@code createdAt}
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record WorkItem(
    String id,
    String title,
    WorkItemStatus status,
    Priority priority,
    @JsonProperty("type") ItemType itemType,
    Double estimatedEffortHours,
    Instant createdAt,
    Instant updatedAt
) implements Serializable {

    public WorkItem {
        if (id == null || id.isBlank()) {
            throw new ValidationException("Work item id must not be blank");
        }
        if (title == null || title.isBlank()) {
            throw new ValidationException("Work item " + id + " has no title");
        }
        if (status == null || priority == null || itemType == null) {
            throw new ValidationException("Work item " + id + " is missing status, priority or type");
        }
        if (estimatedEffortHours != null
                && (estimatedEffortHours.isNaN() || estimatedEffortHours < 0)) {
            throw new ValidationException("Work item " + id + " has negative effort: " + estimatedEffortHours);
        }
        if (createdAt == null || updatedAt == null) {
            throw new ValidationException("Work item " + id + " is missing timestamps");
        }
        if (updatedAt.isBefore(createdAt)) {
            throw new ValidationException("Work item " + id + " updated before it was created");
        }
    }

    @JsonIgnore
    public boolean isDone() {
        return status.isDone();
    }

    public WorkItem withStatus(WorkItemStatus newStatus, Instant now) {
        return new WorkItem(id, title, newStatus, priority, itemType, estimatedEffortHours,
                createdAt, later(now));
    }

    public WorkItem withDetails(String newTitle, Priority newPriority, Double newEffort, Instant now) {
        return new WorkItem(id,
                newTitle != null ? newTitle : title,
                status,
                newPriority != null ? newPriority : priority,
                itemType,
                newEffort != null ? newEffort : estimatedEffortHours,
                createdAt, later(now));
    }

    /** Keeps {@code updatedAt} monotonic even if the wall clock steps backwards. */
    private Instant later(Instant now) {
        return now.isAfter(updatedAt) ? now : updatedAt;
    }
}
