package com.workgraph.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.workgraph.core.error.ValidationException;

import java.util.Locale;

/**
 * Lifecycle status of a work item. Transitions are driven by callers only;
 * analytics never infer or change a status.
 */
public enum WorkItemStatus {
    TODO("todo"),
    IN_PROGRESS("in-progress"),
    BLOCKED("blocked"),
    DONE("done");

    private final String value;

    WorkItemStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public boolean isDone() {
        return this == DONE;
    }

    /**
     * Parses the stored form. Accepts the legacy spellings written by older tooling
     * ({@code in_progress}, {@code active}, {@code completed}).
     */
    @JsonCreator
    public static WorkItemStatus fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ValidationException("Status must not be blank");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        return switch (normalized) {
            case "todo" -> TODO;
            case "in-progress", "active" -> IN_PROGRESS;
            case "blocked" -> BLOCKED;
            case "done", "completed" -> DONE;
            default -> throw new ValidationException("Unknown status: " + raw);
        };
    }
}
