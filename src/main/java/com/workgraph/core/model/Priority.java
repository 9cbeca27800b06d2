package com.workgraph.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.workgraph.core.error.ValidationException;

import java.util.Locale;

/**
 * Priority of a work item with its default scoring weight (critical=4 .. low=1).
 */
public enum Priority {
    LOW("low", 1),
    MEDIUM("medium", 2),
    HIGH("high", 3),
    CRITICAL("critical", 4);

    private final String value;
    private final int defaultWeight;

    Priority(String value, int defaultWeight) {
        this.value = value;
        this.defaultWeight = defaultWeight;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public int defaultWeight() {
        return defaultWeight;
    }

    @JsonCreator
    public static Priority fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ValidationException("Priority must not be blank");
        }
        for (Priority p : values()) {
            if (p.value.equals(raw.trim().toLowerCase(Locale.ROOT))) {
                return p;
            }
        }
        throw new ValidationException("Unknown priority: " + raw);
    }
}
