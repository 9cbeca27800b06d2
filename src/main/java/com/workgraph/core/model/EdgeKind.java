package com.workgraph.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.workgraph.core.error.ValidationException;

import java.util.Locale;

/**
 * Relation between two work items.
 * <p>
 * BLOCKS: the target cannot start until the source is done. The inverse
 * "blocked by" view is derived and never stored.
 * PARENT_OF: hierarchical grouping (track to feature), display only.
 */
public enum EdgeKind {
    BLOCKS("blocks"),
    PARENT_OF("parent_of");

    private final String value;

    EdgeKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static EdgeKind fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ValidationException("Edge kind must not be blank");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (EdgeKind k : values()) {
            if (k.value.equals(normalized)) {
                return k;
            }
        }
        throw new ValidationException("Unknown edge kind: " + raw);
    }
}
