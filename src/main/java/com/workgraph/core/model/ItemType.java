package com.workgraph.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.workgraph.core.error.ValidationException;

import java.util.Locale;

/**
 * Kind of work item. {@code phase} is read as an alias of {@link #EPIC}.
 */
public enum ItemType {
    FEATURE("feature", "feat"),
    BUG("bug", "bug"),
    TRACK("track", "trk"),
    EPIC("epic", "epic");

    private final String value;
    private final String idPrefix;

    ItemType(String value, String idPrefix) {
        this.value = value;
        this.idPrefix = idPrefix;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /** Prefix used when the store generates an id for a new item of this type. */
    public String idPrefix() {
        return idPrefix;
    }

    @JsonCreator
    public static ItemType fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ValidationException("Item type must not be blank");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        if ("phase".equals(normalized)) {
            return EPIC;
        }
        for (ItemType t : values()) {
            if (t.value.equals(normalized)) {
                return t;
            }
        }
        throw new ValidationException("Unknown item type: " + raw);
    }
}
