package com.workgraph.core.model;

import com.workgraph.core.error.ValidationException;

import java.io.Serializable;
import java.util.Comparator;

/**
 * A directed relation between two work item ids.
 *
 * @param from source item id (for BLOCKS: the item that must finish first)
 * @param to   target item id
 * @param kind relation kind
 */
public record Edge(
    String from,
    String to,
    EdgeKind kind
) implements Serializable, Comparable<Edge> {

    private static final Comparator<Edge> ORDER = Comparator
            .comparing(Edge::from)
            .thenComparing(Edge::to)
            .thenComparing(Edge::kind);

    public Edge {
        if (from == null || from.isBlank() || to == null || to.isBlank()) {
            throw new ValidationException("Edge endpoints must not be blank");
        }
        if (kind == null) {
            throw new ValidationException("Edge kind is required");
        }
        if (from.equals(to)) {
            throw new ValidationException("A work item cannot relate to itself: " + from);
        }
    }

    public static Edge blocks(String from, String to) {
        return new Edge(from, to, EdgeKind.BLOCKS);
    }

    public static Edge parentOf(String parent, String child) {
        return new Edge(parent, child, EdgeKind.PARENT_OF);
    }

    public boolean touches(String id) {
        return from.equals(id) || to.equals(id);
    }

    @Override
    public int compareTo(Edge other) {
        return ORDER.compare(this, other);
    }
}
