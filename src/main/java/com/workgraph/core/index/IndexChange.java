package com.workgraph.core.index;

import com.workgraph.core.model.Edge;
import com.workgraph.core.model.WorkItem;

import java.util.List;
import java.util.Objects;

/**
 * One store mutation as seen by the index.
 *
 * @param type   what changed
 * @param node   the new node state (UPSERT_NODE only)
 * @param nodeId the affected node (UPSERT_NODE and REMOVE_NODE)
 * @param edge   the affected edge (ADD_EDGE and REMOVE_EDGE)
 */
public record IndexChange(
    ChangeType type,
    WorkItem node,
    String nodeId,
    Edge edge
) {

    public enum ChangeType {
        UPSERT_NODE,
        REMOVE_NODE,
        ADD_EDGE,
        REMOVE_EDGE
    }

    public IndexChange {
        Objects.requireNonNull(type, "type");
        switch (type) {
            case UPSERT_NODE -> Objects.requireNonNull(node, "node");
            case REMOVE_NODE -> Objects.requireNonNull(nodeId, "nodeId");
            case ADD_EDGE, REMOVE_EDGE -> Objects.requireNonNull(edge, "edge");
        }
    }

    public static IndexChange upsertNode(WorkItem node) {
        return new IndexChange(ChangeType.UPSERT_NODE, node, node.id(), null);
    }

    public static IndexChange removeNode(String nodeId) {
        return new IndexChange(ChangeType.REMOVE_NODE, null, nodeId, null);
    }

    public static IndexChange addEdge(Edge edge) {
        return new IndexChange(ChangeType.ADD_EDGE, null, null, edge);
    }

    public static IndexChange removeEdge(Edge edge) {
        return new IndexChange(ChangeType.REMOVE_EDGE, null, null, edge);
    }

    /** Node ids whose locks must be held while this change is applied. */
    public List<String> affectedIds() {
        return switch (type) {
            case UPSERT_NODE, REMOVE_NODE -> List.of(nodeId);
            case ADD_EDGE, REMOVE_EDGE -> List.of(edge.from(), edge.to());
        };
    }

    @Override
    public String toString() {
        return switch (type) {
            case UPSERT_NODE, REMOVE_NODE -> type + "(" + nodeId + ")";
            case ADD_EDGE, REMOVE_EDGE -> type + "(" + edge.from() + " " + edge.kind().value() + " " + edge.to() + ")";
        };
    }
}
