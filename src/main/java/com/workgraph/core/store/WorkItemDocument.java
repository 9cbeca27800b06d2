package com.workgraph.core.store;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.workgraph.core.model.Edge;
import com.workgraph.core.model.EdgeKind;
import com.workgraph.core.model.ItemType;
import com.workgraph.core.model.Priority;
import com.workgraph.core.model.WorkItem;
import com.workgraph.core.model.WorkItemStatus;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * The persisted unit: one work item plus its outgoing edges.
 * <p>
 * Incoming edges are never stored here; they live in the documents of their sources,
 * so every relation is recorded exactly once.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record WorkItemDocument(
    String id,
    String title,
    WorkItemStatus status,
    Priority priority,
    ItemType type,
    Double estimatedEffortHours,
    Instant createdAt,
    Instant updatedAt,
    List<OutgoingEdge> edges
) {

    public WorkItemDocument {
        edges = edges == null ? List.of() : List.copyOf(edges);
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record OutgoingEdge(EdgeKind kind, String to) {}

    public static WorkItemDocument of(WorkItem item, Collection<Edge> outgoing) {
        var edges = new ArrayList<OutgoingEdge>();
        for (Edge e : outgoing) {
            if (!e.from().equals(item.id())) {
                throw new IllegalArgumentException("Edge " + e + " does not start at " + item.id());
            }
            edges.add(new OutgoingEdge(e.kind(), e.to()));
        }
        return new WorkItemDocument(item.id(), item.title(), item.status(), item.priority(), item.itemType(),
                item.estimatedEffortHours(), item.createdAt(), item.updatedAt(), edges);
    }

    /** Rebuilds the validated node; invalid content surfaces as a {@code ValidationException}. */
    public WorkItem toWorkItem() {
        return new WorkItem(id, title, status, priority, type, estimatedEffortHours, createdAt, updatedAt);
    }

    public List<Edge> outgoingEdges() {
        var result = new ArrayList<Edge>(edges.size());
        for (OutgoingEdge e : edges) {
            result.add(new Edge(id, e.to(), e.kind()));
        }
        return result;
    }

    public boolean hasEdge(Edge edge) {
        return edge.from().equals(id)
                && edges.stream().anyMatch(e -> e.kind() == edge.kind() && Objects.equals(e.to(), edge.to()));
    }

    public WorkItemDocument withItem(WorkItem item) {
        return of(item, outgoingEdges());
    }

    public WorkItemDocument withEdge(Edge edge) {
        if (hasEdge(edge)) {
            return this;
        }
        var updated = new ArrayList<>(outgoingEdges());
        updated.add(edge);
        return of(toWorkItem(), updated);
    }

    public WorkItemDocument withoutEdge(Edge edge) {
        var updated = new ArrayList<>(outgoingEdges());
        updated.remove(edge);
        return of(toWorkItem(), updated);
    }
}
