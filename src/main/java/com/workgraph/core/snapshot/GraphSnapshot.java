package com.workgraph.core.snapshot;

import com.workgraph.core.error.NotFoundException;
import com.workgraph.core.model.Edge;
import com.workgraph.core.model.WorkItem;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable, point-in-time adjacency view of the dependency graph.
 * <p>
 * {@code forward[a]} holds the ids {@code a} blocks, {@code backward[b]} the ids
 * blocking {@code b}; both come from {@code blocks} edges only. Parent links are kept
 * solely to tell orphans apart from grouped items. Every map has an entry (possibly
 * empty) for each node and all collections are ordered by id, so a snapshot can be
 * shared across threads without copying.
 */
public final class GraphSnapshot {

    private final long version;
    private final Map<String, WorkItem> nodes;
    private final Map<String, List<String>> forward;
    private final Map<String, List<String>> backward;
    private final Set<String> parentLinked;
    private final List<Edge> blockEdges;
    private final List<Edge> parentEdges;

    GraphSnapshot(long version,
                  Map<String, WorkItem> nodes,
                  Map<String, List<String>> forward,
                  Map<String, List<String>> backward,
                  Set<String> parentLinked,
                  List<Edge> blockEdges,
                  List<Edge> parentEdges) {
        this.version = version;
        this.nodes = nodes;
        this.forward = forward;
        this.backward = backward;
        this.parentLinked = parentLinked;
        this.blockEdges = blockEdges;
        this.parentEdges = parentEdges;
    }

    /** Index version this snapshot was taken from. */
    public long version() {
        return version;
    }

    /** All nodes in id order. */
    public Collection<WorkItem> nodes() {
        return nodes.values();
    }

    public Set<String> nodeIds() {
        return nodes.keySet();
    }

    public int size() {
        return nodes.size();
    }

    public boolean contains(String id) {
        return nodes.containsKey(id);
    }

    public WorkItem node(String id) {
        WorkItem node = nodes.get(id);
        if (node == null) {
            throw new NotFoundException(id);
        }
        return node;
    }

    /** Ids directly blocked by {@code id}. */
    public List<String> blocks(String id) {
        requireKnown(id);
        return forward.get(id);
    }

    /** Ids directly blocking {@code id}. */
    public List<String> blockedBy(String id) {
        requireKnown(id);
        return backward.get(id);
    }

    public boolean hasParentRelation(String id) {
        requireKnown(id);
        return parentLinked.contains(id);
    }

    public boolean isDone(String id) {
        return node(id).isDone();
    }

    public long unresolvedCount() {
        return nodes.values().stream().filter(n -> !n.isDone()).count();
    }

    public List<Edge> blockEdges() {
        return blockEdges;
    }

    public List<Edge> parentEdges() {
        return parentEdges;
    }

    private void requireKnown(String id) {
        if (!nodes.containsKey(id)) {
            throw new NotFoundException(id);
        }
    }

    @Override
    public String toString() {
        return "GraphSnapshot[version=" + version + ", nodes=" + nodes.size()
                + ", blocks=" + blockEdges.size() + ", parents=" + parentEdges.size() + "]";
    }
}
