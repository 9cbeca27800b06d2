package com.workgraph.core.index;

import com.workgraph.core.error.IndexInconsistentException;
import com.workgraph.core.model.Edge;
import com.workgraph.core.model.WorkItem;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Immutable contents of the index: the nodes table, the edges table and a
 * per-node lookup of the edges touching each node. Every mutation returns a new
 * state, so a published state can be read without locks.
 */
final class IndexState {

    private static final IndexState EMPTY = new IndexState(0, Map.of(), Set.of(), Map.of());

    private final long version;
    private final Map<String, WorkItem> nodes;
    private final Set<Edge> edges;
    private final Map<String, Set<Edge>> edgesByNode;

    private IndexState(long version, Map<String, WorkItem> nodes, Set<Edge> edges,
                       Map<String, Set<Edge>> edgesByNode) {
        this.version = version;
        this.nodes = nodes;
        this.edges = edges;
        this.edgesByNode = edgesByNode;
    }

    static IndexState empty() {
        return EMPTY;
    }

    long version() {
        return version;
    }

    Map<String, WorkItem> nodes() {
        return nodes;
    }

    Set<Edge> edges() {
        return edges;
    }

    Set<Edge> edgesTouching(String id) {
        return edgesByNode.getOrDefault(id, Set.of());
    }

    IndexState withVersion(long newVersion) {
        return new IndexState(newVersion, nodes, edges, edgesByNode);
    }

    /**
     * Applies a change, returning {@code this} when the change is already reflected.
     *
     * @throws IndexInconsistentException if the change would leave a dangling edge
     */
    IndexState apply(IndexChange change) {
        return switch (change.type()) {
            case UPSERT_NODE -> upsertNode(change.node());
            case REMOVE_NODE -> removeNode(change.nodeId());
            case ADD_EDGE -> addEdge(change.edge());
            case REMOVE_EDGE -> removeEdge(change.edge());
        };
    }

    private IndexState upsertNode(WorkItem node) {
        if (node.equals(nodes.get(node.id()))) {
            return this;
        }
        var newNodes = new TreeMap<>(nodes);
        newNodes.put(node.id(), node);
        return new IndexState(version + 1, Collections.unmodifiableMap(newNodes), edges, edgesByNode);
    }

    private IndexState removeNode(String id) {
        if (!nodes.containsKey(id)) {
            return this;
        }
        Set<Edge> touching = edgesTouching(id);
        if (!touching.isEmpty()) {
            throw new IndexInconsistentException("Cannot remove " + id + ": still referenced by " + touching);
        }
        var newNodes = new TreeMap<>(nodes);
        newNodes.remove(id);
        var newLookup = new HashMap<>(edgesByNode);
        newLookup.remove(id);
        return new IndexState(version + 1, Collections.unmodifiableMap(newNodes), edges,
                Collections.unmodifiableMap(newLookup));
    }

    private IndexState addEdge(Edge edge) {
        if (!nodes.containsKey(edge.from()) || !nodes.containsKey(edge.to())) {
            throw new IndexInconsistentException("Edge " + edge + " references a node missing from the index");
        }
        if (edges.contains(edge)) {
            return this;
        }
        var newEdges = new TreeSet<>(edges);
        newEdges.add(edge);
        var newLookup = new HashMap<>(edgesByNode);
        newLookup.put(edge.from(), plus(edgesTouching(edge.from()), edge));
        newLookup.put(edge.to(), plus(edgesTouching(edge.to()), edge));
        return new IndexState(version + 1, nodes, Collections.unmodifiableSet(newEdges),
                Collections.unmodifiableMap(newLookup));
    }

    private IndexState removeEdge(Edge edge) {
        if (!edges.contains(edge)) {
            return this;
        }
        var newEdges = new TreeSet<>(edges);
        newEdges.remove(edge);
        var newLookup = new HashMap<>(edgesByNode);
        newLookup.put(edge.from(), minus(edgesTouching(edge.from()), edge));
        newLookup.put(edge.to(), minus(edgesTouching(edge.to()), edge));
        return new IndexState(version + 1, nodes, Collections.unmodifiableSet(newEdges),
                Collections.unmodifiableMap(newLookup));
    }

    private static Set<Edge> plus(Set<Edge> set, Edge edge) {
        var copy = new TreeSet<>(set);
        copy.add(edge);
        return Collections.unmodifiableSet(copy);
    }

    private static Set<Edge> minus(Set<Edge> set, Edge edge) {
        var copy = new TreeSet<>(set);
        copy.remove(edge);
        return Collections.unmodifiableSet(copy);
    }

    /** Same nodes and edges, ignoring the version counter. */
    boolean sameContentAs(IndexState other) {
        return nodes.equals(other.nodes) && edges.equals(other.edges);
    }
}
