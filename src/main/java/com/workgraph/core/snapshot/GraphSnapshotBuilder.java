package com.workgraph.core.snapshot;

import com.workgraph.core.error.IndexInconsistentException;
import com.workgraph.core.index.GraphReader;
import com.workgraph.core.model.Edge;
import com.workgraph.core.model.EdgeKind;
import com.workgraph.core.model.WorkItem;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Materializes {@link GraphSnapshot}s. The input collections are copied, so later
 * changes to whatever produced them cannot leak into a built snapshot.
 */
public final class GraphSnapshotBuilder {

    private GraphSnapshotBuilder() {}

    /**
     * Builds a snapshot from node and edge tables that are already mutually consistent.
     *
     * @throws IndexInconsistentException if an edge references a node that is not present
     */
    public static GraphSnapshot build(long version, Collection<WorkItem> nodes, Collection<Edge> edges) {
        var nodeMap = new TreeMap<String, WorkItem>();
        for (WorkItem node : nodes) {
            nodeMap.put(node.id(), node);
        }

        var forward = new TreeMap<String, Set<String>>();
        var backward = new TreeMap<String, Set<String>>();
        for (String id : nodeMap.keySet()) {
            forward.put(id, new TreeSet<>());
            backward.put(id, new TreeSet<>());
        }

        var parentLinked = new HashSet<String>();
        var blockEdges = new ArrayList<Edge>();
        var parentEdges = new ArrayList<Edge>();
        for (Edge edge : new TreeSet<>(edges)) {
            if (!nodeMap.containsKey(edge.from()) || !nodeMap.containsKey(edge.to())) {
                throw new IndexInconsistentException("Dangling edge in snapshot source: " + edge);
            }
            if (edge.kind() == EdgeKind.BLOCKS) {
                forward.get(edge.from()).add(edge.to());
                backward.get(edge.to()).add(edge.from());
                blockEdges.add(edge);
            } else {
                parentLinked.add(edge.from());
                parentLinked.add(edge.to());
                parentEdges.add(edge);
            }
        }

        return new GraphSnapshot(version,
                Collections.unmodifiableMap(nodeMap),
                freeze(forward),
                freeze(backward),
                Collections.unmodifiableSet(parentLinked),
                List.copyOf(blockEdges),
                List.copyOf(parentEdges));
    }

    /**
     * Builds a snapshot through the read boundary. The reader must present a stable view
     * for the duration of the call.
     */
    public static GraphSnapshot from(GraphReader reader) {
        var edges = new ArrayList<Edge>(reader.getAllEdges(EdgeKind.BLOCKS));
        edges.addAll(reader.getAllEdges(EdgeKind.PARENT_OF));
        return build(0, reader.getAllNodes(), edges);
    }

    private static Map<String, List<String>> freeze(Map<String, Set<String>> adjacency) {
        var frozen = new TreeMap<String, List<String>>();
        adjacency.forEach((id, ids) -> frozen.put(id, List.copyOf(ids)));
        return Collections.unmodifiableMap(frozen);
    }
}
