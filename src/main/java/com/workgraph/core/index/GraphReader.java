package com.workgraph.core.index;

import com.workgraph.core.model.Edge;
import com.workgraph.core.model.EdgeKind;
import com.workgraph.core.model.WorkItem;

import java.util.List;

/**
 * Read boundary between the analytics layer and whatever persists the graph.
 * Results are ordered by id (edges by source, target, kind) so equal contents
 * always produce equal lists.
 */
public interface GraphReader {

    List<WorkItem> getAllNodes();

    List<Edge> getAllEdges(EdgeKind kind);

    default List<Edge> getAllEdges() {
        return getAllEdges(EdgeKind.BLOCKS);
    }

    /**
     * @throws com.workgraph.core.error.NotFoundException if the id is unknown
     */
    WorkItem getNode(String id);
}
