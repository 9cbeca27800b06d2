package com.workgraph.core.analytics;

import com.workgraph.core.model.ParallelWork;
import com.workgraph.core.model.WorkItem;
import com.workgraph.core.model.WorkItemStatus;
import com.workgraph.core.snapshot.GraphSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Topological layering of the unresolved work by iterative peeling.
 * <p>
 * Layer 0 holds the items with the requested status whose blockers are all done.
 * Each further layer holds the items whose unfinished blockers were all placed in
 * earlier layers. Peeling stops at the first empty layer; cycle members can never be
 * peeled and are reported separately instead of failing the operation.
 */
final class ParallelWorkPlanner {

    private static final Logger log = LoggerFactory.getLogger(ParallelWorkPlanner.class);

    ParallelWork plan(GraphSnapshot snapshot, int maxAgents, WorkItemStatus statusFilter, Deadline deadline) {
        if (maxAgents < 1) {
            throw new IllegalArgumentException("maxAgents must be at least 1");
        }
        List<List<String>> layers = layers(snapshot, statusFilter, deadline);

        var unresolved = new TreeSet<String>();
        for (WorkItem node : snapshot.nodes()) {
            if (!node.isDone()) {
                unresolved.add(node.id());
            }
        }
        layers.forEach(unresolved::removeAll);

        var cycleMembers = new ArrayList<String>();
        var unscheduled = new ArrayList<String>();
        if (!unresolved.isEmpty()) {
            ComponentIndex components = ComponentIndex.of(snapshot);
            for (String id : unresolved) {
                (components.isOnCycle(id) ? cycleMembers : unscheduled).add(id);
            }
        }

        if (layers.isEmpty()) {
            return new ParallelWork(0, List.of(), 0, 0, List.of(), List.of(),
                    List.copyOf(cycleMembers), List.copyOf(unscheduled));
        }
        int widest = layers.stream().mapToInt(List::size).max().orElse(0);
        List<String> readyNow = layers.get(0);
        List<String> nextLevel = layers.size() > 1 ? layers.get(1) : List.of();
        log.debug("get_parallel_work: {} layers, {} ready, {} on cycles, {} unscheduled",
                layers.size(), readyNow.size(), cycleMembers.size(), unscheduled.size());
        return new ParallelWork(Math.min(widest, maxAgents), readyNow, readyNow.size(), layers.size(),
                nextLevel, layers, List.copyOf(cycleMembers), List.copyOf(unscheduled));
    }

    /**
     * Non-empty layers in order, each sorted by id.
     */
    List<List<String>> layers(GraphSnapshot snapshot, WorkItemStatus statusFilter, Deadline deadline) {
        var remaining = new TreeSet<String>();
        for (WorkItem node : snapshot.nodes()) {
            if (!node.isDone()) {
                remaining.add(node.id());
            }
        }

        var layers = new ArrayList<List<String>>();
        while (!remaining.isEmpty()) {
            deadline.check("get_parallel_work");
            var layer = new ArrayList<String>();
            for (String id : remaining) {
                if (snapshot.node(id).status() == statusFilter && isReady(snapshot, id, remaining)) {
                    layer.add(id);
                }
            }
            if (layer.isEmpty()) {
                break;
            }
            layer.forEach(remaining::remove);
            layers.add(List.copyOf(layer));
        }
        return layers;
    }

    private static boolean isReady(GraphSnapshot snapshot, String id, Set<String> remaining) {
        for (String blocker : snapshot.blockedBy(id)) {
            if (remaining.contains(blocker)) {
                return false;
            }
        }
        return true;
    }
}
