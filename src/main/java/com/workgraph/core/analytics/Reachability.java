package com.workgraph.core.analytics;

import com.workgraph.core.snapshot.GraphSnapshot;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Transitive "blocks" closure of a snapshot, computed once and shared by every node
 * of an operation.
 * <p>
 * Done nodes are traversed as pass-through but never reported, and a node never
 * reports itself even when it sits on a cycle. Closures are built per strongly
 * connected component in reverse topological order, so each component is visited once
 * instead of once per node.
 */
final class Reachability {

    private final GraphSnapshot snapshot;
    private final ComponentIndex components;
    private final BitSet[] reachByComponent;

    private Reachability(GraphSnapshot snapshot, ComponentIndex components, BitSet[] reachByComponent) {
        this.snapshot = snapshot;
        this.components = components;
        this.reachByComponent = reachByComponent;
    }

    static Reachability of(GraphSnapshot snapshot, Deadline deadline) {
        ComponentIndex components = ComponentIndex.of(snapshot);
        int count = components.componentCount();
        int n = components.nodeCount();

        BitSet[] members = new BitSet[count];
        for (int c = 0; c < count; c++) {
            members[c] = new BitSet(n);
        }
        for (int v = 0; v < n; v++) {
            members[components.componentOf(v)].set(v);
        }

        BitSet[] reach = new BitSet[count];
        for (int c = 0; c < count; c++) {
            deadline.check("transitive closure");
            BitSet closure = new BitSet(n);
            if (components.isCyclic(c)) {
                closure.or(members[c]);
            }
            Set<Integer> visitedSuccessors = new HashSet<>();
            for (int v = members[c].nextSetBit(0); v >= 0; v = members[c].nextSetBit(v + 1)) {
                for (int w : components.successors(v)) {
                    int d = components.componentOf(w);
                    if (d != c && visitedSuccessors.add(d)) {
                        closure.or(members[d]);
                        closure.or(reach[d]);
                    }
                }
            }
            reach[c] = closure;
        }
        return new Reachability(snapshot, components, reach);
    }

    /**
     * Unfinished ids transitively blocked by {@code id}, ascending.
     */
    List<String> transitivelyBlocked(String id) {
        int ordinal = components.ordinal(id);
        BitSet closure = reachByComponent[components.componentOf(ordinal)];
        var result = new ArrayList<String>(closure.cardinality());
        for (int v = closure.nextSetBit(0); v >= 0; v = closure.nextSetBit(v + 1)) {
            if (v == ordinal) {
                continue;
            }
            String other = components.id(v);
            if (!snapshot.isDone(other)) {
                result.add(other);
            }
        }
        return result;
    }

    boolean isOnCycle(String id) {
        return components.isOnCycle(id);
    }

    /**
     * Breadth-first closure for a single node, for callers that need only one answer.
     */
    static List<String> transitivelyBlocked(GraphSnapshot snapshot, String id) {
        snapshot.node(id);
        var seen = new HashSet<String>();
        Deque<String> queue = new ArrayDeque<>(snapshot.blocks(id));
        var result = new TreeSet<String>();
        while (!queue.isEmpty()) {
            String next = queue.poll();
            if (!seen.add(next)) {
                continue;
            }
            if (!next.equals(id) && !snapshot.isDone(next)) {
                result.add(next);
            }
            queue.addAll(snapshot.blocks(next));
        }
        return List.copyOf(result);
    }
}
