package com.workgraph.core.analytics;

import com.workgraph.core.snapshot.GraphSnapshot;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Enumerates every elementary cycle of the {@code blocks} graph (Johnson's circuit search).
 * <p>
 * Only nodes of a strongly connected component with more than one member can sit on a
 * cycle, so the search starts from each such node in ascending id order and is confined
 * to its component and to ids not smaller than the start. Every cycle is therefore found
 * exactly once, already rotated to begin at its smallest id.
 */
final class CycleDetector {

    private CycleDetector() {}

    static List<List<String>> findCycles(GraphSnapshot snapshot, Deadline deadline) {
        ComponentIndex components = ComponentIndex.of(snapshot);
        var search = new CircuitSearch(components, deadline);
        for (int start = 0; start < components.nodeCount(); start++) {
            if (components.isCyclic(components.componentOf(start))) {
                deadline.check("cycle detection");
                search.from(start);
            }
        }
        var sorted = new ArrayList<>(search.cycles);
        sorted.sort(CycleDetector::compareCycles);
        return List.copyOf(sorted);
    }

    /** Rotates a cycle so that it starts at its lexicographically smallest id. */
    static List<String> canonical(List<String> cycle) {
        int start = cycle.indexOf(Collections.min(cycle));
        var rotated = new ArrayList<String>(cycle.size());
        for (int i = 0; i < cycle.size(); i++) {
            rotated.add(cycle.get((start + i) % cycle.size()));
        }
        return List.copyOf(rotated);
    }

    private static int compareCycles(List<String> a, List<String> b) {
        for (int i = 0; i < Math.min(a.size(), b.size()); i++) {
            int c = a.get(i).compareTo(b.get(i));
            if (c != 0) {
                return c;
            }
        }
        return Integer.compare(a.size(), b.size());
    }

    private static final class CircuitSearch {
        private final ComponentIndex components;
        private final Deadline deadline;
        private final boolean[] blocked;
        private final Map<Integer, Set<Integer>> blockedBy = new HashMap<>();
        private final List<Integer> touched = new ArrayList<>();
        private final List<Integer> path = new ArrayList<>();
        private final List<List<String>> cycles = new ArrayList<>();
        private int start;

        private CircuitSearch(ComponentIndex components, Deadline deadline) {
            this.components = components;
            this.deadline = deadline;
            this.blocked = new boolean[components.nodeCount()];
        }

        void from(int start) {
            this.start = start;
            for (int v : touched) {
                blocked[v] = false;
            }
            touched.clear();
            blockedBy.clear();
            circuit(start);
        }

        private boolean eligible(int w) {
            return w >= start && components.componentOf(w) == components.componentOf(start);
        }

        private boolean circuit(int v) {
            deadline.check("cycle detection");
            boolean closed = false;
            path.add(v);
            blocked[v] = true;
            touched.add(v);
            for (int w : components.successors(v)) {
                if (!eligible(w)) {
                    continue;
                }
                if (w == start) {
                    cycles.add(path.stream().map(components::id).toList());
                    closed = true;
                } else if (!blocked[w] && circuit(w)) {
                    closed = true;
                }
            }
            if (closed) {
                unblock(v);
            } else {
                for (int w : components.successors(v)) {
                    if (eligible(w)) {
                        blockedBy.computeIfAbsent(w, k -> new HashSet<>()).add(v);
                    }
                }
            }
            path.remove(path.size() - 1);
            return closed;
        }

        private void unblock(int v) {
            blocked[v] = false;
            Set<Integer> waiting = blockedBy.remove(v);
            if (waiting != null) {
                for (int u : waiting) {
                    if (blocked[u]) {
                        unblock(u);
                    }
                }
            }
        }
    }
}
