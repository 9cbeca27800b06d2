package com.workgraph.core.analytics;

import com.workgraph.core.snapshot.GraphSnapshot;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Strongly connected components of the {@code blocks} graph (iterative Tarjan).
 * <p>
 * Nodes are numbered in snapshot id order. Components are numbered in the order Tarjan
 * completes them, which is a reverse topological order of the condensation: every
 * component a node can reach has a smaller or equal number.
 */
final class ComponentIndex {

    private final List<String> ids;
    private final Map<String, Integer> ordinals;
    private final int[][] successors;
    private final int[] componentOf;
    private final int[] componentSize;
    private final int componentCount;

    private ComponentIndex(List<String> ids, Map<String, Integer> ordinals, int[][] successors,
                           int[] componentOf, int[] componentSize, int componentCount) {
        this.ids = ids;
        this.ordinals = ordinals;
        this.successors = successors;
        this.componentOf = componentOf;
        this.componentSize = componentSize;
        this.componentCount = componentCount;
    }

    static ComponentIndex of(GraphSnapshot snapshot) {
        List<String> ids = new ArrayList<>(snapshot.nodeIds());
        Map<String, Integer> ordinals = new HashMap<>();
        for (int i = 0; i < ids.size(); i++) {
            ordinals.put(ids.get(i), i);
        }
        int n = ids.size();
        int[][] successors = new int[n][];
        for (int i = 0; i < n; i++) {
            List<String> out = snapshot.blocks(ids.get(i));
            successors[i] = new int[out.size()];
            for (int j = 0; j < out.size(); j++) {
                successors[i][j] = ordinals.get(out.get(j));
            }
        }

        int[] index = new int[n];
        int[] low = new int[n];
        int[] edgePos = new int[n];
        boolean[] onStack = new boolean[n];
        int[] componentOf = new int[n];
        Arrays.fill(index, -1);
        Deque<Integer> stack = new ArrayDeque<>();
        Deque<Integer> calls = new ArrayDeque<>();
        var sizes = new ArrayList<Integer>();
        int counter = 0;

        for (int root = 0; root < n; root++) {
            if (index[root] != -1) {
                continue;
            }
            index[root] = low[root] = counter++;
            stack.push(root);
            onStack[root] = true;
            calls.push(root);

            while (!calls.isEmpty()) {
                int v = calls.peek();
                if (edgePos[v] < successors[v].length) {
                    int w = successors[v][edgePos[v]++];
                    if (index[w] == -1) {
                        index[w] = low[w] = counter++;
                        stack.push(w);
                        onStack[w] = true;
                        calls.push(w);
                    } else if (onStack[w]) {
                        low[v] = Math.min(low[v], index[w]);
                    }
                    continue;
                }
                calls.pop();
                if (!calls.isEmpty()) {
                    int parent = calls.peek();
                    low[parent] = Math.min(low[parent], low[v]);
                }
                if (low[v] == index[v]) {
                    int component = sizes.size();
                    int size = 0;
                    int w;
                    do {
                        w = stack.pop();
                        onStack[w] = false;
                        componentOf[w] = component;
                        size++;
                    } while (w != v);
                    sizes.add(size);
                }
            }
        }

        int[] componentSize = sizes.stream().mapToInt(Integer::intValue).toArray();
        return new ComponentIndex(List.copyOf(ids), ordinals, successors, componentOf, componentSize, sizes.size());
    }

    int nodeCount() {
        return ids.size();
    }

    String id(int ordinal) {
        return ids.get(ordinal);
    }

    int ordinal(String id) {
        return ordinals.get(id);
    }

    int[] successors(int ordinal) {
        return successors[ordinal];
    }

    int componentOf(int ordinal) {
        return componentOf[ordinal];
    }

    int componentCount() {
        return componentCount;
    }

    /** True when the node lies on at least one {@code blocks} cycle. */
    boolean isOnCycle(String id) {
        return componentSize[componentOf[ordinal(id)]] > 1;
    }

    boolean isCyclic(int component) {
        return componentSize[component] > 1;
    }
}
