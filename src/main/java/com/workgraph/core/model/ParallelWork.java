package com.workgraph.core.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * Topological layering of the unresolved work.
 *
 * @param maxParallelism largest layer size, capped by the number of agents
 * @param readyNow       layer 0: items that can start immediately
 * @param totalReady     size of layer 0
 * @param levelCount     number of non-empty layers
 * @param nextLevel      layer 1, empty when there is none
 * @param layers         every layer in order, ids ascending within a layer
 * @param cycleMembers   unresolved items excluded from layering because they sit on a cycle
 * @param unscheduled    other unresolved items that never became ready (different status, or downstream of a cycle)
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ParallelWork(
    int maxParallelism,
    List<String> readyNow,
    int totalReady,
    int levelCount,
    List<String> nextLevel,
    List<List<String>> layers,
    List<String> cycleMembers,
    List<String> unscheduled
) {

    public static ParallelWork empty() {
        return new ParallelWork(0, List.of(), 0, 0, List.of(), List.of(), List.of(), List.of());
    }
}
