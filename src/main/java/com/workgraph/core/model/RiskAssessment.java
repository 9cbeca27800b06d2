package com.workgraph.core.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * Structural risks of the dependency graph. Cycles are a result here, not an error.
 *
 * @param highRiskTasks        single points of failure, highest risk first
 * @param circularDependencies each cycle once, starting at its smallest id
 * @param orphanedTasks        unresolved items with no relations at all
 * @param recommendations      one line per high-risk task, then one per cycle
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RiskAssessment(
    List<HighRiskTask> highRiskTasks,
    List<List<String>> circularDependencies,
    List<String> orphanedTasks,
    List<String> recommendations
) {

    /**
     * @param id          item id
     * @param title       item title
     * @param priority    item priority
     * @param blocksCount number of items it directly blocks
     * @param riskScore   blocks count times priority weight
     * @param riskFactors why the item is risky
     */
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record HighRiskTask(
        String id,
        String title,
        Priority priority,
        int blocksCount,
        int riskScore,
        List<String> riskFactors
    ) {}
}
