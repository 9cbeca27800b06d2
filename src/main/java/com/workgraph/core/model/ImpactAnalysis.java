package com.workgraph.core.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * Downstream effect of completing one item.
 *
 * @param nodeId             the analysed item
 * @param directDependents   number of items it directly blocks
 * @param totalImpact        number of unresolved items transitively blocked by it
 * @param completionImpact   total impact as a percentage of the other unresolved items
 * @param directDependentIds ids it directly blocks, ascending
 * @param affectedTasks      ids it transitively blocks, ascending
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ImpactAnalysis(
    String nodeId,
    int directDependents,
    int totalImpact,
    double completionImpact,
    List<String> directDependentIds,
    List<String> affectedTasks
) {}
