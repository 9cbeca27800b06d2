package com.workgraph.core.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * A work item whose completion unblocks disproportionately many others.
 *
 * @param id           item id
 * @param title        item title
 * @param status       item status (never done)
 * @param priority     item priority
 * @param blocksCount  number of items it directly blocks
 * @param impactScore  weighted impact: direct dependents at full weight, transitive ones at the transitive factor
 * @param blockedTasks ids it directly blocks, ascending
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record Bottleneck(
    String id,
    String title,
    WorkItemStatus status,
    Priority priority,
    int blocksCount,
    double impactScore,
    List<String> blockedTasks
) {}
