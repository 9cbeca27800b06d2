package com.workgraph.core.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * A ready-to-start item suggested to an agent.
 *
 * @param id             item id
 * @param title          item title
 * @param priority       item priority
 * @param score          priority and unlock score minus the effort penalty
 * @param reasons        human readable reasons derived from the dominant score terms
 * @param estimatedHours effort estimate (nullable)
 * @param unlocksCount   number of items it directly blocks
 * @param unlocks        ids it directly blocks, ascending
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record WorkRecommendation(
    String id,
    String title,
    Priority priority,
    double score,
    List<String> reasons,
    Double estimatedHours,
    int unlocksCount,
    List<String> unlocks
) {}
