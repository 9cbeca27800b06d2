package com.workgraph.core.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * Session-start summary computed over a single snapshot.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record StrategicOverview(
    List<WorkRecommendation> recommendations,
    List<Bottleneck> bottlenecks,
    ParallelWork parallelCapacity,
    long snapshotVersion
) {}
