package com.workgraph.core.index;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Outcome of a full index rebuild.
 *
 * @param trigger    why the rebuild ran
 * @param nodeCount  nodes now in the index
 * @param edgeCount  edges of any kind now in the index
 * @param version    index version after the swap
 * @param durationMs wall time spent scanning and building
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RebuildReport(
    RebuildTrigger trigger,
    int nodeCount,
    int edgeCount,
    long version,
    long durationMs
) {}
