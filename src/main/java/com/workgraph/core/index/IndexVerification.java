package com.workgraph.core.index;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * Comparison of the live index with a fresh scan of the store.
 *
 * @param consistent   true when both hold exactly the same nodes and edges
 * @param missingNodes ids in the store but absent from (or different in) the index
 * @param staleNodes   ids in the index but no longer in the store
 * @param missingEdges edges in the store but absent from the index
 * @param extraEdges   edges in the index but absent from the store
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record IndexVerification(
    boolean consistent,
    List<String> missingNodes,
    List<String> staleNodes,
    List<String> missingEdges,
    List<String> extraEdges
) {}
