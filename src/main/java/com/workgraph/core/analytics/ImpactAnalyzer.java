package com.workgraph.core.analytics;

import com.workgraph.core.model.ImpactAnalysis;
import com.workgraph.core.snapshot.GraphSnapshot;

import java.util.List;

/**
 * Downstream effect of completing a single item.
 */
final class ImpactAnalyzer {

    ImpactAnalysis analyze(GraphSnapshot snapshot, String nodeId) {
        // node() rejects unknown ids before any traversal
        snapshot.node(nodeId);
        List<String> direct = snapshot.blocks(nodeId);
        List<String> affected = Reachability.transitivelyBlocked(snapshot, nodeId);
        long others = Math.max(1, snapshot.unresolvedCount() - 1);
        double completionImpact = (double) affected.size() / others * 100.0;
        return new ImpactAnalysis(nodeId, direct.size(), affected.size(), completionImpact, direct, affected);
    }
}
