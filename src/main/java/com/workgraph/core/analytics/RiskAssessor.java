package com.workgraph.core.analytics;

import com.workgraph.core.model.RiskAssessment;
import com.workgraph.core.model.RiskAssessment.HighRiskTask;
import com.workgraph.core.model.WorkItem;
import com.workgraph.core.snapshot.GraphSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Structural risks: single points of failure, dependency cycles and orphaned items.
 */
final class RiskAssessor {

    private static final Logger log = LoggerFactory.getLogger(RiskAssessor.class);

    private final AnalyticsProperties properties;

    RiskAssessor(AnalyticsProperties properties) {
        this.properties = properties;
    }

    RiskAssessment assess(GraphSnapshot snapshot, int spofThreshold, Deadline deadline) {
        if (spofThreshold < 1) {
            throw new IllegalArgumentException("spofThreshold must be at least 1");
        }
        var highRisk = new ArrayList<HighRiskTask>();
        var orphans = new ArrayList<String>();
        for (WorkItem node : snapshot.nodes()) {
            if (node.isDone()) {
                continue;
            }
            deadline.check("assess_risks");
            List<String> blocks = snapshot.blocks(node.id());
            List<String> blockedBy = snapshot.blockedBy(node.id());

            if (blocks.size() >= spofThreshold) {
                highRisk.add(new HighRiskTask(node.id(), node.title(), node.priority(), blocks.size(),
                        blocks.size() * properties.weight(node.priority()),
                        riskFactors(snapshot, blocks.size(), blockedBy)));
            }
            if (blocks.isEmpty() && blockedBy.isEmpty() && !snapshot.hasParentRelation(node.id())) {
                orphans.add(node.id());
            }
        }
        highRisk.sort(Comparator.comparingInt(HighRiskTask::riskScore).reversed()
                .thenComparing(HighRiskTask::id));

        List<List<String>> cycles = CycleDetector.findCycles(snapshot, deadline);

        var recommendations = new ArrayList<String>();
        for (HighRiskTask task : highRisk) {
            recommendations.add("Prioritize " + task.id() + " (" + task.title() + "): it blocks "
                    + task.blocksCount() + " tasks");
        }
        for (List<String> cycle : cycles) {
            recommendations.add("Break circular dependency: " + describeCycle(cycle));
        }

        if (!cycles.isEmpty()) {
            log.info("assess_risks found {} dependency cycle(s)", cycles.size());
        }
        log.debug("assess_risks: {} high-risk, {} cycles, {} orphaned", highRisk.size(), cycles.size(), orphans.size());
        return new RiskAssessment(List.copyOf(highRisk), cycles, List.copyOf(orphans), List.copyOf(recommendations));
    }

    private static List<String> riskFactors(GraphSnapshot snapshot, int blocksCount, List<String> blockedBy) {
        var factors = new ArrayList<String>();
        factors.add("single point of failure: blocks " + blocksCount + " tasks");
        if (blockedBy.stream().anyMatch(id -> !snapshot.isDone(id))) {
            factors.add("high-priority work is itself blocked");
        }
        return List.copyOf(factors);
    }

    static String describeCycle(List<String> cycle) {
        return String.join(" -> ", cycle) + " -> " + cycle.get(0);
    }
}
