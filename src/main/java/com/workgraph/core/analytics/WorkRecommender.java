package com.workgraph.core.analytics;

import com.workgraph.core.model.Priority;
import com.workgraph.core.model.WorkItem;
import com.workgraph.core.model.WorkItemStatus;
import com.workgraph.core.model.WorkRecommendation;
import com.workgraph.core.snapshot.GraphSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Scores the items that can start right now.
 * <p>
 * {@code score = priorityCoefficient * weight + unlockCoefficient * unlocks - effortPenalty},
 * with {@code effortPenalty = min(maxEffortPenalty, hours / effortDivisor)} and zero when
 * no estimate is recorded. Only direct dependents count as unlocked.
 */
final class WorkRecommender {

    private static final Logger log = LoggerFactory.getLogger(WorkRecommender.class);

    private static final Comparator<WorkRecommendation> ORDER = Comparator
            .comparingDouble(WorkRecommendation::score).reversed()
            .thenComparing(Comparator.comparingInt(WorkRecommendation::unlocksCount).reversed())
            .thenComparing(WorkRecommendation::id);

    private final AnalyticsProperties properties;
    private final ParallelWorkPlanner planner;

    WorkRecommender(AnalyticsProperties properties, ParallelWorkPlanner planner) {
        this.properties = properties;
        this.planner = planner;
    }

    List<WorkRecommendation> recommend(GraphSnapshot snapshot, int agentCount, int lookahead, Deadline deadline) {
        if (agentCount < 0 || lookahead < 0) {
            throw new IllegalArgumentException("agentCount and lookahead must not be negative");
        }
        int limit = Math.max(agentCount, lookahead);
        List<WorkRecommendation> ranked = rankReady(snapshot, deadline);
        log.debug("recommend_next_work: {} ready candidates, returning up to {}", ranked.size(), limit);
        return ranked.stream().limit(limit).toList();
    }

    /**
     * Every layer-0 item, best first.
     */
    List<WorkRecommendation> rankReady(GraphSnapshot snapshot, Deadline deadline) {
        List<List<String>> layers = planner.layers(snapshot, WorkItemStatus.TODO, deadline);
        if (layers.isEmpty()) {
            return List.of();
        }
        var scored = new ArrayList<WorkRecommendation>();
        for (String id : layers.get(0)) {
            deadline.check("recommend_next_work");
            scored.add(score(snapshot, snapshot.node(id)));
        }
        scored.sort(ORDER);
        return List.copyOf(scored);
    }

    private WorkRecommendation score(GraphSnapshot snapshot, WorkItem node) {
        AnalyticsProperties.Scoring scoring = properties.getScoring();
        List<String> unlocks = snapshot.blocks(node.id());
        double penalty = effortPenalty(node.estimatedEffortHours());
        double score = scoring.getPriorityCoefficient() * properties.weight(node.priority())
                + scoring.getUnlockCoefficient() * unlocks.size()
                - penalty;
        return new WorkRecommendation(node.id(), node.title(), node.priority(), score,
                reasons(snapshot, node, unlocks.size()), node.estimatedEffortHours(), unlocks.size(), unlocks);
    }

    double effortPenalty(Double hours) {
        if (hours == null) {
            return 0;
        }
        AnalyticsProperties.Scoring scoring = properties.getScoring();
        return Math.min(scoring.getMaxEffortPenalty(), hours / scoring.getEffortDivisor());
    }

    private List<String> reasons(GraphSnapshot snapshot, WorkItem node, int unlocks) {
        var reasons = new ArrayList<String>();
        if (node.priority() == Priority.CRITICAL) {
            reasons.add("critical priority");
        } else if (node.priority() == Priority.HIGH) {
            reasons.add("high priority");
        }
        if (unlocks >= properties.getScoring().getUnlocksReasonThreshold()) {
            reasons.add("unblocks " + unlocks + " tasks");
        }
        if (snapshot.blockedBy(node.id()).isEmpty()) {
            reasons.add("ready to start now");
        } else {
            reasons.add("all dependencies complete");
        }
        Double hours = node.estimatedEffortHours();
        if (hours != null && hours <= properties.getScoring().getQuickWinHours()) {
            reasons.add("quick win (" + formatHours(hours) + "h)");
        }
        return List.copyOf(reasons);
    }

    private static String formatHours(double hours) {
        return hours == Math.rint(hours) ? String.valueOf((long) hours) : String.valueOf(hours);
    }
}
