package com.workgraph.core.analytics;

import com.workgraph.core.model.WorkItem;
import com.workgraph.core.model.WorkQueueItem;
import com.workgraph.core.model.WorkRecommendation;
import com.workgraph.core.snapshot.GraphSnapshot;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;

/**
 * Ordered queue for agents pulling work: ready items in recommendation order,
 * optionally followed by everything still waiting on other work.
 */
final class WorkQueueBuilder {

    private final AnalyticsProperties properties;
    private final WorkRecommender recommender;

    WorkQueueBuilder(AnalyticsProperties properties, WorkRecommender recommender) {
        this.properties = properties;
        this.recommender = recommender;
    }

    List<WorkQueueItem> build(GraphSnapshot snapshot, int maxItems, boolean includeBlocked, Deadline deadline) {
        if (maxItems < 0) {
            throw new IllegalArgumentException("maxItems must not be negative");
        }
        var queue = new ArrayList<WorkQueueItem>();
        var queued = new HashSet<String>();
        for (WorkRecommendation rec : recommender.rankReady(snapshot, deadline)) {
            WorkItem node = snapshot.node(rec.id());
            queue.add(new WorkQueueItem(node.id(), node.title(), node.status(), node.priority(),
                    rec.score(), true, List.of()));
            queued.add(node.id());
        }

        if (includeBlocked) {
            var waiting = new ArrayList<WorkItem>();
            for (WorkItem node : snapshot.nodes()) {
                if (!node.isDone() && !queued.contains(node.id())) {
                    waiting.add(node);
                }
            }
            waiting.sort(Comparator.comparingInt((WorkItem n) -> properties.weight(n.priority())).reversed()
                    .thenComparing(WorkItem::id));
            for (WorkItem node : waiting) {
                deadline.check("get_work_queue");
                List<String> blockers = snapshot.blockedBy(node.id()).stream()
                        .filter(id -> !snapshot.isDone(id))
                        .toList();
                queue.add(new WorkQueueItem(node.id(), node.title(), node.status(), node.priority(),
                        0, false, blockers));
            }
        }
        return queue.stream().limit(maxItems).toList();
    }
}
