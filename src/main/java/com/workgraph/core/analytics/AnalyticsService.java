package com.workgraph.core.analytics;

import com.workgraph.core.index.GraphIndex;
import com.workgraph.core.logging.MdcContext;
import com.workgraph.core.metrics.WorkgraphMetrics;
import com.workgraph.core.model.Bottleneck;
import com.workgraph.core.model.ImpactAnalysis;
import com.workgraph.core.model.ParallelWork;
import com.workgraph.core.model.RiskAssessment;
import com.workgraph.core.model.StrategicOverview;
import com.workgraph.core.model.WorkItemStatus;
import com.workgraph.core.model.WorkQueueItem;
import com.workgraph.core.model.WorkRecommendation;
import com.workgraph.core.snapshot.GraphSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.function.BiFunction;

/**
 * Runs analytics against the current index snapshot.
 * <p>
 * This is the entry point for the presentation layers: each call takes exactly one
 * snapshot, so the result is consistent even while writers keep mutating the index.
 * Null arguments fall back to the configured defaults. A {@code timeoutMs} of zero or
 * less runs without a deadline.
 */
@Service
public class AnalyticsService {

    private static final Logger log = LoggerFactory.getLogger(AnalyticsService.class);

    private final GraphIndex index;
    private final DependencyAnalytics analytics;
    private final WorkgraphMetrics metrics;
    private final Clock clock;

    public AnalyticsService(GraphIndex index, DependencyAnalytics analytics, WorkgraphMetrics metrics, Clock clock) {
        this.index = index;
        this.analytics = analytics;
        this.metrics = metrics;
        this.clock = clock;
    }

    public List<Bottleneck> bottlenecks(Integer topN, Integer minImpact, Long timeoutMs) {
        var defaults = defaults();
        int n = topN != null ? topN : defaults.getTopN();
        int min = minImpact != null ? minImpact : defaults.getMinImpact();
        return run("bottlenecks", timeoutMs, (snapshot, deadline) -> analytics.findBottlenecks(snapshot, n, min, deadline));
    }

    public ParallelWork parallelWork(Integer maxAgents, WorkItemStatus statusFilter, Long timeoutMs) {
        int agents = maxAgents != null ? maxAgents : defaults().getMaxAgents();
        WorkItemStatus status = statusFilter != null ? statusFilter : WorkItemStatus.TODO;
        return run("parallel", timeoutMs, (snapshot, deadline) -> analytics.getParallelWork(snapshot, agents, status, deadline));
    }

    public List<WorkRecommendation> recommend(Integer agentCount, Integer lookahead, Long timeoutMs) {
        var defaults = defaults();
        int agents = agentCount != null ? agentCount : defaults.getAgentCount();
        int ahead = lookahead != null ? lookahead : defaults.getLookahead();
        return run("recommend", timeoutMs, (snapshot, deadline) -> analytics.recommendNextWork(snapshot, agents, ahead, deadline));
    }

    public RiskAssessment risks(Integer spofThreshold, Long timeoutMs) {
        int threshold = spofThreshold != null ? spofThreshold : defaults().getSpofThreshold();
        return run("risks", timeoutMs, (snapshot, deadline) -> analytics.assessRisks(snapshot, threshold, deadline));
    }

    public ImpactAnalysis impact(String nodeId, Long timeoutMs) {
        return run("impact", timeoutMs, (snapshot, deadline) -> analytics.analyzeImpact(snapshot, nodeId, deadline));
    }

    public List<WorkQueueItem> queue(Integer maxItems, boolean includeBlocked, Long timeoutMs) {
        int max = maxItems != null ? maxItems : defaults().getQueueSize();
        return run("queue", timeoutMs, (snapshot, deadline) -> analytics.getWorkQueue(snapshot, max, includeBlocked, deadline));
    }

    public StrategicOverview overview(Long timeoutMs) {
        return run("overview", timeoutMs, analytics::strategicOverview);
    }

    private AnalyticsProperties.Defaults defaults() {
        return analytics.properties().getDefaults();
    }

    private Deadline deadline(Long timeoutMs) {
        long millis = timeoutMs != null ? timeoutMs : defaults().getTimeoutMs();
        return millis > 0 ? Deadline.after(Duration.ofMillis(millis), clock) : Deadline.none();
    }

    private <T> T run(String operation, Long timeoutMs, BiFunction<GraphSnapshot, Deadline, T> body) {
        Deadline deadline = deadline(timeoutMs);
        GraphSnapshot snapshot = index.snapshot();
        try (var mdc = MdcContext.operation(operation, snapshot.version())) {
            long start = System.currentTimeMillis();
            T result = body.apply(snapshot, deadline);
            long elapsed = System.currentTimeMillis() - start;
            metrics.recordAnalytics(operation, elapsed);
            log.info("{} over {} nodes at version {} took {}ms", operation, snapshot.size(), snapshot.version(), elapsed);
            return result;
        }
    }
}
