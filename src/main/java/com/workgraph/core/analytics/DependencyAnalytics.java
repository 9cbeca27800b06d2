package com.workgraph.core.analytics;

import com.workgraph.core.model.Bottleneck;
import com.workgraph.core.model.ImpactAnalysis;
import com.workgraph.core.model.ParallelWork;
import com.workgraph.core.model.RiskAssessment;
import com.workgraph.core.model.StrategicOverview;
import com.workgraph.core.model.WorkItemStatus;
import com.workgraph.core.model.WorkQueueItem;
import com.workgraph.core.model.WorkRecommendation;
import com.workgraph.core.snapshot.GraphSnapshot;

import java.util.List;
import java.util.Objects;

/**
 * Dependency analytics over an immutable {@link GraphSnapshot}.
 * <p>
 * Every operation is a pure function of the snapshot and its arguments: nothing is
 * cached between calls and nothing is written. Instances are thread-safe and may be
 * shared. Each operation has an overload taking a {@link Deadline}; the deadline is
 * checked between per-node computations and expiry surfaces as an
 * {@link com.workgraph.core.error.AnalysisTimeoutException}.
 */
public class DependencyAnalytics {

    static final int OVERVIEW_RECOMMENDATIONS = 3;
    static final int OVERVIEW_BOTTLENECKS = 3;

    private final AnalyticsProperties properties;
    private final BottleneckAnalyzer bottlenecks;
    private final ParallelWorkPlanner planner;
    private final WorkRecommender recommender;
    private final RiskAssessor risks;
    private final ImpactAnalyzer impact;
    private final WorkQueueBuilder queue;

    public DependencyAnalytics(AnalyticsProperties properties) {
        this.properties = Objects.requireNonNull(properties, "properties");
        this.bottlenecks = new BottleneckAnalyzer(properties);
        this.planner = new ParallelWorkPlanner();
        this.recommender = new WorkRecommender(properties, planner);
        this.risks = new RiskAssessor(properties);
        this.impact = new ImpactAnalyzer();
        this.queue = new WorkQueueBuilder(properties, recommender);
    }

    public AnalyticsProperties properties() {
        return properties;
    }

    public List<Bottleneck> findBottlenecks(GraphSnapshot snapshot, int topN, int minImpact) {
        return findBottlenecks(snapshot, topN, minImpact, Deadline.none());
    }

    public List<Bottleneck> findBottlenecks(GraphSnapshot snapshot, int topN, int minImpact, Deadline deadline) {
        return bottlenecks.find(snapshot, topN, minImpact, deadline);
    }

    public ParallelWork getParallelWork(GraphSnapshot snapshot, int maxAgents) {
        return getParallelWork(snapshot, maxAgents, WorkItemStatus.TODO, Deadline.none());
    }

    public ParallelWork getParallelWork(GraphSnapshot snapshot, int maxAgents, WorkItemStatus statusFilter) {
        return getParallelWork(snapshot, maxAgents, statusFilter, Deadline.none());
    }

    public ParallelWork getParallelWork(GraphSnapshot snapshot, int maxAgents, WorkItemStatus statusFilter,
                                        Deadline deadline) {
        return planner.plan(snapshot, maxAgents, Objects.requireNonNull(statusFilter, "statusFilter"), deadline);
    }

    public List<WorkRecommendation> recommendNextWork(GraphSnapshot snapshot, int agentCount) {
        return recommendNextWork(snapshot, agentCount, properties.getDefaults().getLookahead(), Deadline.none());
    }

    public List<WorkRecommendation> recommendNextWork(GraphSnapshot snapshot, int agentCount, int lookahead) {
        return recommendNextWork(snapshot, agentCount, lookahead, Deadline.none());
    }

    public List<WorkRecommendation> recommendNextWork(GraphSnapshot snapshot, int agentCount, int lookahead,
                                                      Deadline deadline) {
        return recommender.recommend(snapshot, agentCount, lookahead, deadline);
    }

    public RiskAssessment assessRisks(GraphSnapshot snapshot) {
        return assessRisks(snapshot, properties.getDefaults().getSpofThreshold(), Deadline.none());
    }

    public RiskAssessment assessRisks(GraphSnapshot snapshot, int spofThreshold) {
        return assessRisks(snapshot, spofThreshold, Deadline.none());
    }

    public RiskAssessment assessRisks(GraphSnapshot snapshot, int spofThreshold, Deadline deadline) {
        return risks.assess(snapshot, spofThreshold, deadline);
    }

    /**
     * @throws com.workgraph.core.error.NotFoundException if {@code nodeId} is not in the snapshot
     */
    public ImpactAnalysis analyzeImpact(GraphSnapshot snapshot, String nodeId) {
        return analyzeImpact(snapshot, nodeId, Deadline.none());
    }

    public ImpactAnalysis analyzeImpact(GraphSnapshot snapshot, String nodeId, Deadline deadline) {
        deadline.check("analyze_impact");
        return impact.analyze(snapshot, nodeId);
    }

    public List<WorkQueueItem> getWorkQueue(GraphSnapshot snapshot, int maxItems, boolean includeBlocked) {
        return getWorkQueue(snapshot, maxItems, includeBlocked, Deadline.none());
    }

    public List<WorkQueueItem> getWorkQueue(GraphSnapshot snapshot, int maxItems, boolean includeBlocked,
                                            Deadline deadline) {
        return queue.build(snapshot, maxItems, includeBlocked, deadline);
    }

    public StrategicOverview strategicOverview(GraphSnapshot snapshot) {
        return strategicOverview(snapshot, Deadline.none());
    }

    public StrategicOverview strategicOverview(GraphSnapshot snapshot, Deadline deadline) {
        var recommendations = recommender.recommend(snapshot, OVERVIEW_RECOMMENDATIONS, 0, deadline);
        var top = bottlenecks.find(snapshot, OVERVIEW_BOTTLENECKS, properties.getDefaults().getMinImpact(), deadline);
        var parallel = planner.plan(snapshot, properties.getDefaults().getMaxAgents(), WorkItemStatus.TODO, deadline);
        return new StrategicOverview(recommendations, top, parallel, snapshot.version());
    }
}
