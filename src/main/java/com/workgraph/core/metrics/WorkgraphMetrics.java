package com.workgraph.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for the index and the analytics engine.
 */
@Service
public class WorkgraphMetrics {

    private final MeterRegistry registry;

    public WorkgraphMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordIndexApply(String changeType, boolean success) {
        Counter.builder("workgraph.index.applies")
                .description("Store mutations applied to the index")
                .tag("change", changeType)
                .tag("result", success ? "applied" : "rolled_back")
                .register(registry)
                .increment();
    }

    public void recordRebuild(String trigger, long ms) {
        Counter.builder("workgraph.index.rebuilds")
                .tag("trigger", trigger)
                .register(registry)
                .increment();
        Timer.builder("workgraph.index.rebuild.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordGraphSize(int nodes, int edges) {
        DistributionSummary.builder("workgraph.index.nodes")
                .register(registry)
                .record(nodes);
        DistributionSummary.builder("workgraph.index.edges")
                .register(registry)
                .record(edges);
    }

    /**
     * Records the wall time of one analytics operation.
     *
     * @param operation e.g. "bottlenecks", "parallel", "impact"
     */
    public void recordAnalytics(String operation, long ms) {
        Timer.builder("workgraph.analytics.duration")
                .description("Analytics operation latency")
                .tag("operation", operation)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }
}
