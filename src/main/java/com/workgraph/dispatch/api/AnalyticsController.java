package com.workgraph.dispatch.api;

import com.workgraph.core.analytics.AnalyticsService;
import com.workgraph.core.model.Bottleneck;
import com.workgraph.core.model.ImpactAnalysis;
import com.workgraph.core.model.ParallelWork;
import com.workgraph.core.model.RiskAssessment;
import com.workgraph.core.model.StrategicOverview;
import com.workgraph.core.model.WorkItemStatus;
import com.workgraph.core.model.WorkQueueItem;
import com.workgraph.core.model.WorkRecommendation;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Read-only REST API over the dependency analytics. Every request is answered from a
 * single index snapshot; omitted parameters take the configured defaults.
 * Every endpoint accepts {@code timeout_ms}; a request that runs past it answers 503.
 */
@RestController
@RequestMapping("/api/v1/analytics")
public class AnalyticsController {

    private final AnalyticsService analyticsService;

    public AnalyticsController(AnalyticsService analyticsService) {
        this.analyticsService = analyticsService;
    }

    @GetMapping("/bottlenecks")
    public List<Bottleneck> bottlenecks(@RequestParam(name = "top_n", required = false) Integer topN,
                                        @RequestParam(name = "min_impact", required = false) Integer minImpact,
                                        @RequestParam(name = "timeout_ms", required = false) Long timeoutMs) {
        return analyticsService.bottlenecks(topN, minImpact, timeoutMs);
    }

    @GetMapping("/parallel")
    public ParallelWork parallel(@RequestParam(name = "max_agents", required = false) Integer maxAgents,
                                 @RequestParam(name = "status", required = false) String status,
                                 @RequestParam(name = "timeout_ms", required = false) Long timeoutMs) {
        WorkItemStatus filter = status != null ? WorkItemStatus.fromValue(status) : null;
        return analyticsService.parallelWork(maxAgents, filter, timeoutMs);
    }

    @GetMapping("/recommendations")
    public List<WorkRecommendation> recommendations(
            @RequestParam(name = "agent_count", required = false) Integer agentCount,
            @RequestParam(name = "lookahead", required = false) Integer lookahead,
            @RequestParam(name = "timeout_ms", required = false) Long timeoutMs) {
        return analyticsService.recommend(agentCount, lookahead, timeoutMs);
    }

    @GetMapping("/risks")
    public RiskAssessment risks(@RequestParam(name = "spof_threshold", required = false) Integer spofThreshold,
                                @RequestParam(name = "timeout_ms", required = false) Long timeoutMs) {
        return analyticsService.risks(spofThreshold, timeoutMs);
    }

    /**
     * GET /api/v1/analytics/impact/{id}. Unknown ids answer 404.
     */
    @GetMapping("/impact/{id}")
    public ImpactAnalysis impact(@PathVariable("id") String id,
                                 @RequestParam(name = "timeout_ms", required = false) Long timeoutMs) {
        return analyticsService.impact(id, timeoutMs);
    }

    @GetMapping("/queue")
    public List<WorkQueueItem> queue(@RequestParam(name = "max_items", required = false) Integer maxItems,
                                     @RequestParam(name = "include_blocked", defaultValue = "false") boolean includeBlocked,
                                     @RequestParam(name = "timeout_ms", required = false) Long timeoutMs) {
        return analyticsService.queue(maxItems, includeBlocked, timeoutMs);
    }

    @GetMapping("/overview")
    public StrategicOverview overview(@RequestParam(name = "timeout_ms", required = false) Long timeoutMs) {
        return analyticsService.overview(timeoutMs);
    }
}
