package com.workgraph.dispatch.api;

import com.workgraph.core.health.HealthCheckService;
import com.workgraph.core.health.HealthStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST controller for system health status.
 */
@RestController
@RequestMapping("/api/v1/health")
public class HealthController {

    private final HealthCheckService healthCheckService;

    public HealthController(HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    /**
     * GET /api/v1/health. Returns 200 unless a component is DOWN, then 503.
     * A DEGRADED index still answers 200; a rebuild fixes it.
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> result = new LinkedHashMap<>();

        var checks = healthCheckService.checkAll();

        Map<String, Object> components = new LinkedHashMap<>();
        for (var check : checks) {
            Map<String, Object> componentInfo = new LinkedHashMap<>();
            componentInfo.put("status", check.status().name());
            componentInfo.put("detail", check.detail());
            if (!check.metadata().isEmpty()) {
                componentInfo.put("metadata", check.metadata());
            }
            components.put(check.component(), componentInfo);
        }

        HealthStatus.Status overall = HealthStatus.overall(checks);
        result.put("status", overall.name());
        result.put("components", components);

        return overall == HealthStatus.Status.DOWN ? ResponseEntity.status(503).body(result)
                                                   : ResponseEntity.ok(result);
    }
}
