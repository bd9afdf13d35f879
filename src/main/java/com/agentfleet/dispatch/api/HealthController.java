package com.agentfleet.dispatch.api;

import com.agentfleet.core.health.HealthCheckService;
import com.agentfleet.core.health.HealthStatus;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller for fleet health.
 */
@RestController
@RequestMapping("/api/v1/health")
public class HealthController {

    private final HealthCheckService healthCheckService;

    public HealthController(@Autowired(required = false) HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    /**
     * GET /api/v1/health: 200 when every component is UP or DEGRADED, 503 if any is DOWN.
     * The overall status is the worst component status.
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> result = new LinkedHashMap<>();
        if (healthCheckService == null) {
            result.put("status", HealthStatus.Status.DOWN.name());
            result.put("components", Map.of());
            return ResponseEntity.status(503).body(result);
        }

        List<HealthStatus> checks = healthCheckService.checkAll();
        HealthStatus.Status overall = HealthStatus.Status.UP;
        Map<String, Object> components = new LinkedHashMap<>();
        for (HealthStatus check : checks) {
            Map<String, Object> info = new LinkedHashMap<>();
            info.put("status", check.status().name());
            info.put("detail", check.detail());
            if (!check.metadata().isEmpty()) {
                info.put("metadata", check.metadata());
            }
            components.put(check.component(), info);
            overall = worse(overall, check.status());
        }

        result.put("status", overall.name());
        result.put("components", components);
        return overall == HealthStatus.Status.DOWN
                ? ResponseEntity.status(503).body(result)
                : ResponseEntity.ok(result);
    }

    private static HealthStatus.Status worse(HealthStatus.Status a, HealthStatus.Status b) {
        if (a == HealthStatus.Status.DOWN || b == HealthStatus.Status.DOWN) return HealthStatus.Status.DOWN;
        if (a == HealthStatus.Status.DEGRADED || b == HealthStatus.Status.DEGRADED) return HealthStatus.Status.DEGRADED;
        return HealthStatus.Status.UP;
    }
}
