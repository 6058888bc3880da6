package com.presentos.dispatch.api;

import com.presentos.core.health.HealthCheckService;
import com.presentos.core.health.HealthStatus;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Liveness and collaborator health for the router.
 */
@RestController
public class HealthController {

    private final HealthCheckService healthCheckService;

    public HealthController(@Autowired(required = false) HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    /**
     * GET /: static payload, answered without touching any collaborator.
     */
    @GetMapping("/")
    public Map<String, String> ping() {
        return Map.of("status", "ok");
    }

    /**
     * GET /api/v1/health: collaborator configuration check.
     * 503 when any component is DOWN, 200 otherwise.
     */
    @GetMapping("/api/v1/health")
    public ResponseEntity<Map<String, Object>> health() {
        List<HealthStatus> checks = healthCheckService != null ? healthCheckService.checkAll() : List.of();
        HealthStatus.Status overall = healthCheckService != null ? overall(checks) : HealthStatus.Status.DOWN;

        Map<String, Object> components = new LinkedHashMap<>();
        checks.forEach(check -> components.put(check.component(), describe(check)));

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", overall.name());
        body.put("components", components);
        HttpStatus status = overall == HealthStatus.Status.DOWN ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.OK;
        return ResponseEntity.status(status).body(body);
    }

    private static HealthStatus.Status overall(List<HealthStatus> checks) {
        if (checks.stream().anyMatch(c -> c.status() == HealthStatus.Status.DOWN)) {
            return HealthStatus.Status.DOWN;
        }
        if (checks.stream().anyMatch(c -> c.status() == HealthStatus.Status.DEGRADED)) {
            return HealthStatus.Status.DEGRADED;
        }
        return HealthStatus.Status.UP;
    }

    private static Map<String, Object> describe(HealthStatus check) {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("status", check.status().name());
        info.put("detail", check.detail());
        if (!check.metadata().isEmpty()) {
            info.put("metadata", check.metadata());
        }
        return info;
    }
}
