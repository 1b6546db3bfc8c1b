package com.sandcastle.dispatch.api;

import com.sandcastle.core.health.HealthCheckService;
import com.sandcastle.core.health.HealthStatus;
import com.sandcastle.session.SessionRegistry;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller for system health status.
 */
@RestController
@RequestMapping("/api/v1/health")
public class HealthController {

    private final HealthCheckService healthCheckService;
    private final SessionRegistry sessionRegistry;

    public HealthController(@Autowired(required = false) HealthCheckService healthCheckService,
                            @Autowired(required = false) SessionRegistry sessionRegistry) {
        this.healthCheckService = healthCheckService;
        this.sessionRegistry = sessionRegistry;
    }

    /**
     * GET /api/v1/health: 200 unless a component is DOWN, then 503.
     * DEGRADED components are reported but keep the service UP.
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> result = new LinkedHashMap<>();

        if (healthCheckService == null) {
            result.put("status", "DOWN");
            result.put("components", Map.of());
            return ResponseEntity.status(503).body(result);
        }

        List<HealthStatus> checks = healthCheckService.checkAll();
        Map<String, Object> components = new LinkedHashMap<>();
        for (var check : checks) {
            Map<String, String> componentInfo = new LinkedHashMap<>();
            componentInfo.put("status", check.status().name());
            componentInfo.put("detail", check.detail());
            components.put(check.component(), componentInfo);
        }
        boolean anyDown = HealthStatus.overall(checks) == HealthStatus.Status.DOWN;

        result.put("status", anyDown ? "DOWN" : "UP");
        result.put("components", components);
        if (sessionRegistry != null) {
            result.put("active_sessions", sessionRegistry.activeCount());
        }

        return anyDown ? ResponseEntity.status(503).body(result)
                       : ResponseEntity.ok(result);
    }
}
