package com.atlas.api.api;

import com.atlas.api.config.AtlasServiceProperties;
import com.atlas.database.DataSourceHealthCheck;
import com.atlas.observability.HealthCheckRegistry;
import com.atlas.observability.HealthReport;
import com.atlas.observability.HealthStatus;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness endpoint for load balancers. Always 200; a failing dependency shows as "degraded".
 */
@RestController
public class HealthController {

    private final HealthCheckRegistry healthChecks;
    private final AtlasServiceProperties service;

    public HealthController(HealthCheckRegistry healthChecks, AtlasServiceProperties service) {
        this.healthChecks = healthChecks;
        this.service = service;
    }

    @GetMapping("/health")
    public Map<String, String> health() {
        HealthReport report = healthChecks.checkAll();
        Map<String, String> body = new LinkedHashMap<>();
        body.put("status", report.isUp() ? "up" : "degraded");
        body.put("database", report.statusOf(DataSourceHealthCheck.COMPONENT) == HealthStatus.OK ? "ok" : "error");
        body.put("service", service.name());
        return body;
    }
}
