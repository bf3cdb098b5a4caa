package org.nexus.nexusmonitor.api;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nexus.nexusmonitor.domain.HealthStatus;
import org.nexus.nexusmonitor.service.HealthReportService;
import org.nexus.nexusmonitor.service.MetricsCollector;
import org.nexus.nexusmonitor.service.SystemMonitor;
import org.nexus.nexusmonitor.service.alerts.AlertEngine;
import org.nexus.nexusmonitor.service.dashboard.DashboardManager;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Probe endpoints for orchestrators and scrapers. Not under /api so that
 * no API key is ever required.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class HealthController {
    private static final MediaType PROMETHEUS_TEXT = MediaType.parseMediaType("text/plain;version=0.0.4;charset=utf-8");

    private final SystemMonitor systemMonitor;
    private final HealthReportService healthReport;
    private final MetricsCollector metricsCollector;
    private final AlertEngine alertEngine;
    private final DashboardManager dashboardManager;
    private final Clock clock;

    @GetMapping("/health")
    public ResponseEntity<HealthStatus> health() {
        var status = systemMonitor.getHealthStatus();
        var code = status.status() == HealthStatus.State.HEALTHY ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE;
        return ResponseEntity.status(code).body(status);
    }

    @GetMapping("/health/detailed")
    public ResponseEntity<?> detailed() {
        try {
            return ResponseEntity.ok(healthReport.detailed());
        } catch (Exception e) {
            log.error("[Health] detailed health check failed", e);
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of(
                    "status", "unhealthy",
                    "timestamp", clock.instant(),
                    "error", String.valueOf(e.getMessage())));
        }
    }

    @GetMapping("/health/live")
    public Map<String, Object> live() {
        return Map.of("status", "alive", "timestamp", clock.instant());
    }

    @GetMapping("/health/ready")
    public ResponseEntity<Map<String, Object>> ready() {
        var r = healthReport.readiness();
        if (r.ready()) {
            return ResponseEntity.ok(Map.of("status", "ready", "services_ready", true));
        }
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of(
                "status", "not ready",
                "services_ready", false,
                "error", "Components not running: " + String.join(", ", r.notReady())));
    }

    @GetMapping({"/health/metrics", "/metrics"})
    public ResponseEntity<String> prometheus() {
        String body;
        try {
            body = metricsCollector.getPrometheusMetrics();
        } catch (Exception e) {
            log.error("[Health] metrics export failed", e);
            body = "# Metrics collection unavailable\n";
        }
        return ResponseEntity.ok().contentType(PROMETHEUS_TEXT).body(body);
    }

    @GetMapping("/status")
    public Map<String, Object> status() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("service", "nexus-monitor");
        out.put("timestamp", clock.instant());
        out.put("health", systemMonitor.getLastMetrics().isPresent() ? "collecting" : "starting");
        out.put("alerts", alertEngine.getAlertStats());
        out.put("dashboard", dashboardManager.getStats());
        out.put("metrics", metricsCollector.getMetricsStats());
        return out;
    }
}
