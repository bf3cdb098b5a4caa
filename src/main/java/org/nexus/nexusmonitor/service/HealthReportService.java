package org.nexus.nexusmonitor.service;

import lombok.extern.slf4j.Slf4j;
import org.nexus.nexusmonitor.service.alerts.AlertEngine;
import org.nexus.nexusmonitor.service.dashboard.DashboardManager;
import org.nexus.nexusmonitor.service.patient.PatientMonitor;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.lang.management.ManagementFactory;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregates component state for the detailed health and readiness probes.
 * The database is optional: without a {@link DatabaseService} bean it is
 * reported as unavailable and the service as degraded.
 */
@Slf4j
@Service
public class HealthReportService {
    private final AlertEngine alertEngine;
    private final SystemMonitor systemMonitor;
    private final PatientMonitor patientMonitor;
    private final DashboardManager dashboardManager;
    private final MetricsCollector metricsCollector;
    private final ObjectProvider<DatabaseService> database;
    private final Clock clock;
    private final String version;

    public HealthReportService(AlertEngine alertEngine, SystemMonitor systemMonitor, PatientMonitor patientMonitor,
                               DashboardManager dashboardManager, MetricsCollector metricsCollector,
                               ObjectProvider<DatabaseService> database, Clock clock,
                               @Value("${app.version:1.0.0}") String version) {
        this.alertEngine = alertEngine;
        this.systemMonitor = systemMonitor;
        this.patientMonitor = patientMonitor;
        this.dashboardManager = dashboardManager;
        this.metricsCollector = metricsCollector;
        this.database = database;
        this.clock = clock;
        this.version = version;
    }

    public record ComponentHealth(String status, Map<String, Object> details) {}

    public record DetailedHealth(String status, Instant timestamp, double uptime, String version,
                                 Map<String, ComponentHealth> services, Map<String, Object> performance) {}

    public record Readiness(boolean ready, List<String> notReady) {}

    public DetailedHealth detailed() {
        Map<String, ComponentHealth> services = new LinkedHashMap<>();
        var db = databaseHealth();
        services.put("database", db);
        services.put("alertEngine", new ComponentHealth(state(alertEngine.isRunning()),
                Map.of("activeAlerts", alertEngine.getActiveAlerts().size())));
        services.put("systemMonitor", new ComponentHealth(state(systemMonitor.isRunning()), Map.of()));
        services.put("patientMonitor", new ComponentHealth(state(patientMonitor.isRunning()), Map.of()));
        services.put("dashboardManager", new ComponentHealth(state(dashboardManager.isRunning()), Map.of()));
        var stats = metricsCollector.getMetricsStats();
        services.put("metricsCollector", new ComponentHealth("available",
                Map.of("totalMetrics", stats.totalMetrics(), "totalDataPoints", stats.totalDataPoints())));

        boolean degraded = !"connected".equals(db.status())
                || services.values().stream().anyMatch(c -> "stopped".equals(c.status()));

        return new DetailedHealth(degraded ? "degraded" : "healthy", clock.instant(), jvmUptimeSeconds(),
                version, services, performance());
    }

    public Readiness readiness() {
        List<String> notReady = new ArrayList<>();
        if (!alertEngine.isRunning()) notReady.add("alertEngine");
        if (!systemMonitor.isRunning()) notReady.add("systemMonitor");
        if (!patientMonitor.isRunning()) notReady.add("patientMonitor");
        if (!dashboardManager.isRunning()) notReady.add("dashboardManager");
        return new Readiness(notReady.isEmpty(), List.copyOf(notReady));
    }

    private ComponentHealth databaseHealth() {
        var db = database.getIfAvailable();
        if (db == null) return new ComponentHealth("unavailable", Map.of());
        try {
            boolean ok = db.testConnection();
            Map<String, Object> info = ok ? db.getConnectionInfo() : Map.of();
            return new ComponentHealth(ok ? "connected" : "disconnected", info == null ? Map.of() : info);
        } catch (Exception e) {
            log.warn("[Health] database check failed: {}", e.getMessage());
            return new ComponentHealth("error", Map.of("error", String.valueOf(e.getMessage())));
        }
    }

    private Map<String, Object> performance() {
        var rt = Runtime.getRuntime();
        long usedHeap = rt.totalMemory() - rt.freeMemory();
        Map<String, Object> perf = new LinkedHashMap<>();
        perf.put("memory_usage", (usedHeap / (1024 * 1024)) + "MB");
        perf.put("cpu_usage", systemMonitor.getLastMetrics().map(m -> m.cpu().usage()).orElse(0.0));
        perf.put("threads", ManagementFactory.getThreadMXBean().getThreadCount());
        return perf;
    }

    private static String state(boolean running) {
        return running ? "running" : "stopped";
    }

    private static double jvmUptimeSeconds() {
        return ManagementFactory.getRuntimeMXBean().getUptime() / 1000.0;
    }
}
