package org.nexus.nexusmonitor.service.dashboard;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.nexus.nexusmonitor.config.MonitoringProps;
import org.nexus.nexusmonitor.domain.MetricPoint;
import org.nexus.nexusmonitor.domain.Severity;
import org.nexus.nexusmonitor.domain.dashboard.*;
import org.nexus.nexusmonitor.service.MetricsCollector;
import org.nexus.nexusmonitor.service.SystemMonitor;
import org.nexus.nexusmonitor.service.alerts.AlertEngine;
import org.nexus.nexusmonitor.service.patient.PatientMonitor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.*;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Builds the dashboard snapshot on its own timer and keeps the widget registry.
 * Readers always see a complete snapshot: the reference is swapped, never patched.
 */
@Slf4j
@Service
public class DashboardManager {
    static final List<LayoutCell> DEFAULT_LAYOUT = List.of(
            new LayoutCell("system-metrics", 0, 0, 6, 4),
            new LayoutCell("patient-overview", 6, 0, 6, 2),
            new LayoutCell("service-status", 6, 2, 6, 2),
            new LayoutCell("alerts-summary", 0, 4, 12, 3),
            new LayoutCell("recent-vitals", 0, 7, 8, 4),
            new LayoutCell("performance-metrics", 8, 7, 4, 4)
    );

    private final MetricsCollector metrics;
    private final PatientMonitor patients;
    private final SystemMonitor system;
    private final AlertEngine alerts;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Duration interval;
    private final String theme;
    private final String timezone;

    private final Map<String, DashboardWidget> widgets = new LinkedHashMap<>();
    private volatile DashboardData snapshot;

    private ScheduledExecutorService scheduler;
    private volatile boolean running;

    public DashboardManager(MetricsCollector metrics, PatientMonitor patients, SystemMonitor system,
                            AlertEngine alerts, MonitoringProps props, ObjectMapper objectMapper, Clock clock) {
        this.metrics = metrics;
        this.patients = patients;
        this.system = system;
        this.alerts = alerts;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.interval = props.intervals() == null || props.intervals().metrics() == null
                ? Duration.ofSeconds(15) : props.intervals().metrics();
        this.theme = props.dashboard() == null || props.dashboard().theme() == null ? "light" : props.dashboard().theme();
        this.timezone = props.dashboard() == null || props.dashboard().timezone() == null
                ? "America/Sao_Paulo" : props.dashboard().timezone();
        initializeDefaultWidgets();
    }

    public synchronized void start() {
        if (running) {
            log.warn("[Dashboard] already running");
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "dashboard-refresh");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleAtFixedRate(this::refresh, 0, interval.toMillis(), TimeUnit.MILLISECONDS);
        running = true;
        log.info("[Dashboard] started, refresh every {} ms", interval.toMillis());
    }

    public synchronized void stop() {
        if (!running) return;
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        scheduler = null;
        running = false;
        log.info("[Dashboard] stopped");
    }

    public boolean isRunning() { return running; }

    /** Rebuilds the snapshot and copies its slices into the live widgets. */
    public void refresh() {
        try {
            var data = buildSnapshot();
            snapshot = data;
            updateWidgets(data);
            log.debug("[Dashboard] data updated at {}", data.timestamp());
        } catch (Exception e) {
            log.error("[Dashboard] failed to update dashboard data", e);
        }
    }

    DashboardData buildSnapshot() {
        var now = clock.instant();

        var sys = new DashboardData.SystemSummary(
                latest("system_cpu_usage_percent"),
                latest("system_memory_usage_percent"),
                latest("system_disk_usage_percent"),
                latest("system_uptime_seconds"));

        var pm = patients.getPatientMetrics();
        var pat = new DashboardData.PatientSummary(pm.totalPatients(), pm.activePatients(),
                pm.criticalPatients(), pm.recentAlerts());

        Map<String, DashboardData.ServiceSummary> services = new LinkedHashMap<>();
        for (var s : system.getServicesStatus()) {
            services.put(s.name(), new DashboardData.ServiceSummary(s.state(), s.responseTimeMs()));
        }

        var stats = alerts.getAlertStats();
        var alertSummary = new DashboardData.AlertSummary(stats.total(), stats.active(), stats.bySeverity());

        return new DashboardData(now, sys, pat, services, alertSummary);
    }

    private double latest(String name) {
        return metrics.getLatestMetric(name).map(MetricPoint::value).orElse(0.0);
    }

    private void updateWidgets(DashboardData d) {
        var sys = d.systemMetrics();
        replaceData("system-metrics", new WidgetData.Chart(
                Map.of("cpu", sys.cpu(), "memory", sys.memory(), "disk", sys.disk()), d.timestamp()));

        var p = d.patientMetrics();
        replaceData("patient-overview", new WidgetData.MetricCards(Map.of(
                "total", p.totalPatients(),
                "active", p.activePatients(),
                "critical", p.criticalPatients(),
                "recentAlerts", p.recentAlerts())));

        replaceData("service-status", new WidgetData.StatusMap(d.serviceStatus()));
        replaceData("alerts-summary", new WidgetData.AlertCounts(d.alerts().active(), d.alerts().bySeverity()));
    }

    private void replaceData(String id, WidgetData data) {
        synchronized (widgets) {
            var w = widgets.get(id);
            if (w != null && w.type() == data.widgetType()) {
                widgets.put(id, w.withData(data));
            }
        }
    }

    /** Empty until the first refresh has completed. */
    public Optional<DashboardData> getDashboardData() {
        return Optional.ofNullable(snapshot);
    }

    public Optional<DashboardWidget> getWidget(String id) {
        synchronized (widgets) {
            return Optional.ofNullable(widgets.get(id));
        }
    }

    public List<DashboardWidget> getAllWidgets() {
        synchronized (widgets) {
            return List.copyOf(widgets.values());
        }
    }

    public void addWidget(DashboardWidget widget) {
        synchronized (widgets) {
            widgets.put(widget.id(), widget);
        }
        log.info("[Dashboard] widget added: {} ({})", widget.title(), widget.id());
    }

    public boolean removeWidget(String id) {
        boolean removed;
        synchronized (widgets) {
            removed = widgets.remove(id) != null;
        }
        if (removed) log.info("[Dashboard] widget removed: {}", id);
        return removed;
    }

    public boolean updateWidget(String id, WidgetUpdate update) {
        synchronized (widgets) {
            var w = widgets.get(id);
            if (w == null) return false;
            widgets.put(id, w.apply(update));
        }
        log.debug("[Dashboard] widget updated: {}", id);
        return true;
    }

    public DashboardConfig getDashboardConfig() {
        return new DashboardConfig(DEFAULT_LAYOUT, getAllWidgets(),
                new DashboardConfig.Settings(interval.toMillis(), theme, timezone));
    }

    public DashboardStats getStats() {
        var s = snapshot;
        return new DashboardStats(getAllWidgets().size(), s == null ? null : s.timestamp(), running);
    }

    /** @throws DashboardUnavailableException before the first refresh */
    public String exportDashboardData(ExportFormat format) {
        var d = snapshot;
        if (d == null) throw new DashboardUnavailableException("No dashboard data available");
        return switch (format) {
            case JSON -> toJson(d);
            case CSV -> toCsv(d);
        };
    }

    private String toJson(DashboardData d) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(d);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize dashboard data", e);
        }
    }

    private static String toCsv(DashboardData d) {
        var ts = d.timestamp().toString();
        var sys = d.systemMetrics();
        var p = d.patientMetrics();
        var a = d.alerts();

        Map<String, Double> rows = new LinkedHashMap<>();
        rows.put("cpu", sys.cpu());
        rows.put("memory", sys.memory());
        rows.put("disk", sys.disk());
        rows.put("uptime", sys.uptime());
        rows.put("total_patients", (double) p.totalPatients());
        rows.put("active_patients", (double) p.activePatients());
        rows.put("critical_patients", (double) p.criticalPatients());
        rows.put("recent_alerts", (double) p.recentAlerts());
        rows.put("alerts_total", (double) a.total());
        for (var s : Severity.values()) {
            rows.put("alerts_" + s.name().toLowerCase(Locale.ROOT), (double) a.count(s));
        }

        var sb = new StringBuilder("timestamp,metric,value");
        rows.forEach((metric, value) -> sb.append('\n').append(ts).append(',').append(metric)
                .append(',').append(MetricsCollector.formatNumber(value)));
        return sb.toString();
    }

    private void initializeDefaultWidgets() {
        addWidget(new DashboardWidget("system-metrics", WidgetType.CHART, "System Resources", null,
                Map.of("chartType", "line", "metrics", List.of("cpu", "memory", "disk"), "timeRange", "1h"),
                interval.toMillis()));
        addWidget(new DashboardWidget("patient-overview", WidgetType.METRIC, "Patient Overview", null,
                Map.of("displayMode", "cards", "metrics", List.of("total", "active", "critical")), null));
        addWidget(new DashboardWidget("service-status", WidgetType.STATUS, "Service Status", null,
                Map.of("showResponseTimes", true, "alertOnFailure", true), null));
        addWidget(new DashboardWidget("alerts-summary", WidgetType.ALERT, "Active Alerts", null,
                Map.of("maxAlerts", 10, "groupBySeverity", true), null));
        addWidget(new DashboardWidget("recent-vitals", WidgetType.TABLE, "Recent Vital Signs", null,
                Map.of("maxRows", 15, "autoRefresh", true), null));
        addWidget(new DashboardWidget("performance-metrics", WidgetType.CHART, "API Performance", null,
                Map.of("chartType", "bar", "metrics", List.of("responseTime", "requestCount", "errorRate"),
                        "timeRange", "24h"), null));
    }
}
