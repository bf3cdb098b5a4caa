package org.nexus.nexusmonitor.service;

import lombok.extern.slf4j.Slf4j;
import org.nexus.nexusmonitor.config.MonitoringProps;
import org.nexus.nexusmonitor.domain.*;
import org.nexus.nexusmonitor.service.alerts.AlertConfigService;
import org.nexus.nexusmonitor.service.alerts.AlertEngine;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodically samples OS resources, records them as metric series and
 * raises system alerts when a threshold is crossed.
 */
@Slf4j
@Service
public class SystemMonitor {
    static final double CPU_CRITICAL = 95.0;
    static final double MEMORY_CRITICAL = 95.0;
    static final double DISK_CRITICAL = 98.0;
    static final String SOURCE = "system-monitor";

    private final SystemMetricsSampler sampler;
    private final ServiceProbe probe;
    private final MetricsCollector metrics;
    private final AlertEngine alerts;
    private final AlertConfigService thresholds;
    private final MonitoringProps props;
    private final Clock clock;

    private ScheduledExecutorService scheduler;
    private volatile boolean running;
    private volatile SystemMetrics lastMetrics;

    public SystemMonitor(SystemMetricsSampler sampler, ServiceProbe probe, MetricsCollector metrics,
                         AlertEngine alerts, AlertConfigService thresholds, MonitoringProps props, Clock clock) {
        this.sampler = sampler;
        this.probe = probe;
        this.metrics = metrics;
        this.alerts = alerts;
        this.thresholds = thresholds;
        this.props = props;
        this.clock = clock;
    }

    public synchronized void start() {
        if (running) {
            log.warn("[SystemMonitor] already running");
            return;
        }
        long every = interval().toMillis();
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "system-monitor");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleAtFixedRate(this::tick, 0, every, TimeUnit.MILLISECONDS);
        running = true;
        log.info("[SystemMonitor] started, interval={} ms", every);
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
        log.info("[SystemMonitor] stopped");
    }

    public boolean isRunning() { return running; }

    /** sample, record, prune, then evaluate thresholds */
    void tick() {
        try {
            var snapshot = sampler.sample();
            lastMetrics = snapshot;
            metrics.recordSystemMetrics(snapshot);
            metrics.clearOldMetrics(clock.instant().minus(Duration.ofDays(metricsRetentionDays())));
            checkThresholds(snapshot);
            log.debug("[SystemMonitor] tick cpu={}% memory={}% disk={}%",
                    snapshot.cpu().usage(), snapshot.memory().usagePercent(), snapshot.disk().usagePercent());
        } catch (Exception e) {
            log.error("[SystemMonitor] monitoring cycle failed", e);
        }
    }

    /** Fresh reading for on-demand callers; the periodic CPU baseline and last tick snapshot are not touched. */
    public SystemMetrics collectSystemMetrics() {
        return sampler.peek();
    }

    public Optional<SystemMetrics> getLastMetrics() {
        return Optional.ofNullable(lastMetrics);
    }

    void checkThresholds(SystemMetrics m) {
        double cpu = m.cpu().usage();
        if (cpu > thresholds.getCpuPct()) {
            raise(cpu > CPU_CRITICAL, "High CPU usage: %s%%".formatted(oneDecimal(cpu)),
                    Map.of("cpuUsage", cpu, "threshold", thresholds.getCpuPct()));
        }
        double mem = m.memory().usagePercent();
        if (mem > thresholds.getMemoryPct()) {
            raise(mem > MEMORY_CRITICAL, "High memory usage: %s%%".formatted(oneDecimal(mem)),
                    Map.of("memoryUsage", mem, "threshold", thresholds.getMemoryPct()));
        }
        double disk = m.disk().usagePercent();
        if (disk > thresholds.getDiskPct()) {
            raise(disk > DISK_CRITICAL, "High disk usage: %s%%".formatted(oneDecimal(disk)),
                    Map.of("diskUsage", disk, "threshold", thresholds.getDiskPct()));
        }
    }

    private void raise(boolean critical, String message, Map<String, Object> data) {
        alerts.sendAlert(AlertType.SYSTEM, critical ? Severity.CRITICAL : Severity.HIGH, message, SOURCE, data);
    }

    public HealthStatus getHealthStatus() {
        try {
            var m = collectSystemMetrics();
            var checks = new HealthStatus.Checks(
                    m.cpu().usage() < thresholds.getCpuPct(),
                    m.memory().usagePercent() < thresholds.getMemoryPct(),
                    m.disk().usagePercent() < thresholds.getDiskPct(),
                    checkServicesHealth());

            List<String> failed = new ArrayList<>();
            if (!checks.cpu()) failed.add("cpu");
            if (!checks.memory()) failed.add("memory");
            if (!checks.disk()) failed.add("disk");
            if (!checks.services()) failed.add("services");

            if (failed.isEmpty()) {
                return new HealthStatus(HealthStatus.State.HEALTHY, clock.instant(), checks, "All systems operational");
            }
            boolean critical = m.cpu().usage() > CPU_CRITICAL
                    || m.memory().usagePercent() > MEMORY_CRITICAL
                    || m.disk().usagePercent() > DISK_CRITICAL;
            return critical
                    ? new HealthStatus(HealthStatus.State.CRITICAL, clock.instant(), checks,
                        "Critical issues detected: " + String.join(", ", failed))
                    : new HealthStatus(HealthStatus.State.WARNING, clock.instant(), checks,
                        "Warning: Issues detected in " + String.join(", ", failed));
        } catch (Exception e) {
            log.error("[SystemMonitor] error getting health status", e);
            return new HealthStatus(HealthStatus.State.CRITICAL, clock.instant(),
                    new HealthStatus.Checks(false, false, false, false), "Health check failed");
        }
    }

    public SystemStatus getSystemStatus() {
        var m = collectSystemMetrics();
        return new SystemStatus(m.uptime(), m, getServicesStatus());
    }

    public List<ServiceStatus> getServicesStatus() {
        return probe.probeAll();
    }

    private boolean checkServicesHealth() {
        try {
            return getServicesStatus().stream().allMatch(s -> s.state() == ServiceState.RUNNING);
        } catch (Exception e) {
            log.error("[SystemMonitor] error checking services health", e);
            return false;
        }
    }

    private Duration interval() {
        return props.intervals() == null || props.intervals().system() == null
                ? Duration.ofSeconds(30) : props.intervals().system();
    }

    private int metricsRetentionDays() {
        return props.retention() == null || props.retention().metricsDays() <= 0 ? 30 : props.retention().metricsDays();
    }

    private static String oneDecimal(double v) {
        return String.format(Locale.ROOT, "%.1f", v);
    }
}
