package org.nexus.nexusmonitor.service.alerts;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import org.nexus.nexusmonitor.config.MonitoringProps;
import org.nexus.nexusmonitor.domain.*;
import org.nexus.nexusmonitor.service.NotificationService;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Central alert registry: rule catalog, cooldown suppression, resolution,
 * severity-based notification and the retention sweep.
 */
@Slf4j
@Service
public class AlertEngine {
    private static final Duration DEFAULT_CLEANUP_INTERVAL = Duration.ofHours(1);
    private static final int DEFAULT_RETENTION_DAYS = 90;

    private final NotificationService notifications;
    private final MonitoringProps props;
    private final Clock clock;
    private final Executor notificationExecutor;
    private final ObjectMapper json = new ObjectMapper().findAndRegisterModules()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private final Map<String, Alert> alerts = new ConcurrentHashMap<>();
    private final Map<String, AlertRule> rules = Collections.synchronizedMap(new LinkedHashMap<>());
    private final Map<String, Instant> lastAlertTimes = new HashMap<>();
    private final Object throttleLock = new Object();

    private ScheduledExecutorService scheduler;
    private volatile boolean running;

    public AlertEngine(NotificationService notifications, MonitoringProps props, Clock clock,
                       @Qualifier("alertNotificationExecutor") Executor notificationExecutor) {
        this.notifications = notifications;
        this.props = props;
        this.clock = clock;
        this.notificationExecutor = notificationExecutor;
        initializeDefaultRules();
    }

    public synchronized void start() {
        if (running) {
            log.warn("[Alerts] engine is already running");
            return;
        }
        long every = (props.intervals() == null || props.intervals().alertCleanup() == null
                ? DEFAULT_CLEANUP_INTERVAL : props.intervals().alertCleanup()).toMillis();
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "alert-retention");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleAtFixedRate(this::safeCleanup, every, every, TimeUnit.MILLISECONDS);
        running = true;
        log.info("[Alerts] engine started, retention sweep every {} ms", every);
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
        log.info("[Alerts] engine stopped");
    }

    public boolean isRunning() { return running; }

    /**
     * Stores a new alert and dispatches notifications, unless a rule matching
     * (type, severity) declares a cooldown that has not elapsed for the key
     * type|severity|source. Suppressed alerts return an empty id.
     */
    public String sendAlert(AlertType type, Severity severity, String message, String source,
                            Map<String, Object> data) {
        var throttleKey = type + "|" + severity + "|" + source;
        var rule = findRule(type, severity);
        Alert alert;
        synchronized (throttleLock) {
            var now = clock.instant();
            var last = lastAlertTimes.get(throttleKey);
            if (rule.isPresent() && rule.get().getCooldownMs() != null && last != null
                    && Duration.between(last, now).toMillis() < rule.get().getCooldownMs()) {
                log.debug("[Alerts] throttled by cooldown ({}): {}", rule.get().getId(), message);
                return "";
            }
            alert = Alert.builder()
                    .id(UUID.randomUUID().toString())
                    .type(type)
                    .severity(severity)
                    .message(message)
                    .source(source)
                    .data(data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data)))
                    .timestamp(now)
                    .resolved(false)
                    .build();
            alerts.put(alert.getId(), alert);
            lastAlertTimes.put(throttleKey, now);
        }
        log.warn("[Alerts] [{}] {} id={} type={} source={}", severity, message, alert.getId(), type, source);

        var snapshot = alert.toBuilder().build();
        notificationExecutor.execute(() -> sendNotifications(snapshot));
        return alert.getId();
    }

    /** false when the alert is unknown or already resolved. */
    public boolean resolveAlert(String alertId, String resolvedBy) {
        var alert = alerts.get(alertId);
        if (alert == null) {
            log.warn("[Alerts] attempted to resolve unknown alert {}", alertId);
            return false;
        }
        synchronized (alert) {
            if (alert.isResolved()) {
                log.warn("[Alerts] alert already resolved {}", alertId);
                return false;
            }
            alert.setResolvedAt(clock.instant());
            alert.setResolvedBy(resolvedBy);
            alert.setResolved(true);
        }
        log.info("[Alerts] resolved {} by {}: {}", alertId, resolvedBy, alert.getMessage());
        return true;
    }

    public Optional<Alert> getAlert(String alertId) {
        return Optional.ofNullable(alerts.get(alertId)).map(this::copy);
    }

    /** Newest first, after applying every non-null filter. */
    public List<Alert> getAlerts(AlertFilter f) {
        var filter = f == null ? AlertFilter.none() : f;
        var stream = alerts.values().stream()
                .map(this::copy)
                .filter(a -> filter.type() == null || a.getType() == filter.type())
                .filter(a -> filter.severity() == null || a.getSeverity() == filter.severity())
                .filter(a -> filter.resolved() == null || a.isResolved() == filter.resolved())
                .filter(a -> filter.since() == null || !a.getTimestamp().isBefore(filter.since()))
                .sorted(Comparator.comparing(Alert::getTimestamp).reversed());
        if (filter.limit() != null && filter.limit() > 0) {
            stream = stream.limit(filter.limit());
        }
        return stream.toList();
    }

    public List<Alert> getAlerts() { return getAlerts(AlertFilter.none()); }

    public List<Alert> getActiveAlerts() {
        return getAlerts(new AlertFilter(null, null, false, null, null));
    }

    public List<Alert> getCriticalAlerts() {
        return getAlerts(new AlertFilter(null, Severity.CRITICAL, false, null, null));
    }

    public AlertStats getAlertStats() {
        Map<Severity, Integer> bySeverity = new EnumMap<>(Severity.class);
        for (var s : Severity.values()) bySeverity.put(s, 0);
        Map<AlertType, Integer> byType = new EnumMap<>(AlertType.class);
        for (var t : AlertType.values()) byType.put(t, 0);
        int total = 0, resolved = 0;
        for (var a : alerts.values()) {
            total++;
            if (a.isResolved()) resolved++;
            bySeverity.merge(a.getSeverity(), 1, Integer::sum);
            byType.merge(a.getType(), 1, Integer::sum);
        }
        return new AlertStats(total, total - resolved, resolved, bySeverity, byType);
    }

    public void addRule(AlertRule rule) {
        rules.put(rule.getId(), rule);
        log.info("[Alerts] rule added: {} ({})", rule.getName(), rule.getId());
    }

    public boolean removeRule(String ruleId) {
        boolean removed = rules.remove(ruleId) != null;
        if (removed) log.info("[Alerts] rule removed: {}", ruleId);
        return removed;
    }

    public List<AlertRule> getRules() {
        synchronized (rules) {
            return List.copyOf(rules.values());
        }
    }

    /** Removes resolved alerts older than the retention window. Unresolved alerts are kept. */
    public int cleanupOldAlerts() {
        int days = props.retention() == null || props.retention().alertsDays() <= 0
                ? DEFAULT_RETENTION_DAYS : props.retention().alertsDays();
        var cutoff = clock.instant().minus(Duration.ofDays(days));
        int before = alerts.size();
        alerts.values().removeIf(a -> a.isResolved() && a.getTimestamp().isBefore(cutoff));
        int removed = before - alerts.size();
        if (removed > 0) log.info("[Alerts] cleaned up {} old resolved alerts", removed);
        return removed;
    }

    private void safeCleanup() {
        try {
            cleanupOldAlerts();
        } catch (Exception e) {
            log.error("[Alerts] retention sweep failed", e);
        }
    }

    private Optional<AlertRule> findRule(AlertType type, Severity severity) {
        synchronized (rules) {
            return rules.values().stream()
                    .filter(r -> r.getType() == type && r.getSeverity() == severity)
                    .findFirst();
        }
    }

    private void sendNotifications(Alert alert) {
        var channels = props.alerts() == null ? List.<String>of() : props.alerts().channelsFor(alert.getSeverity());
        for (var channel : channels) {
            try {
                switch (channel) {
                    case "email" -> {
                        if (props.email() != null && props.email().enabled()) {
                            notifications.sendEmail(props.email().to(),
                                    "[%s] Nexus Saude Alert".formatted(alert.getSeverity()),
                                    formatForEmail(alert));
                        }
                    }
                    case "websocket" -> notifications.sendWebSocketMessage("alert", alert);
                    default -> log.warn("[Alerts] unknown notification channel: {}", channel);
                }
            } catch (Exception e) {
                log.error("[Alerts] failed to notify via {} for alert {}", channel, alert.getId(), e);
            }
        }
    }

    String formatForEmail(Alert alert) {
        var sb = new StringBuilder()
                .append("Alert Details:\n")
                .append("- ID: ").append(alert.getId()).append('\n')
                .append("- Type: ").append(alert.getType()).append('\n')
                .append("- Severity: ").append(alert.getSeverity()).append('\n')
                .append("- Message: ").append(alert.getMessage()).append('\n')
                .append("- Source: ").append(alert.getSource()).append('\n')
                .append("- Timestamp: ").append(alert.getTimestamp()).append('\n');
        if (alert.getData() != null && !alert.getData().isEmpty()) {
            try {
                sb.append("\nAdditional Data: ").append(json.writeValueAsString(alert.getData())).append('\n');
            } catch (Exception e) {
                sb.append("\nAdditional Data: ").append(alert.getData()).append('\n');
            }
        }
        return sb.append("\nThis alert was generated by the Nexus Saude monitoring system.").toString();
    }

    private Alert copy(Alert a) {
        synchronized (a) {
            return a.toBuilder().build();
        }
    }

    private void initializeDefaultRules() {
        var t = props.thresholds();
        addRule(AlertRule.builder().id("cpu_high").name("High CPU Usage")
                .type(AlertType.SYSTEM).severity(Severity.HIGH).condition("cpu_usage > threshold")
                .threshold(t == null ? null : t.cpu()).enabled(true)
                .cooldownMs(Duration.ofMinutes(5).toMillis()).build());
        addRule(AlertRule.builder().id("memory_high").name("High Memory Usage")
                .type(AlertType.SYSTEM).severity(Severity.HIGH).condition("memory_usage > threshold")
                .threshold(t == null ? null : t.memory()).enabled(true)
                .cooldownMs(Duration.ofMinutes(5).toMillis()).build());
        addRule(AlertRule.builder().id("disk_high").name("High Disk Usage")
                .type(AlertType.SYSTEM).severity(Severity.HIGH).condition("disk_usage > threshold")
                .threshold(t == null ? null : t.disk()).enabled(true)
                .cooldownMs(Duration.ofMinutes(15).toMillis()).build());
        addRule(AlertRule.builder().id("service_down").name("Service Down")
                .type(AlertType.SERVICE).severity(Severity.CRITICAL).condition("service_status != running")
                .enabled(true)
                .cooldownMs(Duration.ofMinutes(2).toMillis()).build());
    }
}
