package org.nexus.nexusmonitor.service;

import lombok.extern.slf4j.Slf4j;
import org.nexus.nexusmonitor.config.MonitoringProps;
import org.nexus.nexusmonitor.domain.MetricPoint;
import org.nexus.nexusmonitor.domain.MetricsStats;
import org.nexus.nexusmonitor.domain.SystemMetrics;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Collectors;

/**
 * In-memory time series keyed by metric name. Each series is capped at
 * {@code maxPoints}; the oldest points are evicted first.
 */
@Slf4j
@Service
public class MetricsCollector {
    private static final int DEFAULT_MAX_POINTS = 10_000;

    private static final Map<String, String> HELP = Map.ofEntries(
            Map.entry("system_cpu_usage_percent", "Current CPU usage percentage"),
            Map.entry("system_cpu_cores", "Number of CPU cores"),
            Map.entry("system_load_average_1m", "System load average for 1 minute"),
            Map.entry("system_load_average_5m", "System load average for 5 minutes"),
            Map.entry("system_load_average_15m", "System load average for 15 minutes"),
            Map.entry("system_memory_total_bytes", "Total system memory in bytes"),
            Map.entry("system_memory_free_bytes", "Free system memory in bytes"),
            Map.entry("system_memory_used_bytes", "Used system memory in bytes"),
            Map.entry("system_memory_usage_percent", "Memory usage percentage"),
            Map.entry("system_disk_total_bytes", "Total disk space in bytes"),
            Map.entry("system_disk_free_bytes", "Free disk space in bytes"),
            Map.entry("system_disk_used_bytes", "Used disk space in bytes"),
            Map.entry("system_disk_usage_percent", "Disk usage percentage"),
            Map.entry("system_network_inbound_bytes", "Network inbound bytes"),
            Map.entry("system_network_outbound_bytes", "Network outbound bytes"),
            Map.entry("system_uptime_seconds", "System uptime in seconds")
    );

    private final Map<String, ArrayDeque<MetricPoint>> series = new LinkedHashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final int maxPoints;
    private final Clock clock;

    @Autowired
    public MetricsCollector(MonitoringProps props, Clock clock) {
        this(props.retention() == null || props.retention().maxMetricPoints() <= 0
                ? DEFAULT_MAX_POINTS : props.retention().maxMetricPoints(), clock);
    }

    public MetricsCollector(int maxPoints, Clock clock) {
        this.maxPoints = maxPoints;
        this.clock = clock;
        log.info("[Metrics] collector ready, maxPoints={}", maxPoints);
    }

    public void recordSystemMetrics(SystemMetrics m) {
        var ts = m.timestamp();
        recordMetric("system_cpu_usage_percent", m.cpu().usage(), ts, null);
        recordMetric("system_cpu_cores", m.cpu().cores(), ts, null);
        double[] load = m.cpu().loadAverage();
        recordMetric("system_load_average_1m", load.length > 0 ? load[0] : 0, ts, null);
        recordMetric("system_load_average_5m", load.length > 1 ? load[1] : 0, ts, null);
        recordMetric("system_load_average_15m", load.length > 2 ? load[2] : 0, ts, null);

        recordMetric("system_memory_total_bytes", m.memory().total(), ts, null);
        recordMetric("system_memory_free_bytes", m.memory().free(), ts, null);
        recordMetric("system_memory_used_bytes", m.memory().used(), ts, null);
        recordMetric("system_memory_usage_percent", m.memory().usagePercent(), ts, null);

        recordMetric("system_disk_total_bytes", m.disk().total(), ts, null);
        recordMetric("system_disk_free_bytes", m.disk().free(), ts, null);
        recordMetric("system_disk_used_bytes", m.disk().used(), ts, null);
        recordMetric("system_disk_usage_percent", m.disk().usagePercent(), ts, null);

        recordMetric("system_network_inbound_bytes", m.network().inbound(), ts, null);
        recordMetric("system_network_outbound_bytes", m.network().outbound(), ts, null);

        recordMetric("system_uptime_seconds", m.uptime(), ts, null);
        log.debug("[Metrics] system snapshot recorded at {}", ts);
    }

    public void recordMetric(String name, double value) {
        recordMetric(name, value, null, null);
    }

    public void recordMetric(String name, double value, Instant timestamp, Map<String, String> labels) {
        var point = new MetricPoint(timestamp == null ? clock.instant() : timestamp, name, value, labels);
        lock.writeLock().lock();
        try {
            append(point);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void recordCounter(String name) {
        recordCounter(name, 1, null);
    }

    /**
     * Adds {@code increment} to the latest value recorded under {@code name}, whatever its
     * labels, and stores the running total as a new point carrying {@code labels}.
     */
    public void recordCounter(String name, double increment, Map<String, String> labels) {
        lock.writeLock().lock();
        try {
            var s = series.get(name);
            double latest = s == null || s.isEmpty() ? 0 : s.peekLast().value();
            append(new MetricPoint(clock.instant(), name, latest + increment, labels));
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void recordGauge(String name, double value, Map<String, String> labels) {
        recordMetric(name, value, clock.instant(), labels);
    }

    /** Cumulative histogram: {@code _sum}, {@code _count} and one {@code _bucket} per boundary >= value. */
    public void recordHistogram(String name, double value, double[] buckets, Map<String, String> labels) {
        recordMetric(name + "_sum", value, clock.instant(), labels);
        recordCounter(name + "_count", 1, labels);
        for (double bucket : buckets) {
            if (value <= bucket) {
                Map<String, String> withLe = new LinkedHashMap<>();
                if (labels != null) withLe.putAll(labels);
                withLe.put("le", formatNumber(bucket));
                recordCounter(name + "_bucket", 1, withLe);
            }
        }
    }

    public List<MetricPoint> getMetrics(String name) {
        return getMetrics(name, null);
    }

    /** Most recent {@code limit} points in chronological order; all points when limit is null. */
    public List<MetricPoint> getMetrics(String name, Integer limit) {
        lock.readLock().lock();
        try {
            var s = series.get(name);
            if (s == null) return List.of();
            var all = new ArrayList<>(s);
            if (limit != null && limit > 0 && limit < all.size()) {
                return List.copyOf(all.subList(all.size() - limit, all.size()));
            }
            return all;
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<MetricPoint> getLatestMetric(String name) {
        lock.readLock().lock();
        try {
            var s = series.get(name);
            return (s == null || s.isEmpty()) ? Optional.empty() : Optional.of(s.peekLast());
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Points with start <= timestamp <= end. */
    public List<MetricPoint> getMetricsByTimeRange(String name, Instant start, Instant end) {
        lock.readLock().lock();
        try {
            var s = series.get(name);
            if (s == null) return List.of();
            return s.stream()
                    .filter(p -> !p.timestamp().isBefore(start) && !p.timestamp().isAfter(end))
                    .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<String> getAllMetricNames() {
        lock.readLock().lock();
        try {
            return List.copyOf(series.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }

    public MetricsStats getMetricsStats() {
        lock.readLock().lock();
        try {
            int points = 0;
            Instant oldest = null, newest = null;
            for (var s : series.values()) {
                points += s.size();
                if (s.isEmpty()) continue;
                var first = s.peekFirst().timestamp();
                var last = s.peekLast().timestamp();
                if (oldest == null || first.isBefore(oldest)) oldest = first;
                if (newest == null || last.isAfter(newest)) newest = last;
            }
            return new MetricsStats(series.size(), points, List.copyOf(series.keySet()), oldest, newest);
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Prometheus text exposition: one family per series, valued by its latest point. */
    public String getPrometheusMetrics() {
        List<String> lines = new ArrayList<>();
        lock.readLock().lock();
        try {
            for (var e : series.entrySet()) {
                var s = e.getValue();
                if (s.isEmpty()) continue;
                String name = e.getKey();
                lines.add("# HELP " + name + " " + HELP.getOrDefault(name, "Metric: " + name));
                lines.add("# TYPE " + name + " " + metricType(name));
                var p = s.peekLast();
                lines.add(name + formatLabels(p.labels()) + " " + formatNumber(p.value())
                        + " " + p.timestamp().toEpochMilli());
                lines.add("");
            }
        } finally {
            lock.readLock().unlock();
        }
        return String.join("\n", lines);
    }

    public void clearMetrics() {
        lock.writeLock().lock();
        try {
            series.clear();
        } finally {
            lock.writeLock().unlock();
        }
        log.info("[Metrics] all metrics cleared");
    }

    /** Drops every point with timestamp <= olderThan. */
    public int clearOldMetrics(Instant olderThan) {
        int removed = 0;
        lock.writeLock().lock();
        try {
            for (var s : series.values()) {
                int before = s.size();
                s.removeIf(p -> !p.timestamp().isAfter(olderThan));
                removed += before - s.size();
            }
        } finally {
            lock.writeLock().unlock();
        }
        if (removed > 0) log.info("[Metrics] cleared {} old data points", removed);
        return removed;
    }

    private void append(MetricPoint point) {
        var s = series.computeIfAbsent(point.name(), k -> new ArrayDeque<>());
        s.addLast(point);
        while (s.size() > maxPoints) {
            s.removeFirst();
        }
    }

    static String metricType(String name) {
        if (name.endsWith("_count") || name.endsWith("_total")) return "counter";
        if (name.endsWith("_bucket")) return "histogram";
        return "gauge";
    }

    private static String formatLabels(Map<String, String> labels) {
        if (labels.isEmpty()) return "";
        return new TreeMap<>(labels).entrySet().stream()
                .map(l -> l.getKey() + "=\"" + l.getValue() + "\"")
                .collect(Collectors.joining(",", "{", "}"));
    }

    public static String formatNumber(double v) {
        if (Double.isNaN(v)) return "NaN";
        if (Double.isInfinite(v)) return v > 0 ? "+Inf" : "-Inf";
        if (v == 0) return "0";
        return BigDecimal.valueOf(v).stripTrailingZeros().toPlainString();
    }
}
