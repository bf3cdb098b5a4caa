package org.nexus.nexusmonitor.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.nexus.nexusmonitor.TestProps.MutableClock;
import org.nexus.nexusmonitor.domain.MetricPoint;
import org.nexus.nexusmonitor.domain.SystemMetrics;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MetricsCollectorTest {
    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    private MutableClock clock;
    private MetricsCollector collector;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        collector = new MetricsCollector(5, clock);
    }

    @Test
    void seriesIsCappedAndKeepsMostRecentPoints() {
        for (int i = 0; i < 8; i++) {
            collector.recordMetric("latency", i, T0.plusSeconds(i), null);
        }
        var points = collector.getMetrics("latency");
        assertEquals(5, points.size());
        assertEquals(List.of(3.0, 4.0, 5.0, 6.0, 7.0), points.stream().map(MetricPoint::value).toList());
    }

    @Test
    void limitReturnsNewestInChronologicalOrder() {
        for (int i = 0; i < 4; i++) collector.recordMetric("q", i, T0.plusSeconds(i), null);
        var last2 = collector.getMetrics("q", 2);
        assertEquals(List.of(2.0, 3.0), last2.stream().map(MetricPoint::value).toList());
    }

    @Test
    void unknownMetricDegradesToEmpty() {
        assertTrue(collector.getMetrics("nope").isEmpty());
        assertTrue(collector.getLatestMetric("nope").isEmpty());
        assertTrue(collector.getMetricsByTimeRange("nope", T0, T0.plusSeconds(10)).isEmpty());
    }

    @Test
    void timeRangeIsInclusive() {
        for (int i = 0; i < 5; i++) collector.recordMetric("r", i, T0.plusSeconds(i * 10L), null);
        var hits = collector.getMetricsByTimeRange("r", T0.plusSeconds(10), T0.plusSeconds(30));
        assertEquals(List.of(1.0, 2.0, 3.0), hits.stream().map(MetricPoint::value).toList());
    }

    @Test
    void counterAccumulatesRunningTotal() {
        collector.recordCounter("requests_total");
        collector.recordCounter("requests_total");
        collector.recordCounter("requests_total", 3, null);
        assertEquals(5.0, collector.getLatestMetric("requests_total").orElseThrow().value());
    }

    @Test
    void counterContinuesFromLatestPointWhateverItsLabels() {
        collector.recordCounter("http_total", 1, Map.of("route", "/a"));
        collector.recordCounter("http_total", 1, Map.of("route", "/b"));

        var latest = collector.getLatestMetric("http_total").orElseThrow();
        assertEquals(2.0, latest.value());
        assertEquals(Map.of("route", "/b"), latest.labels());

        var valueLines = collector.getPrometheusMetrics().lines()
                .filter(l -> l.startsWith("http_total")).toList();
        assertEquals(List.of("http_total{route=\"/b\"} 2 " + T0.toEpochMilli()), valueLines);
    }

    @Test
    void histogramRecordsSumCountAndBuckets() {
        double[] buckets = {0.1, 0.5, 1.0};
        collector.recordHistogram("req_seconds", 0.3, buckets, null);
        collector.recordHistogram("req_seconds", 0.05, buckets, null);

        assertEquals(2.0, collector.getLatestMetric("req_seconds_count").orElseThrow().value());
        assertEquals(0.05, collector.getLatestMetric("req_seconds_sum").orElseThrow().value());
        // 0.3 fills two buckets, 0.05 fills three; the bucket series is one running counter
        assertEquals(5, collector.getMetrics("req_seconds_bucket").size());
        assertEquals(5.0, collector.getLatestMetric("req_seconds_bucket").orElseThrow().value());

        var prom = collector.getPrometheusMetrics();
        assertTrue(prom.contains("# TYPE req_seconds_bucket histogram"));
        assertTrue(prom.contains("req_seconds_bucket{le=\"1\"} 5 "));
        assertFalse(prom.contains("req_seconds_bucket{le=\"0.1\"}"));
        assertTrue(prom.contains("# TYPE req_seconds_count counter"));
    }

    @Test
    void prometheusGaugeExposition() {
        collector.recordMetric("system_cpu_usage_percent", 42, T0, null);
        var lines = collector.getPrometheusMetrics().split("\n");
        assertEquals("# HELP system_cpu_usage_percent Current CPU usage percentage", lines[0]);
        assertEquals("# TYPE system_cpu_usage_percent gauge", lines[1]);
        assertEquals("system_cpu_usage_percent 42 " + T0.toEpochMilli(), lines[2]);
    }

    @Test
    void prometheusUsesLatestPointOnly() {
        collector.recordMetric("queue_depth", 1, T0, null);
        collector.recordMetric("queue_depth", 7, T0.plusSeconds(5), null);
        var prom = collector.getPrometheusMetrics();
        assertTrue(prom.contains("# HELP queue_depth Metric: queue_depth"));
        assertTrue(prom.contains("queue_depth 7 " + T0.plusSeconds(5).toEpochMilli()));
        assertFalse(prom.contains("queue_depth 1 "));
    }

    @Test
    void clearOldMetricsDropsPointsAtOrBeforeCutoff() {
        collector.recordMetric("m", 1, T0, null);
        collector.recordMetric("m", 2, T0.plusSeconds(60), null);
        collector.recordMetric("m", 3, T0.plusSeconds(120), null);
        int removed = collector.clearOldMetrics(T0.plusSeconds(60));
        assertEquals(2, removed);
        assertEquals(List.of(3.0), collector.getMetrics("m").stream().map(MetricPoint::value).toList());
    }

    @Test
    void systemSnapshotFansOutIntoNamedSeries() {
        var snapshot = new SystemMetrics(T0,
                new SystemMetrics.Cpu(12.5, 4, new double[]{0.5, 0.4, 0.3}),
                new SystemMetrics.Memory(1000, 400, 600, 60.0),
                new SystemMetrics.Disk(2000, 1000, 1000, 50.0),
                new SystemMetrics.Network(10, 20),
                3600);
        collector.recordSystemMetrics(snapshot);

        var stats = collector.getMetricsStats();
        assertEquals(16, stats.totalMetrics());
        assertEquals(16, stats.totalDataPoints());
        assertEquals(T0, stats.oldestTimestamp());
        assertEquals(60.0, collector.getLatestMetric("system_memory_usage_percent").orElseThrow().value());
        assertEquals(0.4, collector.getLatestMetric("system_load_average_5m").orElseThrow().value());
    }

    @Test
    void timestampDefaultsToClock() {
        clock.advance(Duration.ofMinutes(3));
        collector.recordGauge("g", 1, null);
        assertEquals(T0.plus(Duration.ofMinutes(3)), collector.getLatestMetric("g").orElseThrow().timestamp());
    }

    @Test
    void formatNumberStripsTrailingZeros() {
        assertEquals("42", MetricsCollector.formatNumber(42.0));
        assertEquals("0.25", MetricsCollector.formatNumber(0.25));
        assertEquals("+Inf", MetricsCollector.formatNumber(Double.POSITIVE_INFINITY));
    }
}
