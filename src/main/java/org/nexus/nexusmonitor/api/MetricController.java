package org.nexus.nexusmonitor.api;

import lombok.RequiredArgsConstructor;
import org.nexus.nexusmonitor.api.error.NotFoundException;
import org.nexus.nexusmonitor.domain.MetricPoint;
import org.nexus.nexusmonitor.domain.MetricsStats;
import org.nexus.nexusmonitor.service.MetricsCollector;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;

/**
 * Read APIs over the in-memory metric series: latest window, ranges and stats.
 */
@RestController
@RequestMapping("/api/metrics")
@RequiredArgsConstructor
public class MetricController {
    private final MetricsCollector metricsCollector;

    @GetMapping
    public MetricsStats stats() {
        return metricsCollector.getMetricsStats();
    }

    @GetMapping("/names")
    public List<String> names() {
        return metricsCollector.getAllMetricNames();
    }

    @GetMapping("/{name}")
    public List<MetricPoint> query(
            @PathVariable String name,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to
    ) {
        if (from != null && to != null) {
            if (from.isAfter(to)) throw new IllegalArgumentException("from must not be after to");
            return metricsCollector.getMetricsByTimeRange(name, from, to);
        }
        return metricsCollector.getMetrics(name, limit);
    }

    @GetMapping("/{name}/latest")
    public MetricPoint latest(@PathVariable String name) {
        return metricsCollector.getLatestMetric(name)
                .orElseThrow(() -> new NotFoundException("metric not found: " + name));
    }
}
