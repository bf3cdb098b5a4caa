package org.nexus.nexusmonitor.domain;

import java.time.Instant;
import java.util.List;

public record MetricsStats(
        int totalMetrics,
        int totalDataPoints,
        List<String> metricNames,
        Instant oldestTimestamp,
        Instant newestTimestamp
) {}
