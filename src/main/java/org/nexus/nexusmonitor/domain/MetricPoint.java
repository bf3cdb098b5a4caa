package org.nexus.nexusmonitor.domain;

import java.time.Instant;
import java.util.Map;

public record MetricPoint(
        Instant timestamp,
        String name,
        double value,
        Map<String, String> labels   // empty when unlabeled
) {
    public MetricPoint {
        labels = (labels == null) ? Map.of() : Map.copyOf(labels);
    }
}
