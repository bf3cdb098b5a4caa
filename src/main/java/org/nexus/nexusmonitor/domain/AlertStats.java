package org.nexus.nexusmonitor.domain;

import java.util.Map;

public record AlertStats(
        int total,
        int active,
        int resolved,
        Map<Severity, Integer> bySeverity,
        Map<AlertType, Integer> byType
) {}
