package org.nexus.nexusmonitor.domain;

import java.util.Map;

/** Patient activity over the trailing hour. */
public record PatientMetrics(
        int totalPatients,
        int activePatients,
        int criticalPatients,
        int recentVitalSigns,
        Map<Severity, Integer> alertCounts
) {
    public int recentAlerts() {
        return alertCounts.values().stream().mapToInt(Integer::intValue).sum();
    }
}
