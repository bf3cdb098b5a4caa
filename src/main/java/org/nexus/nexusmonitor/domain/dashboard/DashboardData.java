package org.nexus.nexusmonitor.domain.dashboard;

import org.nexus.nexusmonitor.domain.ServiceState;
import org.nexus.nexusmonitor.domain.Severity;

import java.time.Instant;
import java.util.Map;

/** One consistent dashboard snapshot. Replaced as a whole on every refresh. */
public record DashboardData(
        Instant timestamp,
        SystemSummary systemMetrics,
        PatientSummary patientMetrics,
        Map<String, ServiceSummary> serviceStatus,
        AlertSummary alerts
) {
    public DashboardData {
        serviceStatus = serviceStatus == null ? Map.of() : Map.copyOf(serviceStatus);
    }

    public record SystemSummary(double cpu, double memory, double disk, double uptime) {}

    public record PatientSummary(int totalPatients, int activePatients, int criticalPatients, int recentAlerts) {}

    public record ServiceSummary(ServiceState status, Long responseTimeMs) {}

    public record AlertSummary(int total, int active, Map<Severity, Integer> bySeverity) {
        public AlertSummary {
            bySeverity = bySeverity == null ? Map.of() : Map.copyOf(bySeverity);
        }

        public int count(Severity severity) {
            return bySeverity.getOrDefault(severity, 0);
        }
    }
}
