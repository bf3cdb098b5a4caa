package org.nexus.nexusmonitor.config;

import org.nexus.nexusmonitor.domain.Severity;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.List;
import java.util.Map;

@ConfigurationProperties(prefix = "app")
public record MonitoringProps(String apiKey, String adminApiKey, String adminAllowIps,
                              IntervalProps intervals, ThresholdProps thresholds,
                              RetentionProps retention, AlertsProps alerts, EmailProps email,
                              WebSocketProps websocket, ServicesProps services,
                              DashboardProps dashboard) {

    /** Tick period of each independent timer */
    public record IntervalProps(Duration system, Duration patient, Duration metrics, Duration alertCleanup) {}

    /** Resource thresholds in percent; responseTime in milliseconds */
    public record ThresholdProps(Double cpu, Double memory, Double disk, Long responseTime) {}

    public record RetentionProps(int metricsDays, int alertsDays, int maxMetricPoints,
                                 int maxVitalsPerPatient, int maxAlertsPerPatient) {}

    /** Ordered notification channels per severity (email, websocket) */
    public record AlertsProps(Map<Severity, List<String>> priorities) {
        public List<String> channelsFor(Severity severity) {
            if (priorities == null) return List.of();
            return priorities.getOrDefault(severity, List.of());
        }
    }

    public record EmailProps(boolean enabled, String from, String to) {}

    public record WebSocketProps(boolean enabled, Duration heartbeatInterval) {}

    /** Dependent services probed by the health check */
    public record ServicesProps(Duration probeTimeout, List<ServiceEndpoint> endpoints) {
        public record ServiceEndpoint(String name, String url) {}
    }

    public record DashboardProps(String theme, String timezone) {}
}
