package org.nexus.nexusmonitor.service.alerts;

import org.nexus.nexusmonitor.domain.AlertType;
import org.nexus.nexusmonitor.domain.Severity;

import java.time.Instant;

/** Query filter for {@link AlertEngine#getAlerts(AlertFilter)}; null fields match everything. */
public record AlertFilter(AlertType type, Severity severity, Boolean resolved, Instant since, Integer limit) {

    public static AlertFilter none() {
        return new AlertFilter(null, null, null, null, null);
    }
}
