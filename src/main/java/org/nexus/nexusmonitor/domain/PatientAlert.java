package org.nexus.nexusmonitor.domain;

import java.time.Instant;
import java.util.Map;

public record PatientAlert(
        String patientId,
        PatientAlertType type,
        Severity severity,
        String message,
        Instant timestamp,
        Map<String, Object> data
) {}
