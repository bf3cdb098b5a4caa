package org.nexus.nexusmonitor.domain;

import java.time.Instant;

public record ServiceStatus(
        String name,
        ServiceState state,
        Instant lastCheck,
        Long responseTimeMs,
        String errorMessage
) {}
