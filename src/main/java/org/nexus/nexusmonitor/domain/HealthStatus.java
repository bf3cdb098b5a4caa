package org.nexus.nexusmonitor.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record HealthStatus(State status, Instant timestamp, Checks checks, String message) {

    public enum State {
        @JsonProperty("healthy") HEALTHY,
        @JsonProperty("warning") WARNING,
        @JsonProperty("critical") CRITICAL
    }

    public record Checks(boolean cpu, boolean memory, boolean disk, boolean services) {}
}
