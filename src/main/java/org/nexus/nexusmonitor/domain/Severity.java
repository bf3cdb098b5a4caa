package org.nexus.nexusmonitor.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Ordinal alert severity: LOW < MEDIUM < HIGH < CRITICAL. Lowercase on the wire. */
public enum Severity {
    @JsonProperty("low") LOW,
    @JsonProperty("medium") MEDIUM,
    @JsonProperty("high") HIGH,
    @JsonProperty("critical") CRITICAL
}
