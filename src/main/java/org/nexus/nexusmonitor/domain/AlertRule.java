package org.nexus.nexusmonitor.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Catalog entry. Matched against raised alerts by (type, severity) only;
 * {@code cooldownMs} is the minimum gap between two alerts of the same throttle key.
 */
@Value
@Builder
public class AlertRule {
    String id;
    String name;
    AlertType type;
    Severity severity;
    String condition;
    Double threshold;
    boolean enabled;
    Long cooldownMs;
}
