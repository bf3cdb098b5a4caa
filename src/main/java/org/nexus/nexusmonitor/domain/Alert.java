package org.nexus.nexusmonitor.domain;

import lombok.*;

import java.time.Instant;
import java.util.Map;

/**
 * A raised alert. Only {@code resolved}, {@code resolvedAt} and {@code resolvedBy}
 * change after creation, and only once.
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder(toBuilder = true)
public class Alert {
    private String id;
    private AlertType type;
    private Severity severity;
    private String message;
    private Instant timestamp;
    private String source;
    private Map<String, Object> data;
    private boolean resolved;
    private Instant resolvedAt;
    private String resolvedBy;
}
