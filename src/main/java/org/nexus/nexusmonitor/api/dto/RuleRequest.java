package org.nexus.nexusmonitor.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import org.nexus.nexusmonitor.domain.AlertRule;
import org.nexus.nexusmonitor.domain.AlertType;
import org.nexus.nexusmonitor.domain.Severity;

public record RuleRequest(
        @NotBlank String id,
        @NotBlank String name,
        @NotNull AlertType type,
        @NotNull Severity severity,
        @NotBlank String condition,
        Double threshold,
        Boolean enabled,
        @PositiveOrZero Long cooldownMs
) {
    public AlertRule toRule() {
        return AlertRule.builder()
                .id(id).name(name).type(type).severity(severity).condition(condition)
                .threshold(threshold)
                .enabled(enabled == null || enabled)
                .cooldownMs(cooldownMs)
                .build();
    }
}
