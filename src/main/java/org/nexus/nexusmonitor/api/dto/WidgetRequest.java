package org.nexus.nexusmonitor.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.nexus.nexusmonitor.domain.dashboard.DashboardWidget;
import org.nexus.nexusmonitor.domain.dashboard.WidgetData;
import org.nexus.nexusmonitor.domain.dashboard.WidgetType;

import java.util.Map;

public record WidgetRequest(
        @NotBlank String id,
        @NotNull WidgetType type,
        @NotBlank String title,
        WidgetData data,
        Map<String, Object> config,
        @Positive Long refreshInterval
) {
    public DashboardWidget toWidget() {
        return new DashboardWidget(id, type, title, data, config, refreshInterval);
    }
}
