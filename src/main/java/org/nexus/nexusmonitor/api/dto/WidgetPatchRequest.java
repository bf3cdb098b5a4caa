package org.nexus.nexusmonitor.api.dto;

import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import org.nexus.nexusmonitor.domain.dashboard.WidgetData;
import org.nexus.nexusmonitor.domain.dashboard.WidgetUpdate;

import java.util.Map;

public record WidgetPatchRequest(
        @Size(min = 1, max = 200) String title,
        WidgetData data,
        Map<String, Object> config,
        @Positive Long refreshInterval
) {
    public WidgetUpdate toUpdate() {
        return new WidgetUpdate(title, data, config, refreshInterval);
    }
}
