package org.nexus.nexusmonitor.domain.dashboard;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable widget definition. {@code data} is null until the first refresh
 * and, when present, must match the widget type.
 */
public record DashboardWidget(
        String id,
        WidgetType type,
        String title,
        WidgetData data,
        Map<String, Object> config,
        Long refreshInterval
) {
    public DashboardWidget {
        if (id == null || id.isBlank()) throw new IllegalArgumentException("widget id is required");
        if (type == null) throw new IllegalArgumentException("widget type is required");
        if (data != null && data.widgetType() != type) {
            throw new IllegalArgumentException("widget " + id + " of type " + type
                    + " cannot hold " + data.widgetType() + " data");
        }
        config = config == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(config));
    }

    public DashboardWidget withData(WidgetData newData) {
        return new DashboardWidget(id, type, title, newData, config, refreshInterval);
    }

    /** Fields left null in the update keep their current value. */
    public DashboardWidget apply(WidgetUpdate u) {
        return new DashboardWidget(id, type,
                u.title() != null ? u.title() : title,
                u.data() != null ? u.data() : data,
                u.config() != null ? u.config() : config,
                u.refreshInterval() != null ? u.refreshInterval() : refreshInterval);
    }
}
