package org.nexus.nexusmonitor.domain.dashboard;

import java.util.Map;

public record WidgetUpdate(String title, WidgetData data, Map<String, Object> config, Long refreshInterval) {}
