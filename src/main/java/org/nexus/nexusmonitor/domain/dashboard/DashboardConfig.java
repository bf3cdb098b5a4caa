package org.nexus.nexusmonitor.domain.dashboard;

import java.util.List;

public record DashboardConfig(List<LayoutCell> layout, List<DashboardWidget> widgets, Settings settings) {

    public record Settings(long refreshInterval, String theme, String timezone) {}
}
