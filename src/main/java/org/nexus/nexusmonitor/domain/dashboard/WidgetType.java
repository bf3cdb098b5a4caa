package org.nexus.nexusmonitor.domain.dashboard;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum WidgetType {
    @JsonProperty("chart") CHART,
    @JsonProperty("metric") METRIC,
    @JsonProperty("alert") ALERT,
    @JsonProperty("status") STATUS,
    @JsonProperty("table") TABLE
}
