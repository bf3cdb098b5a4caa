package org.nexus.nexusmonitor.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum AlertType {
    @JsonProperty("system") SYSTEM,
    @JsonProperty("patient") PATIENT,
    @JsonProperty("service") SERVICE,
    @JsonProperty("security") SECURITY
}
