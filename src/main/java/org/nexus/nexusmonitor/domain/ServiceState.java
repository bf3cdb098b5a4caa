package org.nexus.nexusmonitor.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum ServiceState {
    @JsonProperty("running") RUNNING,
    @JsonProperty("stopped") STOPPED,
    @JsonProperty("error") ERROR
}
