package org.nexus.nexusmonitor.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum PatientAlertType {
    @JsonProperty("vitals") VITALS,
    @JsonProperty("medication") MEDICATION,
    @JsonProperty("appointment") APPOINTMENT,
    @JsonProperty("emergency") EMERGENCY
}
