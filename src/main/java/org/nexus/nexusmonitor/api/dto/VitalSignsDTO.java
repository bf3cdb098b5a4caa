package org.nexus.nexusmonitor.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.nexus.nexusmonitor.domain.VitalSigns;

import java.time.Instant;

/** Vitals ingestion body; the patient id comes from the path. */
public record VitalSignsDTO(
        Instant timestamp,
        @DecimalMin("0.0") @DecimalMax("400.0") Double heartRate,
        @Valid BloodPressureDTO bloodPressure,
        @DecimalMin("20.0") @DecimalMax("50.0") Double temperature,
        @DecimalMin("0.0") @DecimalMax("120.0") Double respiratoryRate,
        @DecimalMin("0.0") @DecimalMax("100.0") Double oxygenSaturation,
        @Positive Double weight,
        @Positive Double height
) {
    public record BloodPressureDTO(
            @NotNull @DecimalMin("0.0") @DecimalMax("400.0") Double systolic,
            @NotNull @DecimalMin("0.0") @DecimalMax("300.0") Double diastolic
    ) {}

    public VitalSigns toDomain(String patientId) {
        var bp = bloodPressure == null ? null
                : new VitalSigns.BloodPressure(bloodPressure.systolic(), bloodPressure.diastolic());
        return new VitalSigns(patientId, timestamp, heartRate, bp, temperature, respiratoryRate,
                oxygenSaturation, weight, height);
    }
}
