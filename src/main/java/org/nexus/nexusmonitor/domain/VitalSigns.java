package org.nexus.nexusmonitor.domain;

import java.time.Instant;

/** A single vitals reading. Every measurement is optional. */
public record VitalSigns(
        String patientId,
        Instant timestamp,
        Double heartRate,          // bpm
        BloodPressure bloodPressure,
        Double temperature,        // °C
        Double respiratoryRate,    // breaths/min
        Double oxygenSaturation,   // %
        Double weight,
        Double height
) {
    public record BloodPressure(double systolic, double diastolic) {}
}
