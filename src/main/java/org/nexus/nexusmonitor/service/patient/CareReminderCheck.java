package org.nexus.nexusmonitor.service.patient;

import org.nexus.nexusmonitor.domain.PatientAlert;

import java.time.Instant;
import java.util.List;

/**
 * A sweep run on every patient monitoring tick. Returned alerts are stored in
 * the patient's history and forwarded to the alert engine.
 */
public interface CareReminderCheck {

    String name();

    List<PatientAlert> check(Instant now);
}
