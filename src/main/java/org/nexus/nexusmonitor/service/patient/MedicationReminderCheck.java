package org.nexus.nexusmonitor.service.patient;

import lombok.extern.slf4j.Slf4j;
import org.nexus.nexusmonitor.domain.PatientAlert;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

// TODO: query the prescription schedule once the medication store is exposed through DatabaseService
@Slf4j
@Component
public class MedicationReminderCheck implements CareReminderCheck {

    @Override
    public String name() { return "medication"; }

    @Override
    public List<PatientAlert> check(Instant now) {
        log.debug("[PatientMonitor] checking medication alerts");
        return List.of();
    }
}
