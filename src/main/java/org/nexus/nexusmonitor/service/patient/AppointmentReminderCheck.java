package org.nexus.nexusmonitor.service.patient;

import lombok.extern.slf4j.Slf4j;
import org.nexus.nexusmonitor.domain.PatientAlert;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

@Slf4j
@Component
public class AppointmentReminderCheck implements CareReminderCheck {

    @Override
    public String name() { return "appointment"; }

    @Override
    public List<PatientAlert> check(Instant now) {
        log.debug("[PatientMonitor] checking appointment reminders");
        return List.of();
    }
}
