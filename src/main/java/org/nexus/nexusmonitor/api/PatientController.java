package org.nexus.nexusmonitor.api;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.nexus.nexusmonitor.api.dto.VitalSignsDTO;
import org.nexus.nexusmonitor.domain.PatientAlert;
import org.nexus.nexusmonitor.domain.PatientMetrics;
import org.nexus.nexusmonitor.domain.VitalSigns;
import org.nexus.nexusmonitor.service.patient.PatientMonitor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/patients")
@RequiredArgsConstructor
public class PatientController {
    private final PatientMonitor patientMonitor;

    @GetMapping("/metrics")
    public PatientMetrics metrics() {
        return patientMonitor.getPatientMetrics();
    }

    @GetMapping("/{patientId}/vitals")
    public List<VitalSigns> vitals(@PathVariable String patientId,
                                   @RequestParam(required = false) Integer limit) {
        return patientMonitor.getPatientVitals(patientId, limit);
    }

    @PostMapping("/{patientId}/vitals")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public void record(@PathVariable String patientId, @Valid @RequestBody VitalSignsDTO body) {
        patientMonitor.recordVitalSigns(body.toDomain(patientId));
    }

    @GetMapping("/{patientId}/alerts")
    public List<PatientAlert> alerts(@PathVariable String patientId,
                                     @RequestParam(required = false) Integer limit) {
        return patientMonitor.getPatientAlerts(patientId, limit);
    }

    @PostMapping("/simulate")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void simulate() {
        patientMonitor.simulatePatientData();
    }
}
