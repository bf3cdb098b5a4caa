package org.nexus.nexusmonitor.api;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.nexus.nexusmonitor.api.dto.ResolveRequest;
import org.nexus.nexusmonitor.api.error.NotFoundException;
import org.nexus.nexusmonitor.domain.Alert;
import org.nexus.nexusmonitor.domain.AlertStats;
import org.nexus.nexusmonitor.domain.AlertType;
import org.nexus.nexusmonitor.domain.Severity;
import org.nexus.nexusmonitor.service.alerts.AlertEngine;
import org.nexus.nexusmonitor.service.alerts.AlertFilter;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Alert queries and resolution.
 */
@RestController
@RequestMapping("/api/alerts")
@RequiredArgsConstructor
public class AlertsController {
    private final AlertEngine alertEngine;

    @GetMapping
    public List<Alert> list(
            @RequestParam(required = false) AlertType type,
            @RequestParam(required = false) Severity severity,
            @RequestParam(required = false) Boolean resolved,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant since,
            @RequestParam(required = false) Integer limit
    ) {
        return alertEngine.getAlerts(new AlertFilter(type, severity, resolved, since, limit));
    }

    @GetMapping("/active")
    public List<Alert> active() {
        return alertEngine.getActiveAlerts();
    }

    @GetMapping("/critical")
    public List<Alert> critical() {
        return alertEngine.getCriticalAlerts();
    }

    @GetMapping("/stats")
    public AlertStats stats() {
        return alertEngine.getAlertStats();
    }

    @GetMapping("/{id}")
    public Alert one(@PathVariable String id) {
        return alertEngine.getAlert(id).orElseThrow(() -> new NotFoundException("alert not found: " + id));
    }

    @PatchMapping("/{id}/resolve")
    public Map<String, Object> resolve(@PathVariable String id, @RequestBody(required = false) @Valid ResolveRequest body) {
        var by = body == null || body.resolvedBy() == null || body.resolvedBy().isBlank() ? "api" : body.resolvedBy();
        if (!alertEngine.resolveAlert(id, by)) {
            throw new NotFoundException("Alert not found or already resolved: " + id);
        }
        return Map.of("resolved", true, "id", id, "resolvedBy", by);
    }
}
