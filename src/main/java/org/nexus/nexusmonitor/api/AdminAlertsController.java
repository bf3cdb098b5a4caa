package org.nexus.nexusmonitor.api;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Positive;
import lombok.RequiredArgsConstructor;
import org.nexus.nexusmonitor.api.dto.RuleRequest;
import org.nexus.nexusmonitor.api.error.NotFoundException;
import org.nexus.nexusmonitor.domain.AlertRule;
import org.nexus.nexusmonitor.service.alerts.AlertConfigService;
import org.nexus.nexusmonitor.service.alerts.AlertEngine;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/** Admin endpoints to view/update thresholds and the alert rule catalog at runtime. */
@RestController
@RequestMapping("/api/admin/alerts")
@RequiredArgsConstructor
public class AdminAlertsController {
    private final AlertConfigService cfg;
    private final AlertEngine alertEngine;

    @GetMapping("/config")
    public Map<String, Object> get() {
        return Map.of(
                "cpu", cfg.getCpuPct(),
                "memory", cfg.getMemoryPct(),
                "disk", cfg.getDiskPct(),
                "responseTime", cfg.getResponseTimeMs()
        );
    }

    public record UpdateReq(
            @DecimalMin("0.0") @DecimalMax("100.0") Double cpu,
            @DecimalMin("0.0") @DecimalMax("100.0") Double memory,
            @DecimalMin("0.0") @DecimalMax("100.0") Double disk,
            @Positive Long responseTime) {}

    @PutMapping("/config")
    public ResponseEntity<?> update(@RequestBody @Valid UpdateReq body) {
        cfg.update(body.cpu(), body.memory(), body.disk(), body.responseTime());
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/rules")
    public List<AlertRule> rules() {
        return alertEngine.getRules();
    }

    @PostMapping("/rules")
    @ResponseStatus(HttpStatus.CREATED)
    public AlertRule addRule(@RequestBody @Valid RuleRequest body) {
        var rule = body.toRule();
        alertEngine.addRule(rule);
        return rule;
    }

    @DeleteMapping("/rules/{id}")
    public ResponseEntity<?> removeRule(@PathVariable String id) {
        if (!alertEngine.removeRule(id)) throw new NotFoundException("rule not found: " + id);
        return ResponseEntity.noContent().build();
    }
}
