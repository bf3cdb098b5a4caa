package org.nexus.nexusmonitor.api;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.nexus.nexusmonitor.api.dto.WidgetPatchRequest;
import org.nexus.nexusmonitor.api.dto.WidgetRequest;
import org.nexus.nexusmonitor.api.error.NotFoundException;
import org.nexus.nexusmonitor.domain.dashboard.*;
import org.nexus.nexusmonitor.service.dashboard.DashboardManager;
import org.nexus.nexusmonitor.service.dashboard.DashboardUnavailableException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/dashboard")
@RequiredArgsConstructor
public class DashboardController {
    private final DashboardManager dashboard;

    @GetMapping("/data")
    public DashboardData data() {
        return dashboard.getDashboardData()
                .orElseThrow(() -> new DashboardUnavailableException("No dashboard data available"));
    }

    @GetMapping("/config")
    public DashboardConfig config() {
        return dashboard.getDashboardConfig();
    }

    @GetMapping("/stats")
    public DashboardStats stats() {
        return dashboard.getStats();
    }

    @GetMapping("/widgets")
    public List<DashboardWidget> widgets() {
        return dashboard.getAllWidgets();
    }

    @GetMapping("/widgets/{id}")
    public DashboardWidget widget(@PathVariable String id) {
        return dashboard.getWidget(id).orElseThrow(() -> new NotFoundException("widget not found: " + id));
    }

    @PostMapping("/widgets")
    @ResponseStatus(HttpStatus.CREATED)
    public DashboardWidget add(@Valid @RequestBody WidgetRequest body) {
        var w = body.toWidget();
        dashboard.addWidget(w);
        return w;
    }

    @PatchMapping("/widgets/{id}")
    public DashboardWidget update(@PathVariable String id, @Valid @RequestBody WidgetPatchRequest body) {
        if (!dashboard.updateWidget(id, body.toUpdate())) throw new NotFoundException("widget not found: " + id);
        return dashboard.getWidget(id).orElseThrow(() -> new NotFoundException("widget not found: " + id));
    }

    @DeleteMapping("/widgets/{id}")
    public ResponseEntity<?> remove(@PathVariable String id) {
        if (!dashboard.removeWidget(id)) throw new NotFoundException("widget not found: " + id);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/export")
    public ResponseEntity<String> export(@RequestParam(defaultValue = "json") String format) {
        var f = ExportFormat.parse(format);
        var body = dashboard.exportDashboardData(f);
        var type = f == ExportFormat.CSV ? MediaType.parseMediaType("text/csv") : MediaType.APPLICATION_JSON;
        return ResponseEntity.ok()
                .contentType(type)
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        "attachment; filename=\"dashboard." + f.name().toLowerCase(java.util.Locale.ROOT) + "\"")
                .body(body);
    }
}
