package org.nexus.nexusmonitor.api;

import lombok.RequiredArgsConstructor;
import org.nexus.nexusmonitor.domain.HealthStatus;
import org.nexus.nexusmonitor.domain.ServiceStatus;
import org.nexus.nexusmonitor.domain.SystemMetrics;
import org.nexus.nexusmonitor.domain.SystemStatus;
import org.nexus.nexusmonitor.service.SystemMonitor;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/system")
@RequiredArgsConstructor
public class SystemController {
    private final SystemMonitor systemMonitor;

    /** Fresh sample; does not feed the metric series. */
    @GetMapping("/metrics")
    public SystemMetrics metrics() {
        return systemMonitor.collectSystemMetrics();
    }

    @GetMapping("/status")
    public SystemStatus status() {
        return systemMonitor.getSystemStatus();
    }

    @GetMapping("/health")
    public HealthStatus health() {
        return systemMonitor.getHealthStatus();
    }

    @GetMapping("/services")
    public List<ServiceStatus> services() {
        return systemMonitor.getServicesStatus();
    }
}
