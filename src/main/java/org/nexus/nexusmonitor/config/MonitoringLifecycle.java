package org.nexus.nexusmonitor.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nexus.nexusmonitor.service.SystemMonitor;
import org.nexus.nexusmonitor.service.alerts.AlertEngine;
import org.nexus.nexusmonitor.service.dashboard.DashboardManager;
import org.nexus.nexusmonitor.service.patient.PatientMonitor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

/** Starts the monitoring timers once the context is up and stops them in reverse order. */
@Slf4j
@Component
@RequiredArgsConstructor
public class MonitoringLifecycle implements SmartLifecycle {
    private final AlertEngine alertEngine;
    private final SystemMonitor systemMonitor;
    private final PatientMonitor patientMonitor;
    private final DashboardManager dashboardManager;

    @Value("${app.monitoring.autostart:true}")
    private boolean autostart;

    private volatile boolean running;

    @Override
    public void start() {
        alertEngine.start();
        systemMonitor.start();
        patientMonitor.start();
        dashboardManager.start();
        running = true;
        log.info("[Monitoring] all components started");
    }

    @Override
    public void stop() {
        dashboardManager.stop();
        patientMonitor.stop();
        systemMonitor.stop();
        alertEngine.stop();
        running = false;
        log.info("[Monitoring] all components stopped");
    }

    @Override
    public boolean isRunning() { return running; }

    @Override
    public boolean isAutoStartup() { return autostart; }
}
