package org.nexus.nexusmonitor;

import org.junit.jupiter.api.Test;
import org.nexus.nexusmonitor.service.alerts.AlertEngine;
import org.nexus.nexusmonitor.service.dashboard.DashboardManager;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

@SpringBootTest(properties = "app.monitoring.autostart=false")
class NexusMonitorApplicationTest {

    @Autowired AlertEngine alertEngine;
    @Autowired DashboardManager dashboardManager;

    @Test
    void contextLoadsWithDefaultRulesAndWidgets() {
        assertEquals(4, alertEngine.getRules().size());
        assertEquals(6, dashboardManager.getAllWidgets().size());
        assertFalse(dashboardManager.isRunning());
    }
}
