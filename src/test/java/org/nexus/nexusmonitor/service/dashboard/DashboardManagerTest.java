package org.nexus.nexusmonitor.service.dashboard;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.nexus.nexusmonitor.TestProps;
import org.nexus.nexusmonitor.TestProps.MutableClock;
import org.nexus.nexusmonitor.domain.*;
import org.nexus.nexusmonitor.domain.dashboard.*;
import org.nexus.nexusmonitor.service.MetricsCollector;
import org.nexus.nexusmonitor.service.SystemMonitor;
import org.nexus.nexusmonitor.service.alerts.AlertEngine;
import org.nexus.nexusmonitor.service.patient.PatientMonitor;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class DashboardManagerTest {
    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    private MutableClock clock;
    private MetricsCollector metrics;
    private PatientMonitor patients;
    private SystemMonitor system;
    private AlertEngine alerts;
    private DashboardManager dashboard;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        metrics = new MetricsCollector(100, clock);
        patients = mock(PatientMonitor.class);
        system = mock(SystemMonitor.class);
        alerts = mock(AlertEngine.class);
        var mapper = new ObjectMapper().findAndRegisterModules()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        dashboard = new DashboardManager(metrics, patients, system, alerts, TestProps.defaults(), mapper, clock);

        Map<Severity, Integer> bySeverity = new EnumMap<>(Severity.class);
        bySeverity.put(Severity.LOW, 1);
        bySeverity.put(Severity.MEDIUM, 0);
        bySeverity.put(Severity.HIGH, 2);
        bySeverity.put(Severity.CRITICAL, 1);
        when(alerts.getAlertStats()).thenReturn(new AlertStats(4, 3, 1, bySeverity, Map.of()));
        when(patients.getPatientMetrics()).thenReturn(new PatientMetrics(5, 3, 1, 12,
                Map.of(Severity.LOW, 0, Severity.MEDIUM, 0, Severity.HIGH, 2, Severity.CRITICAL, 1)));
        when(system.getServicesStatus()).thenReturn(List.of(
                new ServiceStatus("fhir-service", ServiceState.RUNNING, T0, 120L, null)));
    }

    @Test
    void exportBeforeFirstRefreshFails() {
        assertTrue(dashboard.getDashboardData().isEmpty());
        assertThrows(DashboardUnavailableException.class, () -> dashboard.exportDashboardData(ExportFormat.JSON));
    }

    @Test
    void refreshBuildsSnapshotFromComponents() {
        metrics.recordMetric("system_cpu_usage_percent", 42.5, T0, null);
        metrics.recordMetric("system_uptime_seconds", 3600, T0, null);

        dashboard.refresh();

        var d = dashboard.getDashboardData().orElseThrow();
        assertEquals(T0, d.timestamp());
        assertEquals(42.5, d.systemMetrics().cpu());
        assertEquals(0.0, d.systemMetrics().memory());
        assertEquals(3600.0, d.systemMetrics().uptime());
        assertEquals(3, d.patientMetrics().recentAlerts());
        assertEquals(ServiceState.RUNNING, d.serviceStatus().get("fhir-service").status());
        assertEquals(4, d.alerts().total());
        assertEquals(3, d.alerts().active());
    }

    @Test
    void activeAlertsWidgetCountsUnresolvedOnly() {
        dashboard.refresh();

        var widget = dashboard.getWidget("alerts-summary").orElseThrow();
        assertEquals("Active Alerts", widget.title());
        assertEquals(3, ((WidgetData.AlertCounts) widget.data()).total());
    }

    @Test
    void refreshFillsLiveWidgetsOnly() {
        metrics.recordMetric("system_cpu_usage_percent", 42.5, T0, null);
        dashboard.refresh();

        var chart = (WidgetData.Chart) dashboard.getWidget("system-metrics").orElseThrow().data();
        assertEquals(42.5, chart.values().get("cpu"));
        var cards = (WidgetData.MetricCards) dashboard.getWidget("patient-overview").orElseThrow().data();
        assertEquals(1, cards.cards().get("critical"));
        assertNotNull(dashboard.getWidget("service-status").orElseThrow().data());
        assertNotNull(dashboard.getWidget("alerts-summary").orElseThrow().data());
        assertNull(dashboard.getWidget("recent-vitals").orElseThrow().data());
    }

    @Test
    void csvExportFlattensScalars() {
        metrics.recordMetric("system_cpu_usage_percent", 42, T0, null);
        dashboard.refresh();

        var lines = dashboard.exportDashboardData(ExportFormat.CSV).split("\n");
        assertEquals("timestamp,metric,value", lines[0]);
        assertEquals("2026-03-01T10:00:00Z,cpu,42", lines[1]);
        assertTrue(List.of(lines).contains("2026-03-01T10:00:00Z,critical_patients,1"));
        assertTrue(List.of(lines).contains("2026-03-01T10:00:00Z,alerts_high,2"));
        assertEquals(14, lines.length);
    }

    @Test
    void jsonExportSerializesSnapshot() {
        dashboard.refresh();
        var json = dashboard.exportDashboardData(ExportFormat.JSON);
        assertTrue(json.contains("\"systemMetrics\""));
        assertTrue(json.contains("\"fhir-service\""));
    }

    @Test
    void unsupportedFormatIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> ExportFormat.parse("xml"));
        assertEquals(ExportFormat.CSV, ExportFormat.parse("csv"));
    }

    @Test
    void failedRefreshKeepsPreviousSnapshot() {
        dashboard.refresh();
        var first = dashboard.getDashboardData().orElseThrow();

        clock.advance(Duration.ofSeconds(15));
        when(patients.getPatientMetrics()).thenThrow(new IllegalStateException("boom"));
        dashboard.refresh();

        assertSame(first, dashboard.getDashboardData().orElseThrow());
    }

    @Test
    void readersNeverSeeAMixedSnapshot() throws Exception {
        var stop = new AtomicBoolean();
        var mismatches = new CopyOnWriteArrayList<String>();
        var reader = new Thread(() -> {
            while (!stop.get()) {
                dashboard.getDashboardData().ifPresent(d -> {
                    // each refresh writes cpu == uptime, so a torn read would break the pair
                    if (d.systemMetrics().cpu() != d.systemMetrics().uptime()) {
                        mismatches.add(d.systemMetrics().toString());
                    }
                });
            }
        });
        reader.start();
        for (int i = 0; i < 500; i++) {
            metrics.recordMetric("system_cpu_usage_percent", i, null, null);
            metrics.recordMetric("system_uptime_seconds", i, null, null);
            dashboard.refresh();
        }
        stop.set(true);
        reader.join(5000);
        assertTrue(mismatches.isEmpty(), () -> "torn snapshots: " + mismatches);
    }

    @Test
    void widgetRegistryOperations() {
        assertEquals(6, dashboard.getAllWidgets().size());

        dashboard.addWidget(new DashboardWidget("beds", WidgetType.METRIC, "Bed occupancy", null, null, 30_000L));
        assertEquals(7, dashboard.getStats().totalWidgets());

        assertTrue(dashboard.updateWidget("beds", new WidgetUpdate("Beds", null, Map.of("unit", "%"), null)));
        var beds = dashboard.getWidget("beds").orElseThrow();
        assertEquals("Beds", beds.title());
        assertEquals(30_000L, beds.refreshInterval());
        assertEquals("%", beds.config().get("unit"));

        assertFalse(dashboard.updateWidget("ghost", new WidgetUpdate("x", null, null, null)));
        assertThrows(IllegalArgumentException.class, () -> dashboard.updateWidget("beds",
                new WidgetUpdate(null, new WidgetData.Table(List.of("a"), List.of()), null, null)));

        assertTrue(dashboard.removeWidget("beds"));
        assertFalse(dashboard.removeWidget("beds"));
    }

    @Test
    void configCarriesLayoutAndSettings() {
        var cfg = dashboard.getDashboardConfig();
        assertEquals(6, cfg.layout().size());
        assertEquals(new LayoutCell("alerts-summary", 0, 4, 12, 3), cfg.layout().get(3));
        assertEquals(15_000L, cfg.settings().refreshInterval());
        assertEquals("America/Sao_Paulo", cfg.settings().timezone());
    }

    @Test
    void statsReportLastUpdate() {
        assertNull(dashboard.getStats().lastUpdate());
        dashboard.refresh();
        assertEquals(T0, dashboard.getStats().lastUpdate());
        assertFalse(dashboard.getStats().running());
    }
}
