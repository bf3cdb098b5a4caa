package org.nexus.nexusmonitor.service.alerts;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.nexus.nexusmonitor.TestProps;
import org.nexus.nexusmonitor.TestProps.MutableClock;
import org.nexus.nexusmonitor.domain.Alert;
import org.nexus.nexusmonitor.domain.AlertRule;
import org.nexus.nexusmonitor.domain.AlertType;
import org.nexus.nexusmonitor.domain.Severity;
import org.nexus.nexusmonitor.service.NotificationService;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class AlertEngineTest {
    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    private MutableClock clock;
    private NotificationService notifications;
    private AlertEngine engine;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        notifications = mock(NotificationService.class);
        engine = new AlertEngine(notifications, TestProps.defaults(), clock, Runnable::run);
    }

    @Test
    void secondAlertWithinCooldownIsSuppressed() {
        var first = engine.sendAlert(AlertType.SYSTEM, Severity.HIGH, "High CPU usage: 82.0%", "system-monitor", null);
        clock.advance(Duration.ofMinutes(2));
        var second = engine.sendAlert(AlertType.SYSTEM, Severity.HIGH, "High CPU usage: 83.0%", "system-monitor", null);

        assertFalse(first.isEmpty());
        assertEquals("", second);
        assertEquals(1, engine.getAlerts().size());
    }

    @Test
    void alertIsAcceptedAgainAfterCooldownElapses() {
        engine.sendAlert(AlertType.SYSTEM, Severity.HIGH, "cpu", "system-monitor", null);
        clock.advance(Duration.ofMinutes(5));
        var again = engine.sendAlert(AlertType.SYSTEM, Severity.HIGH, "cpu", "system-monitor", null);
        assertFalse(again.isEmpty());
        assertEquals(2, engine.getAlerts().size());
    }

    @Test
    void cooldownIsEnforcedPerSource() {
        engine.sendAlert(AlertType.SYSTEM, Severity.HIGH, "cpu", "system-monitor", null);
        var other = engine.sendAlert(AlertType.SYSTEM, Severity.HIGH, "cpu", "node-b", null);
        assertFalse(other.isEmpty());
    }

    @Test
    void concurrentSendsForSameKeyStoreExactlyOneAlert() throws Exception {
        int threads = 16;
        var pool = Executors.newFixedThreadPool(threads);
        var gate = new CountDownLatch(1);
        try {
            List<Future<String>> results = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                Callable<String> send = () -> {
                    gate.await();
                    return engine.sendAlert(AlertType.SYSTEM, Severity.HIGH, "High CPU usage: 91.0%",
                            "system-monitor", null);
                };
                results.add(pool.submit(send));
            }
            gate.countDown();

            int accepted = 0;
            for (var f : results) {
                if (!f.get(5, TimeUnit.SECONDS).isEmpty()) accepted++;
            }
            assertEquals(1, accepted);
            assertEquals(1, engine.getAlerts().size());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void noMatchingRuleMeansNoCooldown() {
        engine.sendAlert(AlertType.SECURITY, Severity.LOW, "login burst", "auth", null);
        var second = engine.sendAlert(AlertType.SECURITY, Severity.LOW, "login burst", "auth", null);
        assertFalse(second.isEmpty());
        assertEquals(2, engine.getAlerts().size());
    }

    @Test
    void resolveIsIdempotent() {
        var id = engine.sendAlert(AlertType.SERVICE, Severity.CRITICAL, "fhir down", "system-monitor", null);
        clock.advance(Duration.ofSeconds(30));

        assertTrue(engine.resolveAlert(id, "oncall"));
        assertFalse(engine.resolveAlert(id, "oncall"));
        assertFalse(engine.resolveAlert("missing", "oncall"));

        Alert a = engine.getAlert(id).orElseThrow();
        assertTrue(a.isResolved());
        assertEquals(T0.plusSeconds(30), a.getResolvedAt());
        assertEquals("oncall", a.getResolvedBy());
    }

    @Test
    void returnedAlertsAreCopies() {
        var id = engine.sendAlert(AlertType.SECURITY, Severity.MEDIUM, "x", "auth", null);
        engine.getAlert(id).orElseThrow().setResolved(true);
        assertFalse(engine.getAlert(id).orElseThrow().isResolved());
    }

    @Test
    void highSeverityNotifiesEmailAndWebsocket() {
        engine.sendAlert(AlertType.SYSTEM, Severity.HIGH, "disk", "system-monitor", Map.of("diskUsage", 93.0));
        verify(notifications).sendEmail(eq("ops@nexus-saude.com"), eq("[HIGH] Nexus Saude Alert"), contains("disk"));
        verify(notifications).sendWebSocketMessage(eq("alert"), any(Alert.class));
    }

    @Test
    void lowSeverityOnlyUsesWebsocket() {
        engine.sendAlert(AlertType.SECURITY, Severity.LOW, "info", "auth", null);
        verify(notifications, never()).sendEmail(anyString(), anyString(), anyString());
        verify(notifications).sendWebSocketMessage(eq("alert"), any(Alert.class));
    }

    @Test
    void failingChannelDoesNotBlockOthersOrPersistence() {
        doThrow(new IllegalStateException("smtp down"))
                .when(notifications).sendEmail(anyString(), anyString(), anyString());

        var id = engine.sendAlert(AlertType.SERVICE, Severity.CRITICAL, "ml down", "system-monitor", null);

        assertFalse(id.isEmpty());
        assertTrue(engine.getAlert(id).isPresent());
        verify(notifications).sendWebSocketMessage(eq("alert"), any(Alert.class));
    }

    @Test
    void retentionRemovesOnlyOldResolvedAlerts() {
        var oldResolved = engine.sendAlert(AlertType.SECURITY, Severity.LOW, "a", "s1", null);
        var oldOpen = engine.sendAlert(AlertType.SECURITY, Severity.LOW, "b", "s2", null);
        engine.resolveAlert(oldResolved, "me");

        clock.advance(Duration.ofDays(91));
        var freshResolved = engine.sendAlert(AlertType.SECURITY, Severity.LOW, "c", "s3", null);
        engine.resolveAlert(freshResolved, "me");

        assertEquals(1, engine.cleanupOldAlerts());
        assertTrue(engine.getAlert(oldResolved).isEmpty());
        assertTrue(engine.getAlert(oldOpen).isPresent());
        assertTrue(engine.getAlert(freshResolved).isPresent());
    }

    @Test
    void filtersAndNewestFirstOrdering() {
        engine.sendAlert(AlertType.SECURITY, Severity.LOW, "first", "a", null);
        clock.advance(Duration.ofMinutes(1));
        var mid = engine.sendAlert(AlertType.SYSTEM, Severity.CRITICAL, "second", "b", null);
        clock.advance(Duration.ofMinutes(1));
        engine.sendAlert(AlertType.SECURITY, Severity.MEDIUM, "third", "c", null);
        engine.resolveAlert(mid, "me");

        var all = engine.getAlerts();
        assertEquals("third", all.get(0).getMessage());
        assertEquals("first", all.get(2).getMessage());

        assertEquals(2, engine.getAlerts(new AlertFilter(AlertType.SECURITY, null, null, null, null)).size());
        assertEquals(1, engine.getAlerts(new AlertFilter(null, null, true, null, null)).size());
        assertEquals(2, engine.getAlerts(new AlertFilter(null, null, null, T0.plusSeconds(60), null)).size());
        assertEquals(1, engine.getAlerts(new AlertFilter(null, null, null, null, 1)).size());
        assertTrue(engine.getCriticalAlerts().isEmpty());
        assertEquals(2, engine.getActiveAlerts().size());
    }

    @Test
    void statsPartitionBySeverityAndType() {
        engine.sendAlert(AlertType.SECURITY, Severity.LOW, "a", "s1", null);
        engine.sendAlert(AlertType.PATIENT, Severity.CRITICAL, "b", "s2", null);
        var id = engine.sendAlert(AlertType.PATIENT, Severity.HIGH, "c", "s3", null);
        engine.resolveAlert(id, "me");

        var stats = engine.getAlertStats();
        assertEquals(3, stats.total());
        assertEquals(2, stats.active());
        assertEquals(1, stats.resolved());
        assertEquals(1, stats.bySeverity().get(Severity.CRITICAL));
        assertEquals(0, stats.bySeverity().get(Severity.MEDIUM));
        assertEquals(2, stats.byType().get(AlertType.PATIENT));
    }

    @Test
    void defaultRulesAreSeededAndEditable() {
        assertEquals(4, engine.getRules().size());
        assertTrue(engine.removeRule("disk_high"));
        assertFalse(engine.removeRule("disk_high"));

        engine.addRule(AlertRule.builder().id("sec_low").name("Security noise").type(AlertType.SECURITY)
                .severity(Severity.LOW).condition("events > 10").enabled(true).cooldownMs(60_000L).build());
        engine.sendAlert(AlertType.SECURITY, Severity.LOW, "noise", "auth", null);
        assertEquals("", engine.sendAlert(AlertType.SECURITY, Severity.LOW, "noise", "auth", null));
    }

    @Test
    void startAndStopAreIdempotent() {
        engine.stop();
        engine.start();
        engine.start();
        assertTrue(engine.isRunning());
        engine.stop();
        engine.stop();
        assertFalse(engine.isRunning());
    }
}
