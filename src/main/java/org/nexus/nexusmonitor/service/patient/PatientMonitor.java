package org.nexus.nexusmonitor.service.patient;

import lombok.extern.slf4j.Slf4j;
import org.nexus.nexusmonitor.config.MonitoringProps;
import org.nexus.nexusmonitor.domain.*;
import org.nexus.nexusmonitor.service.alerts.AlertEngine;
import org.springframework.stereotype.Service;

import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

/**
 * Evaluates vital signs against clinical thresholds and keeps a bounded
 * rolling history of readings and alerts per patient.
 */
@Slf4j
@Service
public class PatientMonitor {
    static final String SOURCE = "patient-monitor";
    private static final Duration RECENT_WINDOW = Duration.ofHours(1);
    private static final List<String> SIMULATED_PATIENTS = List.of("patient-001", "patient-002", "patient-003");

    private final AlertEngine alertEngine;
    private final List<CareReminderCheck> reminderChecks;
    private final Clock clock;
    private final Duration interval;
    private final int maxVitals;
    private final int maxAlerts;

    private final Map<String, ArrayDeque<VitalSigns>> vitals = new ConcurrentHashMap<>();
    private final Map<String, ArrayDeque<PatientAlert>> patientAlerts = new ConcurrentHashMap<>();

    private ScheduledExecutorService scheduler;
    private volatile boolean running;

    public PatientMonitor(AlertEngine alertEngine, List<CareReminderCheck> reminderChecks,
                          MonitoringProps props, Clock clock) {
        this.alertEngine = alertEngine;
        this.reminderChecks = List.copyOf(reminderChecks);
        this.clock = clock;
        var r = props.retention();
        this.maxVitals = r == null || r.maxVitalsPerPatient() <= 0 ? 100 : r.maxVitalsPerPatient();
        this.maxAlerts = r == null || r.maxAlertsPerPatient() <= 0 ? 50 : r.maxAlertsPerPatient();
        this.interval = props.intervals() == null || props.intervals().patient() == null
                ? Duration.ofSeconds(60) : props.intervals().patient();
    }

    public synchronized void start() {
        if (running) {
            log.warn("[PatientMonitor] already running");
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "patient-monitor");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleAtFixedRate(this::tick, 0, interval.toMillis(), TimeUnit.MILLISECONDS);
        running = true;
        log.info("[PatientMonitor] started, interval={} ms, {} reminder checks",
                interval.toMillis(), reminderChecks.size());
    }

    public synchronized void stop() {
        if (!running) return;
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        scheduler = null;
        running = false;
        log.info("[PatientMonitor] stopped");
    }

    public boolean isRunning() { return running; }

    void tick() {
        try {
            var now = clock.instant();
            for (var check : reminderChecks) {
                try {
                    check.check(now).forEach(this::createPatientAlert);
                } catch (Exception e) {
                    log.error("[PatientMonitor] reminder check {} failed", check.name(), e);
                }
            }
            var m = getPatientMetrics();
            if (m.criticalPatients() > 0) {
                log.info("[PatientMonitor] {} patients require critical attention", m.criticalPatients());
            }
        } catch (Exception e) {
            log.error("[PatientMonitor] error in patient monitoring cycle", e);
        }
    }

    /** Stores the reading (stamped now if it carries no timestamp) and evaluates thresholds. */
    public void recordVitalSigns(VitalSigns v) {
        if (v.patientId() == null || v.patientId().isBlank()) {
            throw new IllegalArgumentException("patientId is required");
        }
        var reading = v.timestamp() != null ? v : new VitalSigns(v.patientId(), clock.instant(), v.heartRate(),
                v.bloodPressure(), v.temperature(), v.respiratoryRate(), v.oxygenSaturation(), v.weight(), v.height());
        appendBounded(vitals, reading.patientId(), reading, maxVitals);
        checkVitalSignsThresholds(reading).forEach(this::createPatientAlert);
        log.debug("[PatientMonitor] vital signs recorded for {}", reading.patientId());
    }

    List<PatientAlert> checkVitalSignsThresholds(VitalSigns v) {
        List<PatientAlert> out = new ArrayList<>();
        var now = clock.instant();

        Double hr = v.heartRate();
        if (hr != null && (hr < 60 || hr > 100)) {
            out.add(vitalsAlert(v, hr < 50 || hr > 120 ? Severity.CRITICAL : Severity.HIGH,
                    "Abnormal heart rate: " + num(hr) + " bpm", Map.of("heartRate", hr), now));
        }

        var bp = v.bloodPressure();
        if (bp != null && (bp.systolic() > 140 || bp.diastolic() > 90)) {
            out.add(vitalsAlert(v, bp.systolic() > 180 || bp.diastolic() > 110 ? Severity.CRITICAL : Severity.HIGH,
                    "High blood pressure: " + num(bp.systolic()) + "/" + num(bp.diastolic()) + " mmHg",
                    Map.of("bloodPressure", Map.of("systolic", bp.systolic(), "diastolic", bp.diastolic())), now));
        }

        Double temp = v.temperature();
        if (temp != null && (temp > 38.0 || temp < 36.0)) {
            out.add(vitalsAlert(v, temp > 39.5 || temp < 35.0 ? Severity.CRITICAL : Severity.HIGH,
                    "Abnormal temperature: " + num(temp) + "°C", Map.of("temperature", temp), now));
        }

        Double spo2 = v.oxygenSaturation();
        if (spo2 != null && spo2 < 95) {
            out.add(vitalsAlert(v, spo2 < 90 ? Severity.CRITICAL : Severity.HIGH,
                    "Low oxygen saturation: " + num(spo2) + "%", Map.of("oxygenSaturation", spo2), now));
        }
        return out;
    }

    private static PatientAlert vitalsAlert(VitalSigns v, Severity severity, String message,
                                            Map<String, Object> data, Instant now) {
        return new PatientAlert(v.patientId(), PatientAlertType.VITALS, severity, message, now, data);
    }

    /** Keeps the alert in the patient's history and forwards it to the alert engine. */
    public void createPatientAlert(PatientAlert alert) {
        var stamped = alert.timestamp() != null ? alert : new PatientAlert(alert.patientId(), alert.type(),
                alert.severity(), alert.message(), clock.instant(), alert.data());
        appendBounded(patientAlerts, stamped.patientId(), stamped, maxAlerts);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("patientId", stamped.patientId());
        data.put("alertType", stamped.type());
        if (stamped.data() != null) data.putAll(stamped.data());
        alertEngine.sendAlert(AlertType.PATIENT, stamped.severity(),
                "Patient " + stamped.patientId() + ": " + stamped.message(), SOURCE, data);

        log.info("[PatientMonitor] patient alert created: {} patient={} type={} severity={}",
                stamped.message(), stamped.patientId(), stamped.type(), stamped.severity());
    }

    /** Activity over the trailing hour. */
    public PatientMetrics getPatientMetrics() {
        var cutoff = clock.instant().minus(RECENT_WINDOW);
        Set<String> patients = new TreeSet<>(vitals.keySet());
        patients.addAll(patientAlerts.keySet());

        int active = 0, recentVitals = 0, critical = 0;
        Map<Severity, Integer> counts = new EnumMap<>(Severity.class);
        for (var s : Severity.values()) counts.put(s, 0);

        for (var id : patients) {
            var readings = vitals.get(id);
            if (readings != null) {
                long n;
                synchronized (readings) {
                    n = readings.stream().filter(r -> r.timestamp().isAfter(cutoff)).count();
                }
                if (n > 0) {
                    active++;
                    recentVitals += (int) n;
                }
            }
            var alerts = patientAlerts.get(id);
            if (alerts != null) {
                boolean hasCritical = false;
                synchronized (alerts) {
                    for (var a : alerts) {
                        if (!a.timestamp().isAfter(cutoff)) continue;
                        counts.merge(a.severity(), 1, Integer::sum);
                        if (a.severity() == Severity.CRITICAL) hasCritical = true;
                    }
                }
                if (hasCritical) critical++;
            }
        }
        return new PatientMetrics(patients.size(), active, critical, recentVitals, counts);
    }

    public List<VitalSigns> getPatientVitals(String patientId, Integer limit) {
        return tail(vitals.get(patientId), limit);
    }

    public List<PatientAlert> getPatientAlerts(String patientId, Integer limit) {
        return tail(patientAlerts.get(patientId), limit);
    }

    /** Records one normal-range reading for each demo patient. */
    public void simulatePatientData() {
        var rnd = ThreadLocalRandom.current();
        for (var id : SIMULATED_PATIENTS) {
            recordVitalSigns(new VitalSigns(id, clock.instant(),
                    (double) (60 + rnd.nextInt(40)),
                    new VitalSigns.BloodPressure(90 + rnd.nextInt(40), 60 + rnd.nextInt(20)),
                    Math.round((36.0 + rnd.nextDouble() * 2) * 10.0) / 10.0,
                    (double) (12 + rnd.nextInt(8)),
                    (double) (95 + rnd.nextInt(5)),
                    null, null));
        }
        log.info("[PatientMonitor] simulated vitals for {} patients", SIMULATED_PATIENTS.size());
    }

    private static <T> void appendBounded(Map<String, ArrayDeque<T>> map, String key, T value, int max) {
        var deque = map.computeIfAbsent(key, k -> new ArrayDeque<>());
        synchronized (deque) {
            deque.addLast(value);
            while (deque.size() > max) {
                deque.removeFirst();
            }
        }
    }

    private static <T> List<T> tail(ArrayDeque<T> deque, Integer limit) {
        if (deque == null) return List.of();
        List<T> all;
        synchronized (deque) {
            all = new ArrayList<>(deque);
        }
        if (limit != null && limit > 0 && limit < all.size()) {
            return List.copyOf(all.subList(all.size() - limit, all.size()));
        }
        return all;
    }

    private static String num(double v) {
        return new DecimalFormat("0.##", DecimalFormatSymbols.getInstance(Locale.ROOT)).format(v);
    }
}
