package org.nexus.nexusmonitor.service.alerts;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.nexus.nexusmonitor.config.MonitoringProps;
import org.springframework.stereotype.Service;

/**
 * Runtime resource thresholds used by the system monitor. Seeded from
 * {@code app.thresholds} and updateable via the admin API.
 */
@Service
@Slf4j
public class AlertConfigService {
    @Getter private volatile double cpuPct = 80.0;
    @Getter private volatile double memoryPct = 85.0;
    @Getter private volatile double diskPct = 90.0;
    @Getter private volatile long responseTimeMs = 5000;

    public AlertConfigService(MonitoringProps props) {
        var t = props.thresholds();
        if (t != null) {
            if (t.cpu() != null) cpuPct = t.cpu();
            if (t.memory() != null) memoryPct = t.memory();
            if (t.disk() != null) diskPct = t.disk();
            if (t.responseTime() != null) responseTimeMs = t.responseTime();
        }
        log.info("[Alerts] thresholds cpu={} memory={} disk={} responseTime={}ms",
                cpuPct, memoryPct, diskPct, responseTimeMs);
    }

    public synchronized void update(Double cpu, Double memory, Double disk, Long responseTime) {
        if (cpu != null) cpuPct = cpu;
        if (memory != null) memoryPct = memory;
        if (disk != null) diskPct = disk;
        if (responseTime != null) responseTimeMs = responseTime;
        log.info("[Alerts] thresholds updated cpu={} memory={} disk={} responseTime={}ms",
                cpuPct, memoryPct, diskPct, responseTimeMs);
    }
}
