package org.nexus.nexusmonitor.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;

import static org.junit.jupiter.api.Assertions.*;

class SystemMetricsSamplerTest {
    private SystemMetricsSampler sampler;

    @BeforeEach
    void setUp() {
        sampler = new SystemMetricsSampler(Clock.systemUTC());
    }

    @Test
    void firstReadingUsesCumulativeTicks() {
        assertEquals(90.0, sampler.cpuUsage(100, 1000, true), 1e-9);
    }

    @Test
    void onDemandReadDoesNotMoveTheBaseline() {
        sampler.cpuUsage(100, 1000, true);

        assertEquals(50.0, sampler.cpuUsage(150, 1100, false), 1e-9);
        // the next periodic reading still spans the whole interval since the last one
        assertEquals(75.0, sampler.cpuUsage(150, 1200, true), 1e-9);
    }

    @Test
    void noElapsedTicksKeepsLastFigure() {
        sampler.cpuUsage(100, 1000, true);
        sampler.cpuUsage(150, 1200, true);

        assertEquals(75.0, sampler.cpuUsage(150, 1200, false), 1e-9);
        assertEquals(75.0, sampler.cpuUsage(150, 1200, true), 1e-9);
    }

    @Test
    void sampleProducesRoundedPercentages() {
        var m = sampler.sample();
        assertTrue(m.cpu().usage() >= 0 && m.cpu().usage() <= 100);
        assertTrue(m.cpu().cores() > 0);
        assertTrue(m.memory().usagePercent() >= 0 && m.memory().usagePercent() <= 100);
        assertTrue(m.uptime() >= 0);
    }
}
