package org.nexus.nexusmonitor.domain;

import java.time.Instant;

/** One OS resource sample. Fanned out into individual metric series, never stored whole. */
public record SystemMetrics(Instant timestamp, Cpu cpu, Memory memory, Disk disk,
                            Network network, double uptime) {

    public record Cpu(double usage, int cores, double[] loadAverage) {}

    public record Memory(long total, long free, long used, double usagePercent) {}

    public record Disk(long total, long free, long used, double usagePercent) {
        public static Disk empty() { return new Disk(0, 0, 0, 0.0); }
    }

    public record Network(long inbound, long outbound) {}
}
