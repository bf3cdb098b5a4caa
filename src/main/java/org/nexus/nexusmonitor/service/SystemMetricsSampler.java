package org.nexus.nexusmonitor.service;

import com.sun.management.OperatingSystemMXBean;
import lombok.extern.slf4j.Slf4j;
import org.nexus.nexusmonitor.domain.SystemMetrics;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.lang.management.ManagementFactory;
import java.nio.file.FileStore;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.List;

/**
 * Reads OS resource usage. Linux {@code /proc} files are preferred; the JVM
 * management beans are the fallback. A failing source yields zeroed values.
 */
@Slf4j
@Component
public class SystemMetricsSampler {
    private static final Path PROC_STAT = Paths.get("/proc/stat");
    private static final Path PROC_NET_DEV = Paths.get("/proc/net/dev");
    private static final Path PROC_UPTIME = Paths.get("/proc/uptime");
    private static final Path PROC_LOADAVG = Paths.get("/proc/loadavg");

    private final Clock clock;

    // /proc/stat baseline, advanced only by sample()
    private long prevIdle = -1;
    private long prevTotal = -1;
    private double lastCpuUsage;

    public SystemMetricsSampler(Clock clock) {
        this.clock = clock;
    }

    /** Periodic sample: CPU usage covers the interval since the previous call and the baseline moves. */
    public synchronized SystemMetrics sample() {
        return new SystemMetrics(clock.instant(), cpu(true), memory(), disk(), network(), uptime());
    }

    /** On-demand sample: CPU usage is measured against the periodic baseline, which is left untouched. */
    public synchronized SystemMetrics peek() {
        return new SystemMetrics(clock.instant(), cpu(false), memory(), disk(), network(), uptime());
    }

    SystemMetrics.Cpu cpu(boolean advance) {
        int cores = Runtime.getRuntime().availableProcessors();
        double usage = cpuFromProcStat(advance);
        if (usage < 0) usage = cpuFromMxBean();
        return new SystemMetrics.Cpu(round2(usage), cores, loadAverage());
    }

    /**
     * Busy share of the ticks elapsed since the baseline; the first reading uses
     * cumulative ticks. With no ticks elapsed the last committed figure is kept.
     */
    synchronized double cpuUsage(long idle, long total, boolean advance) {
        long dIdle = prevTotal < 0 ? idle : idle - prevIdle;
        long dTotal = prevTotal < 0 ? total : total - prevTotal;
        double usage = dTotal <= 0 ? lastCpuUsage : 100.0 - (100.0 * dIdle / dTotal);
        if (advance) {
            prevIdle = idle;
            prevTotal = total;
            lastCpuUsage = usage;
        }
        return usage;
    }

    private double cpuFromProcStat(boolean advance) {
        if (!Files.isReadable(PROC_STAT)) return -1;
        try {
            List<String> lines = Files.readAllLines(PROC_STAT);
            if (lines.isEmpty() || !lines.get(0).startsWith("cpu ")) return -1;
            String[] parts = lines.get(0).trim().split("\\s+");
            long total = 0;
            for (int i = 1; i < parts.length; i++) total += Long.parseLong(parts[i]);
            // idle + iowait
            long idle = Long.parseLong(parts[4]) + (parts.length > 5 ? Long.parseLong(parts[5]) : 0);

            return cpuUsage(idle, total, advance);
        } catch (IOException | RuntimeException e) {
            log.warn("[SystemMonitor] /proc/stat unreadable: {}", e.getMessage());
            return -1;
        }
    }

    private double cpuFromMxBean() {
        try {
            var bean = ManagementFactory.getOperatingSystemMXBean();
            if (bean instanceof OperatingSystemMXBean osBean) {
                double load = osBean.getCpuLoad();
                if (load >= 0) return load * 100.0;
            }
            double loadAvg = bean.getSystemLoadAverage();
            if (loadAvg >= 0) {
                return Math.min(100.0, loadAvg / Math.max(1, bean.getAvailableProcessors()) * 100.0);
            }
        } catch (Exception e) {
            log.warn("[SystemMonitor] cpu load unavailable: {}", e.getMessage());
        }
        return 0.0;
    }

    private double[] loadAverage() {
        if (Files.isReadable(PROC_LOADAVG)) {
            try {
                String[] parts = Files.readString(PROC_LOADAVG).trim().split("\\s+");
                return new double[]{
                        Double.parseDouble(parts[0]), Double.parseDouble(parts[1]), Double.parseDouble(parts[2])};
            } catch (IOException | RuntimeException e) {
                log.warn("[SystemMonitor] /proc/loadavg unreadable: {}", e.getMessage());
            }
        }
        double one = ManagementFactory.getOperatingSystemMXBean().getSystemLoadAverage();
        return new double[]{Math.max(0, one), 0, 0};
    }

    SystemMetrics.Memory memory() {
        try {
            var bean = ManagementFactory.getOperatingSystemMXBean();
            if (bean instanceof OperatingSystemMXBean osBean) {
                long total = osBean.getTotalMemorySize();
                long free = osBean.getFreeMemorySize();
                long used = total - free;
                double pct = total > 0 ? (double) used / total * 100.0 : 0.0;
                return new SystemMetrics.Memory(total, free, used, round2(pct));
            }
        } catch (Exception e) {
            log.warn("[SystemMonitor] memory stats unavailable: {}", e.getMessage());
        }
        return new SystemMetrics.Memory(0, 0, 0, 0.0);
    }

    SystemMetrics.Disk disk() {
        try {
            FileStore store = Files.getFileStore(Paths.get("/"));
            long total = store.getTotalSpace();
            long free = store.getUsableSpace();
            long used = total - free;
            double pct = total > 0 ? (double) used / total * 100.0 : 0.0;
            return new SystemMetrics.Disk(total, free, used, round2(pct));
        } catch (IOException | RuntimeException e) {
            log.warn("[SystemMonitor] failed to read disk usage: {}", e.getMessage());
            return SystemMetrics.Disk.empty();
        }
    }

    /** Cumulative receive/transmit bytes across non-loopback interfaces. */
    SystemMetrics.Network network() {
        if (!Files.isReadable(PROC_NET_DEV)) return new SystemMetrics.Network(0, 0);
        try {
            long rx = 0, tx = 0;
            for (String line : Files.readAllLines(PROC_NET_DEV)) {
                int colon = line.indexOf(':');
                if (colon < 0) continue;
                String iface = line.substring(0, colon).trim();
                if (iface.equals("lo")) continue;
                String[] f = line.substring(colon + 1).trim().split("\\s+");
                if (f.length < 9) continue;
                rx += Long.parseLong(f[0]);
                tx += Long.parseLong(f[8]);
            }
            return new SystemMetrics.Network(rx, tx);
        } catch (IOException | RuntimeException e) {
            log.warn("[SystemMonitor] /proc/net/dev unreadable: {}", e.getMessage());
            return new SystemMetrics.Network(0, 0);
        }
    }

    /** Seconds. */
    double uptime() {
        if (Files.isReadable(PROC_UPTIME)) {
            try {
                return Double.parseDouble(Files.readString(PROC_UPTIME).trim().split("\\s+")[0]);
            } catch (IOException | RuntimeException e) {
                log.warn("[SystemMonitor] /proc/uptime unreadable: {}", e.getMessage());
            }
        }
        return ManagementFactory.getRuntimeMXBean().getUptime() / 1000.0;
    }

    private static double round2(double v) {
        return Math.round(v * 100.0) / 100.0;
    }
}
