package io.penguin.metrics.agent.probe;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Host-wide figures from {@code /proc}: CPU times, memory, load and mounts.
 */
public class Procfs {

    private final Path procRoot;

    public Procfs(Path procRoot) {
        this.procRoot = procRoot;
    }

    public Path root() {
        return procRoot;
    }

    /**
     * @return aggregate CPU times under key {@code cpu} followed by {@code cpu0}, {@code cpu1}, ...
     */
    public Map<String, CpuTimes> cpuTimes() throws IOException {
        Map<String, CpuTimes> times = new HashMap<>();
        for (String line : Files.readAllLines(procRoot.resolve("stat"), StandardCharsets.UTF_8)) {
            if (!line.startsWith("cpu")) {
                continue;
            }
            String[] parts = line.trim().split("\\s+");
            long total = 0;
            for (int i = 1; i < parts.length; i++) {
                total += Long.parseLong(parts[i]);
            }
            long idle = Long.parseLong(parts[4]) + (parts.length > 5 ? Long.parseLong(parts[5]) : 0);
            times.put(parts[0], new CpuTimes(total, idle));
        }
        return times;
    }

    /**
     * @return {@code /proc/meminfo} values in bytes keyed by field name
     */
    public Map<String, Long> meminfo() throws IOException {
        Map<String, Long> values = new HashMap<>();
        for (String line : Files.readAllLines(procRoot.resolve("meminfo"), StandardCharsets.UTF_8)) {
            int colon = line.indexOf(':');
            if (colon < 0) {
                continue;
            }
            String[] parts = line.substring(colon + 1).trim().split("\\s+");
            long value = Long.parseLong(parts[0]);
            values.put(line.substring(0, colon), parts.length > 1 && parts[1].equals("kB") ? value * 1024 : value);
        }
        return values;
    }

    public double[] loadAverage() throws IOException {
        String[] parts = Files.readString(procRoot.resolve("loadavg"), StandardCharsets.UTF_8).trim().split("\\s+");
        return new double[]{Double.parseDouble(parts[0]), Double.parseDouble(parts[1]), Double.parseDouble(parts[2])};
    }

    public double uptimeSeconds() throws IOException {
        String text = Files.readString(procRoot.resolve("uptime"), StandardCharsets.UTF_8).trim();
        return Double.parseDouble(text.split("\\s+")[0]);
    }

    public List<Mount> mounts() throws IOException {
        List<Mount> mounts = new ArrayList<>();
        for (String line : Files.readAllLines(procRoot.resolve("mounts"), StandardCharsets.UTF_8)) {
            String[] parts = line.split("\\s+");
            if (parts.length >= 3) {
                mounts.add(new Mount(parts[0], unescape(parts[1]), parts[2]));
            }
        }
        return mounts;
    }

    private static String unescape(String path) {
        return path.replace("\\040", " ").replace("\\011", "\t");
    }

    /**
     * Cumulative jiffies; usage between two readings is {@code 1 - Δidle / Δtotal}.
     */
    public record CpuTimes(long total, long idle) {

        public double usagePercentSince(CpuTimes previous) {
            long totalDelta = total - previous.total;
            if (totalDelta <= 0) {
                return 0.0;
            }
            return 100.0 * (totalDelta - (idle - previous.idle)) / totalDelta;
        }
    }

    /**
     * One line of {@code /proc/mounts}.
     */
    public record Mount(String device, String mountpoint, String fsType) {
    }
}
