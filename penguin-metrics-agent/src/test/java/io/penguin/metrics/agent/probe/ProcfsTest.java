package io.penguin.metrics.agent.probe;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ProcfsTest {

    @TempDir
    Path proc;

    @Test
    @DisplayName("Should read aggregate and per-core CPU times")
    void cpuTimes() throws IOException {
        Files.writeString(proc.resolve("stat"), """
                cpu  100 0 100 700 100 0 0 0 0 0
                cpu0 50 0 50 350 50 0 0 0 0 0
                intr 12345
                """);

        Map<String, Procfs.CpuTimes> times = new Procfs(proc).cpuTimes();

        assertEquals(new Procfs.CpuTimes(1000, 800), times.get("cpu"));
        assertEquals(500, times.get("cpu0").total());
        assertFalse(times.containsKey("intr"));
        assertEquals(50.0, new Procfs.CpuTimes(2000, 1300).usagePercentSince(times.get("cpu")), 0.01);
    }

    @Test
    @DisplayName("Should convert meminfo kB values to bytes")
    void meminfo() throws IOException {
        Files.writeString(proc.resolve("meminfo"), "MemTotal:       16384 kB\nHugePages_Total:       0\n");

        Map<String, Long> meminfo = new Procfs(proc).meminfo();

        assertEquals(16384L * 1024, meminfo.get("MemTotal"));
        assertEquals(0L, meminfo.get("HugePages_Total"));
    }

    @Test
    @DisplayName("Should unescape mount points")
    void mounts() throws IOException {
        Files.writeString(proc.resolve("mounts"),
                "/dev/sda1 / ext4 rw 0 0\n/dev/sdb1 /mnt/my\\040disk vfat rw 0 0\n");

        List<Procfs.Mount> mounts = new Procfs(proc).mounts();

        assertEquals(new Procfs.Mount("/dev/sdb1", "/mnt/my disk", "vfat"), mounts.get(1));
    }

    @Test
    @DisplayName("Should read load average and uptime")
    void loadAndUptime() throws IOException {
        Files.writeString(proc.resolve("loadavg"), "0.50 0.25 0.10 1/200 999\n");
        Files.writeString(proc.resolve("uptime"), "3600.55 7000.00\n");
        Procfs procfs = new Procfs(proc);

        assertArrayEquals(new double[]{0.5, 0.25, 0.1}, procfs.loadAverage(), 0.001);
        assertEquals(3600.55, procfs.uptimeSeconds(), 0.001);
    }
}
