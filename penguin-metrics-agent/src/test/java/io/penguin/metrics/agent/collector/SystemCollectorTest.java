package io.penguin.metrics.agent.collector;

import io.penguin.metrics.agent.probe.GpuSysfs;
import io.penguin.metrics.agent.probe.Procfs;
import io.penguin.metrics.config.SourceType;
import io.penguin.metrics.config.model.SystemSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SystemCollectorTest {

    @TempDir
    Path proc;

    @TempDir
    Path sys;

    @BeforeEach
    void setUp() throws Exception {
        Files.writeString(proc.resolve("stat"), "cpu  100 0 100 800 0 0 0 0\ncpu0 100 0 100 800 0 0 0 0\nintr 1 2 3\n");
        Files.writeString(proc.resolve("meminfo"), String.join("\n",
                "MemTotal:        1048576 kB",
                "MemFree:          262144 kB",
                "MemAvailable:     524288 kB",
                "SwapTotal:             0 kB",
                "SwapFree:              0 kB",
                ""));
        Files.writeString(proc.resolve("loadavg"), "0.50 0.40 0.30 1/200 1234\n");
        Files.writeString(proc.resolve("uptime"), "3600.55 7000.00\n");
    }

    @Test
    @DisplayName("Should compute CPU usage between cycles and read memory, load and uptime")
    void collect() throws Exception {
        SystemSource source = Sources.first("system { }", SourceType.SYSTEM);
        SystemCollector collector = new SystemCollector(source, new Procfs(proc), new GpuSysfs(sys));
        collector.initialize();

        Files.writeString(proc.resolve("stat"), "cpu  200 0 200 1400 0 0 0 0\ncpu0 200 0 200 1400 0 0 0 0\n");
        Map<String, Object> values = collector.collect().metrics();

        assertEquals(25.0, values.get("cpu_percent"));
        assertEquals(512.0, values.get("memory_used"));
        assertEquals(1024.0, values.get("memory_total"));
        assertEquals(50.0, values.get("memory_percent"));
        assertEquals(0.0, values.get("swap_percent"));
        assertEquals(0.5, values.get("load_1m"));
        assertEquals(3600L, values.get("uptime"));
        assertFalse(values.containsKey("gpu_utilization"));
    }

    @Test
    @DisplayName("Should report the GPU group on the system source when enabled")
    void gpu() throws Exception {
        Path device = Files.createDirectories(sys.resolve("class/drm/card0/device"));
        Files.writeString(device.resolve("gpu_busy_percent"), "37\n");
        Path hwmon = Files.createDirectories(device.resolve("hwmon/hwmon3"));
        Files.writeString(hwmon.resolve("temp1_input"), "52000\n");
        Files.writeString(hwmon.resolve("freq1_input"), "1200000000\n");
        SystemSource source = Sources.first("system { gpu on; }", SourceType.SYSTEM);
        SystemCollector collector = new SystemCollector(source, new Procfs(proc), new GpuSysfs(sys));

        assertTrue(collector.metrics().stream().anyMatch(m -> m.key().equals("gpu_temperature")));
        collector.initialize();
        Map<String, Object> values = collector.collect().metrics();

        assertEquals(37.0, values.get("gpu_utilization"));
        assertEquals(1200L, values.get("gpu_frequency"));
        assertEquals(52.0, values.get("gpu_temperature"));
    }

    @Test
    @DisplayName("Should publish empty GPU values on a host without a GPU")
    void noGpu() throws Exception {
        SystemSource source = Sources.first("system { gpu on; }", SourceType.SYSTEM);
        SystemCollector collector = new SystemCollector(source, new Procfs(proc), new GpuSysfs(sys));
        collector.initialize();
        Map<String, Object> values = collector.collect().metrics();

        assertTrue(values.containsKey("gpu_utilization"));
        assertNull(values.get("gpu_utilization"));
        assertNull(values.get("gpu_temperature"));
    }

    @Test
    @DisplayName("Should fail initialization without CPU statistics")
    void missingProc() throws Exception {
        Files.delete(proc.resolve("stat"));
        SystemSource source = Sources.first("system { }", SourceType.SYSTEM);

        assertThrows(CollectionException.class, () -> new SystemCollector(source, new Procfs(proc), new GpuSysfs(sys)).initialize());
    }
}
