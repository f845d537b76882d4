package io.penguin.metrics.agent.probe;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class GpuSysfsTest {

    @TempDir
    Path sys;

    @Test
    @DisplayName("Should read the AMD clock from the active DPM level and skip connector entries")
    void amdCard() throws IOException {
        Files.createDirectories(sys.resolve("class/drm/card1-HDMI-A-1"));
        Path device = Files.createDirectories(sys.resolve("class/drm/card1/device"));
        Files.writeString(device.resolve("gpu_busy_percent"), "12\n");
        Files.writeString(device.resolve("pp_dpm_sclk"), """
                0: 500Mhz
                1: 1350Mhz *
                2: 2100Mhz
                """);
        Files.writeString(Files.createDirectories(device.resolve("hwmon/hwmon0")).resolve("temp1_input"), "48500\n");

        GpuReading reading = new GpuSysfs(sys).read().orElseThrow();

        assertEquals("card1", reading.name());
        assertEquals(12.0, reading.utilization());
        assertEquals(1350L, reading.frequencyMhz());
        assertEquals(48.5, reading.temperature());
    }

    @Test
    @DisplayName("Should read the Intel clock without utilization")
    void intelCard() throws IOException {
        Path card = Files.createDirectories(sys.resolve("class/drm/card0"));
        Files.createDirectories(card.resolve("device"));
        Files.writeString(card.resolve("gt_cur_freq_mhz"), "300\n");

        GpuReading reading = new GpuSysfs(sys).read().orElseThrow();

        assertNull(reading.utilization());
        assertEquals(300L, reading.frequencyMhz());
        assertNull(reading.temperature());
    }

    @Test
    @DisplayName("Should fall back to a devfreq GPU node")
    void devfreq() throws IOException {
        Files.createDirectories(sys.resolve("class/devfreq/dmc"));
        Path node = Files.createDirectories(sys.resolve("class/devfreq/fb000000.gpu"));
        Files.writeString(node.resolve("cur_freq"), "800000000\n");
        Files.writeString(node.resolve("load"), "45@800000000Hz\n");

        GpuReading reading = new GpuSysfs(sys).read().orElseThrow();

        assertEquals("fb000000.gpu", reading.name());
        assertEquals(45.0, reading.utilization());
        assertEquals(800L, reading.frequencyMhz());
    }

    @Test
    @DisplayName("Should find nothing on a host without a GPU")
    void none() throws IOException {
        assertTrue(new GpuSysfs(sys).read().isEmpty());
    }
}
