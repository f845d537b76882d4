package io.penguin.metrics.agent.homeassistant;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SensorRegistryTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Should persist entries across instances")
    void roundTripThroughFile() {
        Path file = tempDir.resolve("state/registered_sensors.json");
        SensorRegistry registry = new SensorRegistry(file);
        registry.add("battery_main_capacity", "sensor");
        registry.add("binary_sensor_vpn_state", "binary_sensor");
        registry.save();

        assertTrue(Files.exists(file));
        assertFalse(Files.exists(file.resolveSibling("registered_sensors.json.tmp")));

        SensorRegistry reloaded = new SensorRegistry(file);
        reloaded.load();
        assertEquals(Map.of("battery_main_capacity", "sensor", "binary_sensor_vpn_state", "binary_sensor"),
                reloaded.entries());
    }

    @Test
    @DisplayName("Should start empty when the file is missing or corrupt")
    void missingOrCorrupt() throws Exception {
        SensorRegistry missing = new SensorRegistry(tempDir.resolve("absent.json"));
        missing.load();
        assertTrue(missing.entries().isEmpty());

        Path corrupt = tempDir.resolve("corrupt.json");
        Files.writeString(corrupt, "{not json");
        SensorRegistry registry = new SensorRegistry(corrupt);
        registry.load();
        assertTrue(registry.entries().isEmpty());
    }

    @Test
    @DisplayName("Should read entries without a component as sensors")
    void defaultComponent() throws Exception {
        Path file = tempDir.resolve("legacy.json");
        Files.writeString(file, "{\"sensors\":[{\"unique_id\":\"system_cpu_percent\"}]}");
        SensorRegistry registry = new SensorRegistry(file);
        registry.load();

        assertEquals(Map.of("system_cpu_percent", "sensor"), registry.entries());
    }
}
