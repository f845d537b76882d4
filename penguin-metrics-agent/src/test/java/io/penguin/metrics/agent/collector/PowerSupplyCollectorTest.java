package io.penguin.metrics.agent.collector;

import io.penguin.metrics.config.SourceType;
import io.penguin.metrics.config.model.AcPowerSource;
import io.penguin.metrics.config.model.BatterySource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PowerSupplyCollectorTest {

    @TempDir
    Path supplies;

    private void write(String supply, Map<String, String> files) throws IOException {
        Path dir = Files.createDirectories(supplies.resolve(supply));
        for (Map.Entry<String, String> file : files.entrySet()) {
            Files.writeString(dir.resolve(file.getKey()), file.getValue() + "\n");
        }
    }

    @BeforeEach
    void setUp() throws IOException {
        write("AC", Map.of("type", "Mains", "online", "1"));
        write("BAT1", Map.of("type", "Battery", "status", "Full", "capacity", "100"));
        write("BAT0", Map.of(
                "type", "Battery",
                "status", "Discharging",
                "capacity", "76",
                "voltage_now", "12100000",
                "current_now", "1500000",
                "energy_now", "38500000",
                "temp", "305",
                "present", "1"));
    }

    @Test
    @DisplayName("Should scale micro-units and derive power from voltage and current")
    void battery() throws Exception {
        BatterySource source = Sources.first("""
                battery "main" { name "BAT0"; temperature on; present on; }
                """, SourceType.BATTERY);

        CollectorResult result = new BatteryCollector(source, supplies).collect();

        assertEquals("online", result.state());
        Map<String, Object> values = result.metrics();
        assertEquals("Discharging", values.get("status"));
        assertEquals(76L, values.get("capacity"));
        assertEquals(12.1, values.get("voltage"));
        assertEquals(1.5, values.get("current"));
        assertEquals(18.15, values.get("power"));
        assertEquals(38.5, values.get("energy_now"));
        assertEquals(30.5, values.get("temperature"));
        assertEquals("ON", values.get("present"));
        assertFalse(result.toPayload().containsKey("energy_full"), "Missing files are left out of the payload");
    }

    @Test
    @DisplayName("Should pick the first battery when no supply is named")
    void firstBattery() throws Exception {
        BatterySource source = Sources.first("battery \"any\" { }", SourceType.BATTERY);

        assertEquals("Discharging", new BatteryCollector(source, supplies).collect().metrics().get("status"));
    }

    @Test
    @DisplayName("Should report not_found for a missing battery")
    void missingBattery() throws Exception {
        BatterySource source = Sources.first("battery \"x\" { name \"BAT9\"; }", SourceType.BATTERY);

        assertEquals(CollectorResult.NOT_FOUND, new BatteryCollector(source, supplies).collect().state());
    }

    @Test
    @DisplayName("Should publish AC adapter state as ON/OFF")
    void acPower() throws Exception {
        AcPowerSource source = Sources.first("ac_power \"mains\" { }", SourceType.AC_POWER);
        AcPowerCollector collector = new AcPowerCollector(source, supplies);

        assertEquals("ON", collector.collect().metrics().get("online"));

        Files.writeString(supplies.resolve("AC/online"), "0\n");
        assertEquals("OFF", collector.collect().metrics().get("online"));
    }
}
