package io.penguin.metrics.agent.homeassistant;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.penguin.metrics.config.SourceType;
import io.penguin.metrics.config.model.HomeAssistantSettings;
import io.penguin.metrics.config.model.MqttSettings;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class HomeAssistantDiscoveryTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Device HOST = new Device(List.of("penguin_metrics_penguin_metrics_system"), "host1",
            "Penguin Metrics", "Linux Host", null, Map.of());

    @TempDir
    Path tempDir;

    private RecordingPublisher publisher;
    private SensorRegistry registry;
    private HomeAssistantDiscovery discovery;

    @BeforeEach
    void setUp() {
        publisher = new RecordingPublisher();
        registry = new SensorRegistry(tempDir.resolve("registered_sensors.json"));
        discovery = new HomeAssistantDiscovery(publisher,
                new HomeAssistantSettings(true, "homeassistant", tempDir.resolve("registered_sensors.json")),
                MqttSettings.defaults(), registry);
    }

    private static Sensor sensor(String uniqueId, SourceType type, String topic, boolean binary) {
        return new Sensor(uniqueId, "Value", type, topic, "{{ value_json.value }}", binary ? null : "%",
                null, binary ? null : "measurement", null, null, true, binary, HOST, Map.of());
    }

    @Test
    @DisplayName("Should announce a retained config with two availability conditions")
    void announce() throws Exception {
        Sensor sensor = sensor("service_ssh_cpu_percent", SourceType.SERVICE, "penguin_metrics/service/ssh", false);

        discovery.announce(List.of(sensor));

        assertEquals(1, publisher.messages.size());
        RecordingPublisher.Message message = publisher.messages.get(0);
        assertEquals("homeassistant/sensor/service_ssh_cpu_percent/config", message.topic());
        assertTrue(message.retain());

        JsonNode payload = MAPPER.readTree(message.payload());
        assertEquals("service_ssh_cpu_percent", payload.get("unique_id").asText());
        assertEquals("penguin_metrics/service/ssh", payload.get("state_topic").asText());
        assertEquals("%", payload.get("unit_of_measurement").asText());
        assertEquals("all", payload.get("availability_mode").asText());
        JsonNode availability = payload.get("availability");
        assertEquals(2, availability.size());
        assertEquals("penguin_metrics/status", availability.get(0).get("topic").asText());
        assertEquals("{{ 'online' if value_json.state == 'active' else 'offline' }}",
                availability.get(1).get("value_template").asText());
        assertEquals("host1", payload.get("device").get("name").asText());
        assertEquals("Penguin Metrics", payload.get("origin").get("name").asText());
        assertFalse(payload.has("payload_on"));
        assertEquals(Map.of("service_ssh_cpu_percent", "sensor"), registry.entries());
    }

    @Test
    @DisplayName("Should announce binary sensors under their own component")
    void binarySensor() throws Exception {
        Sensor sensor = sensor("binary_sensor_vpn_state", SourceType.BINARY_SENSOR,
                "penguin_metrics/binary_sensor/vpn", true);

        discovery.announce(List.of(sensor));

        RecordingPublisher.Message message = publisher.messages.get(0);
        assertEquals("homeassistant/binary_sensor/binary_sensor_vpn_state/config", message.topic());
        JsonNode payload = MAPPER.readTree(message.payload());
        assertEquals("ON", payload.get("payload_on").asText());
        assertEquals("OFF", payload.get("payload_off").asText());
    }

    @Test
    @DisplayName("Should follow only the agent status for the system source")
    void systemAvailability() throws Exception {
        Sensor sensor = sensor("system_cpu_percent", SourceType.SYSTEM, "penguin_metrics/system", false);

        discovery.announce(List.of(sensor));

        JsonNode payload = MAPPER.readTree(publisher.messages.get(0).payload());
        assertEquals(1, payload.get("availability").size());
    }

    @Test
    @DisplayName("Should retract with an empty retained payload")
    void retract() {
        Sensor sensor = sensor("battery_main_capacity", SourceType.BATTERY, "penguin_metrics/battery/main", false);
        discovery.announce(List.of(sensor));

        discovery.retract(List.of(sensor));

        RecordingPublisher.Message last = publisher.messages.get(1);
        assertEquals("homeassistant/sensor/battery_main_capacity/config", last.topic());
        assertEquals("", last.payload());
        assertTrue(last.retain());
        assertTrue(registry.entries().isEmpty());
    }

    @Test
    @DisplayName("Should retract registered sensors that no longer exist")
    void finalizeRegistration() {
        registry.add("process_old_cpu_percent", "sensor");
        registry.add("binary_sensor_gone_state", "binary_sensor");
        registry.add("system_cpu_percent", "sensor");

        List<String> stale = discovery.finalizeRegistration(Set.of("system_cpu_percent"));

        assertEquals(List.of("binary_sensor_gone_state", "process_old_cpu_percent"), stale);
        assertTrue(publisher.messages.stream().anyMatch(m ->
                m.topic().equals("homeassistant/binary_sensor/binary_sensor_gone_state/config")
                        && m.payload().isEmpty()));
        assertEquals(Set.of("system_cpu_percent"), registry.entries().keySet());

        SensorRegistry reloaded = new SensorRegistry(tempDir.resolve("registered_sensors.json"));
        reloaded.load();
        assertEquals(Set.of("system_cpu_percent"), reloaded.entries().keySet());
    }

    @Test
    @DisplayName("Should publish nothing when discovery is disabled")
    void disabled() {
        HomeAssistantDiscovery off = new HomeAssistantDiscovery(publisher,
                new HomeAssistantSettings(false, "homeassistant", tempDir.resolve("x.json")),
                MqttSettings.defaults(), registry);
        off.announce(List.of(sensor("system_load_1m", SourceType.SYSTEM, "penguin_metrics/system", false)));

        assertTrue(publisher.messages.isEmpty());
    }
}
