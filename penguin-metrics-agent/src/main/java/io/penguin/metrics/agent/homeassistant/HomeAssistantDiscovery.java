package io.penguin.metrics.agent.homeassistant;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.penguin.metrics.agent.mqtt.MessagePublisher;
import io.penguin.metrics.config.model.HomeAssistantSettings;
import io.penguin.metrics.config.model.MqttSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Publishes Home Assistant MQTT discovery announcements and retractions, keeping the
 * {@link SensorRegistry} in step with what is announced.
 * <p>
 * Every sensor uses {@code availability_mode: all} over the agent status topic and, except for
 * the system source, its own source topic mapped through {@link AvailabilityRule}.
 */
public class HomeAssistantDiscovery {

    private static final Logger log = LoggerFactory.getLogger(HomeAssistantDiscovery.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static final String ORIGIN_NAME = "Penguin Metrics";
    public static final String VERSION = "0.1.0";

    private final MessagePublisher publisher;
    private final HomeAssistantSettings settings;
    private final MqttSettings mqtt;
    private final SensorRegistry registry;

    public HomeAssistantDiscovery(MessagePublisher publisher, HomeAssistantSettings settings, MqttSettings mqtt,
                                  SensorRegistry registry) {
        this.publisher = publisher;
        this.settings = settings;
        this.mqtt = mqtt;
        this.registry = registry;
    }

    public void loadRegistry() {
        if (settings.discovery()) {
            registry.load();
        }
    }

    public String discoveryTopic(String component, String uniqueId) {
        return settings.discoveryPrefix() + "/" + component + "/" + uniqueId + "/config";
    }

    public void announce(Collection<Sensor> sensors) {
        if (!settings.discovery() || sensors.isEmpty()) {
            return;
        }
        for (Sensor sensor : sensors) {
            publisher.publish(discoveryTopic(sensor.component(), sensor.uniqueId()), toJson(payload(sensor)), true);
            registry.add(sensor.uniqueId(), sensor.component());
        }
        registry.save();
        log.debug("Announced {} sensors", sensors.size());
    }

    public void retract(Collection<Sensor> sensors) {
        if (!settings.discovery() || sensors.isEmpty()) {
            return;
        }
        for (Sensor sensor : sensors) {
            publisher.publish(discoveryTopic(sensor.component(), sensor.uniqueId()), "", true);
            registry.remove(sensor.uniqueId());
        }
        registry.save();
        log.debug("Retracted {} sensors", sensors.size());
    }

    /**
     * Retracts every registered id that no live sensor carries any more, e.g. sources removed
     * from the configuration while the agent was down.
     *
     * @return the retracted unique ids
     */
    public List<String> finalizeRegistration(Set<String> liveUniqueIds) {
        List<String> stale = new ArrayList<>();
        if (!settings.discovery()) {
            return stale;
        }
        registry.entries().forEach((uniqueId, component) -> {
            if (!liveUniqueIds.contains(uniqueId)) {
                publisher.publish(discoveryTopic(component, uniqueId), "", true);
                registry.remove(uniqueId);
                stale.add(uniqueId);
            }
        });
        registry.save();
        if (!stale.isEmpty()) {
            log.info("Removed {} stale sensors from Home Assistant", stale.size());
        }
        return stale;
    }

    Map<String, Object> payload(Sensor sensor) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("unique_id", sensor.uniqueId());
        payload.put("object_id", sensor.uniqueId());
        payload.put("name", sensor.name());
        payload.put("state_topic", sensor.stateTopic());
        payload.put("value_template", sensor.valueTemplate());
        putIfPresent(payload, "unit_of_measurement", sensor.unit());
        putIfPresent(payload, "device_class", sensor.deviceClass());
        putIfPresent(payload, "state_class", sensor.stateClass());
        putIfPresent(payload, "icon", sensor.icon());
        putIfPresent(payload, "entity_category", sensor.entityCategory());
        if (!sensor.enabledByDefault()) {
            payload.put("enabled_by_default", false);
        }
        if (sensor.binary()) {
            payload.put("payload_on", "ON");
            payload.put("payload_off", "OFF");
        }

        List<Map<String, Object>> availability = new ArrayList<>();
        Map<String, Object> agent = new LinkedHashMap<>();
        agent.put("topic", mqtt.statusTopic());
        agent.put("payload_available", AvailabilityRule.ONLINE);
        agent.put("payload_not_available", AvailabilityRule.OFFLINE);
        availability.add(agent);
        AvailabilityRule.template(sensor.sourceType()).ifPresent(template -> {
            Map<String, Object> source = new LinkedHashMap<>();
            source.put("topic", sensor.stateTopic());
            source.put("value_template", template);
            source.put("payload_available", AvailabilityRule.ONLINE);
            source.put("payload_not_available", AvailabilityRule.OFFLINE);
            availability.add(source);
        });
        payload.put("availability", availability);
        payload.put("availability_mode", "all");

        if (sensor.device() != null) {
            payload.put("device", sensor.device().toPayload());
        }
        payload.put("origin", Map.of("name", ORIGIN_NAME, "sw_version", VERSION));
        payload.putAll(sensor.extra());
        return payload;
    }

    private static void putIfPresent(Map<String, Object> payload, String key, String value) {
        if (value != null) {
            payload.put(key, value);
        }
    }

    static String toJson(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize discovery payload", e);
        }
    }
}
