package io.penguin.metrics.config.model;

import java.util.Map;
import java.util.Optional;

/**
 * Home Assistant fields from a nested {@code homeassistant { }} block of a source,
 * overriding the generated sensor metadata.
 */
public record SensorOverrides(Map<String, Object> fields) {

    public static final SensorOverrides NONE = new SensorOverrides(Map.of());

    public SensorOverrides {
        fields = Map.copyOf(fields);
    }

    public Optional<Object> get(String key) {
        return Optional.ofNullable(fields.get(key));
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }
}
