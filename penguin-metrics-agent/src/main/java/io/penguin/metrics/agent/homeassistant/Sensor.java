package io.penguin.metrics.agent.homeassistant;

import io.penguin.metrics.config.SourceType;

import java.util.Map;

/**
 * One announced Home Assistant entity, reading a single key of its source's JSON payload.
 *
 * @param device {@code null} when the source is configured with {@code device none;}
 * @param extra  override fields without a dedicated component, copied verbatim
 */
public record Sensor(
        String uniqueId,
        String name,
        SourceType sourceType,
        String stateTopic,
        String valueTemplate,
        String unit,
        String deviceClass,
        String stateClass,
        String icon,
        String entityCategory,
        boolean enabledByDefault,
        boolean binary,
        Device device,
        Map<String, Object> extra) {

    public Sensor {
        extra = Map.copyOf(extra);
    }

    /**
     * @return {@code sensor} or {@code binary_sensor}
     */
    public String component() {
        return binary ? "binary_sensor" : "sensor";
    }
}
