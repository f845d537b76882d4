package io.penguin.metrics.config.model;

import io.penguin.metrics.config.Setting;
import io.penguin.metrics.config.SourceSchema;
import io.penguin.metrics.config.SourceType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The {@code defaults} block: global values plus per-type nested blocks.
 *
 * <p>A setting resolves as instance, then {@code defaults { <type> { } }}, then global
 * {@code defaults}, then the built-in default from {@link SourceSchema}.
 */
public record DefaultsSettings(Map<String, Object> global, Map<SourceType, Map<String, Object>> perType) {

    public DefaultsSettings {
        global = Map.copyOf(global);
        EnumMap<SourceType, Map<String, Object>> copy = new EnumMap<>(SourceType.class);
        perType.forEach((type, values) -> copy.put(type, Map.copyOf(values)));
        perType = Collections.unmodifiableMap(copy);
    }

    public static DefaultsSettings empty() {
        return new DefaultsSettings(Map.of(), Map.of());
    }

    /**
     * Resolves every cascading setting of {@code type}, then lays {@code instance} values on top.
     * Values of instance-only settings are taken from {@code instance} alone.
     */
    public Map<String, Object> resolve(SourceType type, Map<String, Object> instance) {
        Map<String, Object> typeValues = perType.getOrDefault(type, Map.of());
        Map<String, Object> resolved = new LinkedHashMap<>();
        for (Setting setting : SourceSchema.settings(type).values()) {
            Object value = setting.defaultValue();
            if (setting.cascade()) {
                if (global.containsKey(setting.name())) {
                    value = global.get(setting.name());
                }
                if (typeValues.containsKey(setting.name())) {
                    value = typeValues.get(setting.name());
                }
            }
            if (instance.containsKey(setting.name())) {
                value = instance.get(setting.name());
            }
            resolved.put(setting.name(), value);
        }
        return resolved;
    }
}
