package io.penguin.metrics.config.model;

import java.util.Map;

/**
 * A {@code device "name" { ... }} template that sources can reference with {@code device "name";}.
 *
 * @param identifier deterministic Home Assistant device identifier
 * @param fields     remaining directives passed through to the device payload
 */
public record DeviceTemplate(String name, String identifier, String displayName, Map<String, Object> fields) {

    public DeviceTemplate {
        fields = Map.copyOf(fields);
    }
}
