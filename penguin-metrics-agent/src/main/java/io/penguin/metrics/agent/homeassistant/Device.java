package io.penguin.metrics.agent.homeassistant;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A Home Assistant device grouping the sensors of one or more sources.
 *
 * @param viaDevice identifier of the parent device, {@code null} for the host device itself
 * @param extra     additional fields copied verbatim into the payload
 */
public record Device(List<String> identifiers, String name, String manufacturer, String model,
                     String viaDevice, Map<String, Object> extra) {

    public Device {
        identifiers = List.copyOf(identifiers);
        extra = Map.copyOf(extra);
    }

    public String primaryIdentifier() {
        return identifiers.get(0);
    }

    public Map<String, Object> toPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("identifiers", identifiers);
        payload.put("name", name);
        if (manufacturer != null) {
            payload.put("manufacturer", manufacturer);
        }
        if (model != null) {
            payload.put("model", model);
        }
        if (viaDevice != null) {
            payload.put("via_device", viaDevice);
        }
        payload.putAll(extra);
        return payload;
    }
}
