package io.penguin.metrics.agent.collector;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The outcome of one collection cycle.
 *
 * @param state     value of the payload's {@code state} field, matched by the availability template
 * @param available whether the source could be read at all
 * @param error     failure description, {@code null} on success
 */
public record CollectorResult(Map<String, Object> metrics, String state, boolean available, String error,
                              Instant timestamp) {

    public static final String ONLINE = "online";
    public static final String NOT_FOUND = "not_found";
    public static final String ERROR = "error";

    public CollectorResult {
        metrics = Collections.unmodifiableMap(new LinkedHashMap<>(metrics));
    }

    public static CollectorResult of(String state, Map<String, Object> metrics) {
        return new CollectorResult(metrics, state, true, null, Instant.now());
    }

    public static CollectorResult online(Map<String, Object> metrics) {
        return of(ONLINE, metrics);
    }

    public static CollectorResult notFound() {
        return new CollectorResult(Map.of(), NOT_FOUND, false, null, Instant.now());
    }

    public static CollectorResult failed(String error) {
        return new CollectorResult(Map.of(), ERROR, false, error, Instant.now());
    }

    /**
     * @return the JSON object published on the source topic
     */
    public Map<String, Object> toPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        metrics.forEach((key, value) -> {
            if (value != null) {
                payload.put(key, value);
            }
        });
        payload.put("state", state);
        if (error != null) {
            payload.put("error", error);
        }
        return payload;
    }
}
