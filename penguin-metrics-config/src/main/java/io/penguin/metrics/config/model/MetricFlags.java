package io.penguin.metrics.config.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fully resolved metric switches of one source, in declaration order.
 */
public record MetricFlags(Map<String, Boolean> flags) {

    public MetricFlags {
        flags = Collections.unmodifiableMap(new LinkedHashMap<>(flags));
    }

    public boolean enabled(String metric) {
        return Boolean.TRUE.equals(flags.get(metric));
    }

    public List<String> enabledMetrics() {
        List<String> enabled = new ArrayList<>();
        flags.forEach((name, on) -> {
            if (on) {
                enabled.add(name);
            }
        });
        return enabled;
    }
}
