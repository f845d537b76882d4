package io.penguin.metrics.agent.homeassistant;

import io.penguin.metrics.agent.collector.Collector;
import io.penguin.metrics.agent.collector.MetricDescriptor;
import io.penguin.metrics.config.SourceType;
import io.penguin.metrics.config.model.SensorOverrides;
import io.penguin.metrics.config.model.SourceConfig;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds the sensors of a collector from its declared metrics and the source's overrides.
 * Unique ids and topics depend only on source type, source id and metric key.
 */
public class SensorFactory {

    private static final Set<String> KNOWN_OVERRIDES = Set.of("name", "icon", "unit_of_measurement",
            "device_class", "state_class", "entity_category", "enabled_by_default");

    private final String topicPrefix;

    public SensorFactory(String topicPrefix) {
        this.topicPrefix = topicPrefix;
    }

    public String stateTopic(SourceConfig source) {
        if (source.type() == SourceType.SYSTEM) {
            return topicPrefix + "/system";
        }
        return topicPrefix + "/" + source.type().topicSegment() + "/" + source.id();
    }

    public static String uniqueId(SourceType type, String id, String key) {
        if (type == SourceType.SYSTEM) {
            return "system_" + key;
        }
        return type.topicSegment() + "_" + id + "_" + key;
    }

    public List<Sensor> sensors(Collector collector, Device device) {
        SourceConfig source = collector.config();
        SensorOverrides overrides = source.overrides();
        List<MetricDescriptor> metrics = collector.metrics();
        boolean single = metrics.size() == 1;
        Map<String, Object> extra = new HashMap<>();
        overrides.fields().forEach((key, value) -> {
            if (!KNOWN_OVERRIDES.contains(key)) {
                extra.put(key, value);
            }
        });

        List<Sensor> sensors = new ArrayList<>();
        for (MetricDescriptor metric : metrics) {
            String name = single ? text(overrides, "name", metric.name()) : metric.name();
            sensors.add(new Sensor(
                    uniqueId(source.type(), source.id(), metric.key()),
                    name,
                    source.type(),
                    stateTopic(source),
                    "{{ value_json." + metric.key() + " }}",
                    text(overrides, "unit_of_measurement", metric.unit()),
                    text(overrides, "device_class", metric.deviceClass()),
                    text(overrides, "state_class", metric.stateClass()),
                    text(overrides, "icon", metric.icon()),
                    text(overrides, "entity_category", null),
                    overrides.get("enabled_by_default").map(Boolean.TRUE::equals).orElse(true),
                    metric.binary(),
                    device,
                    extra));
        }
        return sensors;
    }

    private static String text(SensorOverrides overrides, String key, String fallback) {
        return overrides.get(key).map(Object::toString).orElse(fallback);
    }
}
