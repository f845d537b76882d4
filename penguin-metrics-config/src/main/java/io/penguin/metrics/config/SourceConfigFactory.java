package io.penguin.metrics.config;

import io.penguin.metrics.config.model.AcPowerSource;
import io.penguin.metrics.config.model.AutoDiscoverySettings;
import io.penguin.metrics.config.model.BatterySource;
import io.penguin.metrics.config.model.BinarySensorSource;
import io.penguin.metrics.config.model.ContainerSource;
import io.penguin.metrics.config.model.CustomSource;
import io.penguin.metrics.config.model.DefaultsSettings;
import io.penguin.metrics.config.model.DeviceRef;
import io.penguin.metrics.config.model.DiskSource;
import io.penguin.metrics.config.model.Match;
import io.penguin.metrics.config.model.MetricFlags;
import io.penguin.metrics.config.model.ProcessSource;
import io.penguin.metrics.config.model.SensorOverrides;
import io.penguin.metrics.config.model.ServiceSource;
import io.penguin.metrics.config.model.SourceConfig;
import io.penguin.metrics.config.model.SystemSource;
import io.penguin.metrics.config.model.TemperatureSource;

import java.time.Duration;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Builds typed {@link SourceConfig} records out of fully resolved setting values.
 * Used for manual declarations by the binder and for entries found by auto-discovery at runtime.
 */
public final class SourceConfigFactory {

    public static final String THERMAL = "thermal";
    public static final String HWMON = "hwmon";

    private SourceConfigFactory() {
    }

    /**
     * Creates the configuration of an auto-discovered source.
     *
     * @param name   display name of the discovered entry
     * @param target the OS object to bind to: a pid, unit, container name, zone, sysfs path or block device
     */
    public static SourceConfig discovered(SourceType type, String name, String target,
                                          AutoDiscoverySettings auto, DefaultsSettings defaults) {
        Map<String, Object> instance = new HashMap<>(auto.options());
        if (auto.updateInterval() != null) {
            instance.put(SourceSchema.UPDATE_INTERVAL, seconds(auto.updateInterval()));
        }
        if (auto.device() != null && auto.device().kind() != DeviceRef.Kind.AUTO) {
            instance.put(SourceSchema.DEVICE, auto.device().toString());
        }
        switch (type) {
            case PROCESS -> instance.put("match", new Match(Match.Kind.PID, target));
            case SERVICE -> instance.put("match", new Match(Match.Kind.UNIT, target));
            case CONTAINER -> instance.put("match", new Match(Match.Kind.NAME, target));
            case TEMPERATURE -> instance.put(HWMON.equals(auto.source()) ? "path" : "zone", target);
            case BATTERY, AC_POWER -> instance.put("name", target);
            case DISK -> instance.put("path", target);
            default -> throw new IllegalArgumentException("Source type " + type + " is not discoverable");
        }
        return create(type, name, defaults.resolve(type, instance), SensorOverrides.NONE);
    }

    /**
     * @param values every setting of {@code type}, already resolved through the default cascade
     */
    public static SourceConfig create(SourceType type, String name, Map<String, Object> values,
                                      SensorOverrides overrides) {
        Values v = new Values(values);
        DeviceRef device = DeviceRef.parse(v.string(SourceSchema.DEVICE));
        Duration interval = duration(v.number(SourceSchema.UPDATE_INTERVAL));
        MetricFlags metrics = metrics(type, values);
        return switch (type) {
            case SYSTEM -> new SystemSource(name, device, interval, metrics, overrides);
            case PROCESS -> new ProcessSource(name, v.match(new Match(Match.Kind.NAME, name)),
                    v.bool("aggregate"), device, interval, metrics, overrides);
            case SERVICE -> new ServiceSource(name, v.match(new Match(Match.Kind.UNIT, defaultUnit(name))),
                    device, interval, metrics, overrides);
            case CONTAINER -> new ContainerSource(name, v.match(new Match(Match.Kind.NAME, name)),
                    device, interval, metrics, overrides);
            case TEMPERATURE -> new TemperatureSource(name, v.string("zone"), v.string("hwmon"), v.string("path"),
                    device, interval, metrics, overrides);
            case BATTERY -> new BatterySource(name, v.string("name"), v.string("path"),
                    device, interval, metrics, overrides);
            case AC_POWER -> new AcPowerSource(name, v.string("name"), v.string("path"),
                    device, interval, metrics, overrides);
            case DISK -> new DiskSource(name, v.string("path"), v.string("mountpoint"),
                    device, interval, metrics, overrides);
            case CUSTOM -> new CustomSource(name, v.string("command"), v.string("script"),
                    CustomSource.OutputType.valueOf(v.string("type").toUpperCase(Locale.ROOT)),
                    v.string("unit"), v.number("scale"), v.string("device_class"), v.string("state_class"),
                    duration(v.number("timeout")), device, interval, metrics, overrides);
            case BINARY_SENSOR -> new BinarySensorSource(name, v.string("command"), v.string("script"),
                    BinarySensorSource.ValueSource.valueOf(v.string("value_source").toUpperCase(Locale.ROOT)),
                    v.bool("invert"), duration(v.number("timeout")), device, interval, metrics, overrides);
        };
    }

    static String defaultUnit(String name) {
        return name.endsWith(".service") ? name : name + ".service";
    }

    private static MetricFlags metrics(SourceType type, Map<String, Object> values) {
        Map<String, Boolean> flags = new LinkedHashMap<>();
        for (String metric : SourceSchema.metricNames(type)) {
            flags.put(metric, Boolean.TRUE.equals(values.get(metric)));
        }
        return new MetricFlags(flags);
    }

    public static Duration duration(double seconds) {
        return Duration.ofNanos(Math.round(seconds * 1_000_000_000L));
    }

    static double seconds(Duration duration) {
        return duration.toNanos() / 1_000_000_000.0;
    }

    private record Values(Map<String, Object> values) {

        String string(String key) {
            Object value = values.get(key);
            return value == null ? null : value.toString();
        }

        boolean bool(String key) {
            return Boolean.TRUE.equals(values.get(key));
        }

        double number(String key) {
            return ((Number) values.get(key)).doubleValue();
        }

        Match match(Match fallback) {
            Object value = values.get("match");
            return value instanceof Match match ? match : fallback;
        }
    }
}
