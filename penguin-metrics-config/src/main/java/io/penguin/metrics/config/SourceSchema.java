package io.penguin.metrics.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static io.penguin.metrics.config.Setting.Kind.BOOLEAN;
import static io.penguin.metrics.config.Setting.Kind.DURATION;
import static io.penguin.metrics.config.Setting.Kind.MATCH;
import static io.penguin.metrics.config.Setting.Kind.NUMBER;
import static io.penguin.metrics.config.Setting.Kind.STRING;
import static io.penguin.metrics.config.Setting.flag;
import static io.penguin.metrics.config.Setting.instance;
import static io.penguin.metrics.config.Setting.option;

/**
 * Recognised directives per source type, with their kinds and built-in defaults.
 * Both validation (unknown directive warnings) and the default cascade are driven from this table.
 */
public final class SourceSchema {

    public static final String UPDATE_INTERVAL = "update_interval";
    public static final String DEVICE = "device";
    public static final double DEFAULT_UPDATE_INTERVAL = 10.0;

    private static final Map<SourceType, Map<String, Setting>> SETTINGS = new EnumMap<>(SourceType.class);

    static {
        register(SourceType.SYSTEM,
                flag("cpu", true),
                flag("cpu_per_core", false),
                flag("memory", true),
                flag("swap", true),
                flag("load", true),
                flag("uptime", true),
                flag("gpu", false));

        register(SourceType.PROCESS,
                instance("match", MATCH),
                flag("cpu", true),
                flag("memory", true),
                flag("smaps", false),
                flag("disk", false),
                flag("disk_rate", false),
                flag("fds", false),
                flag("threads", false),
                option("aggregate", BOOLEAN, false));

        register(SourceType.SERVICE,
                instance("match", MATCH),
                flag("cpu", true),
                flag("memory", true),
                flag("smaps", false),
                flag("state", true),
                flag("restart_count", false),
                flag("disk", false),
                flag("disk_rate", false));

        register(SourceType.CONTAINER,
                instance("match", MATCH),
                flag("cpu", true),
                flag("memory", true),
                flag("network", false),
                flag("network_rate", false),
                flag("disk", false),
                flag("disk_rate", false),
                flag("state", true),
                flag("health", false),
                flag("uptime", false));

        register(SourceType.TEMPERATURE,
                instance("zone", STRING),
                instance("hwmon", STRING),
                instance("path", STRING));

        register(SourceType.BATTERY,
                instance("name", STRING),
                instance("path", STRING),
                flag("capacity", true),
                flag("voltage", true),
                flag("current", true),
                flag("power", true),
                flag("health", true),
                flag("energy_now", true),
                flag("energy_full", true),
                flag("energy_full_design", true),
                flag("cycles", false),
                flag("temperature", false),
                flag("time_to_empty", false),
                flag("time_to_full", false),
                flag("present", false),
                flag("technology", false),
                flag("voltage_max", false),
                flag("voltage_min", false),
                flag("voltage_max_design", false),
                flag("voltage_min_design", false),
                flag("constant_charge_current", false),
                flag("constant_charge_current_max", false),
                flag("charge_full_design", false));

        register(SourceType.AC_POWER,
                instance("name", STRING),
                instance("path", STRING));

        register(SourceType.DISK,
                instance("path", STRING),
                instance("mountpoint", STRING),
                flag("total", true),
                flag("used", true),
                flag("free", true),
                flag("percent", true));

        register(SourceType.CUSTOM,
                instance("command", STRING),
                instance("script", STRING),
                option("type", STRING, "number"),
                option("unit", STRING, null),
                option("scale", NUMBER, 1.0),
                option("device_class", STRING, null),
                option("state_class", STRING, null),
                option("timeout", DURATION, 5.0));

        register(SourceType.BINARY_SENSOR,
                instance("command", STRING),
                instance("script", STRING),
                option("value_source", STRING, "returncode"),
                option("invert", BOOLEAN, false),
                option("timeout", DURATION, 5.0));
    }

    private SourceSchema() {
    }

    private static void register(SourceType type, Setting... settings) {
        Map<String, Setting> byName = new LinkedHashMap<>();
        byName.put(UPDATE_INTERVAL, option(UPDATE_INTERVAL, DURATION, DEFAULT_UPDATE_INTERVAL));
        byName.put(DEVICE, option(DEVICE, STRING, null));
        for (Setting setting : settings) {
            byName.put(setting.name(), setting);
        }
        SETTINGS.put(type, Collections.unmodifiableMap(byName));
    }

    public static Map<String, Setting> settings(SourceType type) {
        return SETTINGS.get(type);
    }

    public static Optional<Setting> setting(SourceType type, String name) {
        return Optional.ofNullable(SETTINGS.get(type).get(name));
    }

    /**
     * @return metric switch names in declaration order
     */
    public static List<String> metricNames(SourceType type) {
        List<String> names = new ArrayList<>();
        for (Setting setting : SETTINGS.get(type).values()) {
            if (setting.metric()) {
                names.add(setting.name());
            }
        }
        return names;
    }

    /**
     * @return every directive that may appear directly inside the global {@code defaults} block
     */
    public static Set<String> globalDefaultNames() {
        Set<String> names = new LinkedHashSet<>();
        for (Map<String, Setting> settings : SETTINGS.values()) {
            for (Setting setting : settings.values()) {
                if (setting.cascade()) {
                    names.add(setting.name());
                }
            }
        }
        return names;
    }
}
