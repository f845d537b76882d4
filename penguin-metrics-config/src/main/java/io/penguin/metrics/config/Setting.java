package io.penguin.metrics.config;

/**
 * One recognised directive of a source block.
 *
 * @param cascade whether the value may also come from {@code defaults}
 * @param metric  whether this is a boolean switch turning a metric family on or off
 */
public record Setting(String name, Kind kind, Object defaultValue, boolean cascade, boolean metric) {

    public enum Kind {
        BOOLEAN,
        DURATION,
        INTEGER,
        NUMBER,
        STRING,
        MATCH
    }

    static Setting flag(String name, boolean enabled) {
        return new Setting(name, Kind.BOOLEAN, enabled, true, true);
    }

    static Setting option(String name, Kind kind, Object defaultValue) {
        return new Setting(name, kind, defaultValue, true, false);
    }

    static Setting instance(String name, Kind kind) {
        return new Setting(name, kind, null, false, false);
    }
}
