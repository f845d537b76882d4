package io.penguin.metrics.config.model;

import io.penguin.metrics.config.SourceType;

import java.time.Duration;

/**
 * An on/off sensor derived from a command's exit code or output.
 */
public record BinarySensorSource(String name, String command, String script, ValueSource valueSource,
                                 boolean invert, Duration timeout, DeviceRef device, Duration updateInterval,
                                 MetricFlags metrics, SensorOverrides overrides) implements SourceConfig {

    public enum ValueSource {
        RETURNCODE,
        OUTPUT
    }

    @Override
    public SourceType type() {
        return SourceType.BINARY_SENSOR;
    }

    public String commandLine() {
        return command != null ? command : script;
    }
}
