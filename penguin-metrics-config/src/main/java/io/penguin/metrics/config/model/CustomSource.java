package io.penguin.metrics.config.model;

import io.penguin.metrics.config.SourceType;

import java.time.Duration;

/**
 * A sensor fed by the output of a shell command or script.
 */
public record CustomSource(String name, String command, String script, OutputType outputType, String unit,
                           double scale, String deviceClass, String stateClass, Duration timeout,
                           DeviceRef device, Duration updateInterval, MetricFlags metrics,
                           SensorOverrides overrides) implements SourceConfig {

    public enum OutputType {
        NUMBER,
        STRING,
        JSON
    }

    @Override
    public SourceType type() {
        return SourceType.CUSTOM;
    }

    /** The shell command line to execute, a script path is run as-is. */
    public String commandLine() {
        return command != null ? command : script;
    }
}
