package io.penguin.metrics.config.model;

import io.penguin.metrics.config.SourceType;

import java.nio.file.Path;
import java.time.Duration;

/**
 * @param supply power-supply name such as {@code BAT0}; {@code null} picks the first battery
 * @param path   explicit sysfs directory, wins over {@code supply}
 */
public record BatterySource(String name, String supply, String path, DeviceRef device, Duration updateInterval,
                            MetricFlags metrics, SensorOverrides overrides) implements SourceConfig {

    @Override
    public SourceType type() {
        return SourceType.BATTERY;
    }

    @Override
    public String target() {
        if (supply != null) {
            return supply;
        }
        return path == null ? null : Path.of(path).getFileName().toString();
    }
}
