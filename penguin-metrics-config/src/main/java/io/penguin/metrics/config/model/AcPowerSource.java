package io.penguin.metrics.config.model;

import io.penguin.metrics.config.SourceType;

import java.nio.file.Path;
import java.time.Duration;

public record AcPowerSource(String name, String supply, String path, DeviceRef device, Duration updateInterval,
                            MetricFlags metrics, SensorOverrides overrides) implements SourceConfig {

    @Override
    public SourceType type() {
        return SourceType.AC_POWER;
    }

    @Override
    public String target() {
        if (supply != null) {
            return supply;
        }
        return path == null ? null : Path.of(path).getFileName().toString();
    }
}
