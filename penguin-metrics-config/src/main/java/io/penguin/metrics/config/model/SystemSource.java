package io.penguin.metrics.config.model;

import io.penguin.metrics.config.SourceType;

import java.time.Duration;

public record SystemSource(String name, DeviceRef device, Duration updateInterval,
                           MetricFlags metrics, SensorOverrides overrides) implements SourceConfig {

    @Override
    public SourceType type() {
        return SourceType.SYSTEM;
    }
}
