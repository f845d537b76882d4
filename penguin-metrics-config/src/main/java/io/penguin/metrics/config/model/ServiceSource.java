package io.penguin.metrics.config.model;

import io.penguin.metrics.config.SourceType;

import java.time.Duration;

public record ServiceSource(String name, Match match, DeviceRef device, Duration updateInterval,
                            MetricFlags metrics, SensorOverrides overrides) implements SourceConfig {

    @Override
    public SourceType type() {
        return SourceType.SERVICE;
    }

    @Override
    public String target() {
        return match.kind() == Match.Kind.UNIT ? match.value() : null;
    }
}
