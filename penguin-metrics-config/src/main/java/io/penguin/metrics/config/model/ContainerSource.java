package io.penguin.metrics.config.model;

import io.penguin.metrics.config.SourceType;

import java.time.Duration;

public record ContainerSource(String name, Match match, DeviceRef device, Duration updateInterval,
                              MetricFlags metrics, SensorOverrides overrides) implements SourceConfig {

    @Override
    public SourceType type() {
        return SourceType.CONTAINER;
    }

    @Override
    public String target() {
        return match.kind() == Match.Kind.NAME ? match.value() : null;
    }
}
