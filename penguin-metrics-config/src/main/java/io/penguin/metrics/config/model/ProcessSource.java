package io.penguin.metrics.config.model;

import io.penguin.metrics.config.SourceType;

import java.time.Duration;

/**
 * @param aggregate sum every matching process into one payload instead of following the first match
 */
public record ProcessSource(String name, Match match, boolean aggregate, DeviceRef device, Duration updateInterval,
                            MetricFlags metrics, SensorOverrides overrides) implements SourceConfig {

    @Override
    public SourceType type() {
        return SourceType.PROCESS;
    }

    @Override
    public String target() {
        return match.kind() == Match.Kind.PID || match.kind() == Match.Kind.NAME ? match.value() : null;
    }
}
