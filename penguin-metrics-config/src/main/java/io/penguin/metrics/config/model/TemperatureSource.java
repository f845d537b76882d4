package io.penguin.metrics.config.model;

import io.penguin.metrics.config.SourceType;

import java.time.Duration;

/**
 * A temperature sensor found by thermal zone name, hwmon sensor name or direct sysfs path.
 * When none is given the source name is used as the thermal zone type.
 */
public record TemperatureSource(String name, String zone, String hwmon, String path, DeviceRef device,
                                Duration updateInterval, MetricFlags metrics,
                                SensorOverrides overrides) implements SourceConfig {

    @Override
    public SourceType type() {
        return SourceType.TEMPERATURE;
    }

    @Override
    public String target() {
        if (path != null) {
            return path;
        }
        return zone != null ? zone : hwmon;
    }
}
