package io.penguin.metrics.config.model;

import io.penguin.metrics.config.SourceType;

import java.time.Duration;

/**
 * @param blockDevice block device name, e.g. {@code sda1}
 * @param mountpoint  mount point; wins over {@code blockDevice} when both are set
 */
public record DiskSource(String name, String blockDevice, String mountpoint, DeviceRef deviceRef,
                         Duration updateInterval, MetricFlags metrics,
                         SensorOverrides overrides) implements SourceConfig {

    @Override
    public SourceType type() {
        return SourceType.DISK;
    }

    @Override
    public DeviceRef device() {
        return deviceRef;
    }

    @Override
    public String target() {
        return blockDevice;
    }
}
