package io.penguin.metrics.config.model;

import io.penguin.metrics.config.Identifiers;
import io.penguin.metrics.config.SourceType;

import java.time.Duration;

/**
 * A fully resolved source declaration, either written in the configuration file or created
 * for an auto-discovered entry. All defaults have already been applied.
 */
public sealed interface SourceConfig
        permits SystemSource, ProcessSource, ServiceSource, ContainerSource, TemperatureSource,
        BatterySource, AcPowerSource, DiskSource, CustomSource, BinarySensorSource {

    SourceType type();

    /** Display name as written, e.g. {@code "Main Battery"}. */
    String name();

    DeviceRef device();

    Duration updateInterval();

    MetricFlags metrics();

    SensorOverrides overrides();

    /** Stable identifier derived from the name, e.g. {@code main_battery}. */
    default String id() {
        return Identifiers.sanitize(name());
    }

    /**
     * The OS object this declaration is bound to, used to keep auto-discovery away from it.
     * {@code null} when the binding is only known at runtime.
     */
    default String target() {
        return null;
    }
}
