package io.penguin.metrics.agent.collector;

/**
 * Describes one value a collector publishes and how Home Assistant should present it.
 *
 * @param key    JSON key inside the source payload
 * @param binary published as an {@code ON}/{@code OFF} binary sensor
 */
public record MetricDescriptor(
        String key,
        String name,
        String unit,
        String deviceClass,
        String stateClass,
        String icon,
        boolean binary) {

    public static MetricDescriptor measurement(String key, String name, String unit, String deviceClass, String icon) {
        return new MetricDescriptor(key, name, unit, deviceClass, "measurement", icon, false);
    }

    public static MetricDescriptor total(String key, String name, String unit, String deviceClass, String icon) {
        return new MetricDescriptor(key, name, unit, deviceClass, "total_increasing", icon, false);
    }

    public static MetricDescriptor text(String key, String name, String icon) {
        return new MetricDescriptor(key, name, null, null, null, icon, false);
    }

    public static MetricDescriptor binary(String key, String name, String deviceClass, String icon) {
        return new MetricDescriptor(key, name, null, deviceClass, null, icon, true);
    }
}
