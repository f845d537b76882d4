package io.penguin.metrics.config.model;

import io.penguin.metrics.config.Glob;
import io.penguin.metrics.config.SourceType;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * One auto-discovery block such as {@code batteries { auto on; filter "BAT*"; }}.
 *
 * @param source         temperature only: {@code thermal} or {@code hwmon}
 * @param updateInterval interval override for discovered sources, {@code null} to use the defaults
 * @param options        per-metric boolean overrides and other settings applied to every discovered source
 */
public record AutoDiscoverySettings(
        SourceType type,
        boolean enabled,
        List<Glob> filters,
        List<Glob> excludes,
        String source,
        DeviceRef device,
        Duration updateInterval,
        Map<String, Object> options) {

    public AutoDiscoverySettings {
        filters = List.copyOf(filters);
        excludes = List.copyOf(excludes);
        options = Map.copyOf(options);
    }

    public static AutoDiscoverySettings disabled(SourceType type) {
        return new AutoDiscoverySettings(type, false, List.of(), List.of(), null, DeviceRef.AUTO, null, Map.of());
    }

    /**
     * An entry is accepted when none of its names hits an exclude, and one of them hits a
     * filter (or no filter is configured).
     */
    public boolean accepts(Collection<String> names) {
        for (Glob exclude : excludes) {
            for (String name : names) {
                if (exclude.matches(name)) {
                    return false;
                }
            }
        }
        if (filters.isEmpty()) {
            return true;
        }
        for (Glob filter : filters) {
            for (String name : names) {
                if (filter.matches(name)) {
                    return true;
                }
            }
        }
        return false;
    }
}
