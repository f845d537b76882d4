package io.penguin.metrics.config.model;

import io.penguin.metrics.config.SourceType;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The typed result of binding a configuration document. Immutable.
 *
 * @param autoRefreshInterval how often auto-discovery re-scans; zero means once at startup
 */
public record Config(
        MqttSettings mqtt,
        HomeAssistantSettings homeAssistant,
        LoggingSettings logging,
        DefaultsSettings defaults,
        Duration autoRefreshInterval,
        Map<String, DeviceTemplate> deviceTemplates,
        Map<SourceType, AutoDiscoverySettings> autoDiscovery,
        Map<SourceType, List<SourceConfig>> sources) {

    public Config {
        deviceTemplates = Map.copyOf(deviceTemplates);
        EnumMap<SourceType, AutoDiscoverySettings> auto = new EnumMap<>(SourceType.class);
        auto.putAll(autoDiscovery);
        autoDiscovery = Collections.unmodifiableMap(auto);
        EnumMap<SourceType, List<SourceConfig>> bySource = new EnumMap<>(SourceType.class);
        sources.forEach((type, list) -> bySource.put(type, List.copyOf(list)));
        sources = Collections.unmodifiableMap(bySource);
    }

    public List<SourceConfig> sources(SourceType type) {
        return sources.getOrDefault(type, List.of());
    }

    /** Every manual declaration, system first, then in type order. */
    public List<SourceConfig> allSources() {
        List<SourceConfig> all = new ArrayList<>();
        for (SourceType type : SourceType.values()) {
            all.addAll(sources(type));
        }
        return all;
    }

    public AutoDiscoverySettings autoDiscovery(SourceType type) {
        return autoDiscovery.getOrDefault(type, AutoDiscoverySettings.disabled(type));
    }

    public Optional<DeviceTemplate> deviceTemplate(String name) {
        return Optional.ofNullable(deviceTemplates.get(name));
    }
}
