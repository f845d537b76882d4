package io.penguin.metrics.config.model;

import java.nio.file.Path;

/**
 * Settings from the {@code homeassistant} block.
 *
 * @param stateFile where the registry of announced sensor ids is persisted
 */
public record HomeAssistantSettings(boolean discovery, String discoveryPrefix, Path stateFile) {

    public static final Path DEFAULT_STATE_FILE = Path.of("/var/lib/penguin-metrics/registered_sensors.json");

    public static HomeAssistantSettings defaults() {
        return new HomeAssistantSettings(true, "homeassistant", DEFAULT_STATE_FILE);
    }
}
