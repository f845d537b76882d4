package io.penguin.metrics.config;

/**
 * Raised by the {@link ConfigBinder} when a well-formed document does not describe a valid configuration.
 */
public class ConfigError extends ConfigException {

    public ConfigError(String message, SourcePosition position) {
        super(message, position);
    }

    public ConfigError(String message) {
        super(message, null);
    }
}
