package io.penguin.metrics.config;

/**
 * Base class for every failure raised while loading a configuration file.
 * The message always starts with the location of the offending text when one is known.
 */
public class ConfigException extends Exception {

    private final SourcePosition position;

    public ConfigException(String message, SourcePosition position) {
        super(position == null ? message : position + ": " + message);
        this.position = position;
    }

    public ConfigException(String message, SourcePosition position, Throwable cause) {
        super(position == null ? message : position + ": " + message, cause);
        this.position = position;
    }

    /**
     * @return where the error was detected, may be {@code null}
     */
    public SourcePosition getPosition() {
        return position;
    }
}
