package io.penguin.metrics.config.model;

/**
 * Settings from the {@code logging} block.
 *
 * @param file          optional log file, {@code null} for console only
 * @param fileMaxSizeMb size at which the log file is rotated
 * @param fileKeep      number of rotated files kept
 * @param format        Logback pattern, {@code null} for the built-in one
 */
public record LoggingSettings(
        String level,
        String file,
        String fileLevel,
        long fileMaxSizeMb,
        int fileKeep,
        boolean colors,
        String format) {

    public static LoggingSettings defaults() {
        return new LoggingSettings("info", null, "debug", 10, 5, true, null);
    }
}
