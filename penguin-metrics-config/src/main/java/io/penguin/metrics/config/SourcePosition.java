package io.penguin.metrics.config;

import java.nio.file.Path;

/**
 * Location of a token, directive or block inside a configuration file.
 *
 * @param file   the file the text was read from, or {@code null} for in-memory text
 * @param line   1-based line
 * @param column 1-based column
 */
public record SourcePosition(Path file, int line, int column) {

    public static SourcePosition of(Path file, int line, int column) {
        return new SourcePosition(file, line, column);
    }

    @Override
    public String toString() {
        String name = file == null ? "<config>" : file.toString();
        return name + ":" + line + ":" + column;
    }
}
