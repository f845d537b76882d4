package io.penguin.metrics.config.model;

/**
 * How a process, service or container declaration finds its target.
 */
public record Match(Kind kind, String value) {

    public enum Kind {
        /** Exact process name (comm) or container name. */
        NAME,
        /** Regular expression on the command line, unit name or container name. */
        PATTERN,
        PID,
        PIDFILE,
        /** Substring of the full command line. */
        CMDLINE,
        UNIT,
        IMAGE,
        LABEL
    }

    @Override
    public String toString() {
        return kind.name().toLowerCase() + " \"" + value + "\"";
    }
}
