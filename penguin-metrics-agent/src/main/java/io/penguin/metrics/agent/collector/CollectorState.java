package io.penguin.metrics.agent.collector;

public enum CollectorState {
    CREATED,
    INITIALIZING,
    RUNNING,
    /** The last cycle failed; the collector stays scheduled. */
    DEGRADED,
    STOPPED
}
