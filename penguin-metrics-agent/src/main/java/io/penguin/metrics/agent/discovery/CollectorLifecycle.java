package io.penguin.metrics.agent.discovery;

import io.penguin.metrics.config.SourceType;
import io.penguin.metrics.config.model.SourceConfig;

/**
 * What the reconciler needs from the owner of the live collector table.
 */
public interface CollectorLifecycle {

    /**
     * Creates, initializes, announces and schedules an auto-discovered source.
     *
     * @return {@code false} when the source could not be started or its identity is already taken
     */
    boolean add(SourceConfig source);

    /**
     * Stops, retracts and discards an auto-discovered source.
     */
    void remove(SourceType type, String id);
}
