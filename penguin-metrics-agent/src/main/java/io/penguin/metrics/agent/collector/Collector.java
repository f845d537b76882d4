package io.penguin.metrics.agent.collector;

import io.penguin.metrics.config.SourceType;
import io.penguin.metrics.config.model.SourceConfig;

import java.time.Duration;
import java.util.List;

/**
 * One telemetry source. The orchestrator only talks to sources through this interface:
 * it initializes a collector once, then calls {@link #collect()} on its own schedule.
 */
public interface Collector {

    SourceConfig config();

    /**
     * One-time setup such as resolving the target. Failure stops the collector for good.
     */
    void initialize() throws CollectionException;

    /**
     * One collection cycle. A missing target is reported as a {@link CollectorResult#notFound()} result,
     * not as an exception.
     */
    CollectorResult collect() throws CollectionException;

    /**
     * @return the values this collector publishes, fixed after construction
     */
    List<MetricDescriptor> metrics();

    default SourceType type() {
        return config().type();
    }

    default String id() {
        return config().id();
    }

    default String name() {
        return config().name();
    }

    default Duration updateInterval() {
        return config().updateInterval();
    }

    default boolean enabled() {
        return !metrics().isEmpty();
    }

    /**
     * Unique key of this collector across all source types, e.g. {@code battery/main}.
     */
    default String key() {
        return type().topicSegment() + "/" + id();
    }
}
