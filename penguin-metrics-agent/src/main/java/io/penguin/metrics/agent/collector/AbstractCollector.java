package io.penguin.metrics.agent.collector;

import io.penguin.metrics.config.model.SourceConfig;

import java.util.ArrayList;
import java.util.List;

/**
 * Base class holding the configuration and the metric list built from enabled flags.
 */
public abstract class AbstractCollector<C extends SourceConfig> implements Collector {

    protected final C config;
    private final List<MetricDescriptor> metrics;

    protected AbstractCollector(C config) {
        this.config = config;
        List<MetricDescriptor> declared = new ArrayList<>();
        declareMetrics(declared);
        this.metrics = List.copyOf(declared);
    }

    /**
     * Adds the descriptors of all enabled metrics. Called once from the constructor,
     * so implementations must only read {@link #config}.
     */
    protected abstract void declareMetrics(List<MetricDescriptor> metrics);

    @Override
    public C config() {
        return config;
    }

    @Override
    public void initialize() throws CollectionException {
    }

    @Override
    public List<MetricDescriptor> metrics() {
        return metrics;
    }

    protected boolean enabled(String metric) {
        return config.metrics().enabled(metric);
    }

    protected static double round(double value, int places) {
        double scale = Math.pow(10, places);
        return Math.round(value * scale) / scale;
    }

    protected static double mib(long bytes) {
        return round(bytes / (1024.0 * 1024.0), 2);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" + key() + "}";
    }
}
