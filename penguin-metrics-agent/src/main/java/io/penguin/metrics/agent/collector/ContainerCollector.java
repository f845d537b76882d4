package io.penguin.metrics.agent.collector;

import io.penguin.metrics.agent.probe.ContainerInfo;
import io.penguin.metrics.agent.probe.ContainerRuntime;
import io.penguin.metrics.agent.probe.ContainerStats;
import io.penguin.metrics.config.model.ContainerSource;
import io.penguin.metrics.config.model.Match;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Resource usage of one Docker container. The payload state is the runtime state, so sensors
 * go unavailable as soon as the container stops running.
 */
public class ContainerCollector extends AbstractCollector<ContainerSource> {

    private final ContainerRuntime runtime;
    private final Clock clock;
    private final Pattern pattern;

    private String containerId;
    private ContainerStats previous;
    private Instant previousAt;

    public ContainerCollector(ContainerSource config, ContainerRuntime runtime) {
        this(config, runtime, Clock.systemUTC());
    }

    ContainerCollector(ContainerSource config, ContainerRuntime runtime, Clock clock) {
        super(config);
        this.runtime = runtime;
        this.clock = clock;
        this.pattern = config.match().kind() == Match.Kind.PATTERN ? Pattern.compile(config.match().value()) : null;
    }

    @Override
    protected void declareMetrics(List<MetricDescriptor> metrics) {
        if (enabled("state")) {
            metrics.add(MetricDescriptor.text("state", "State", "mdi:docker"));
        }
        if (enabled("cpu")) {
            metrics.add(MetricDescriptor.measurement("cpu_percent", "CPU Usage", "%", null, "mdi:cpu-64-bit"));
        }
        if (enabled("memory")) {
            metrics.add(MetricDescriptor.measurement("memory", "Memory", "MiB", "data_size", "mdi:memory"));
            metrics.add(MetricDescriptor.measurement("memory_percent", "Memory Usage", "%", null, "mdi:memory"));
        }
        if (enabled("network")) {
            metrics.add(MetricDescriptor.total("network_rx", "Network Received", "MiB", "data_size", "mdi:download-network"));
            metrics.add(MetricDescriptor.total("network_tx", "Network Sent", "MiB", "data_size", "mdi:upload-network"));
        }
        if (enabled("network_rate")) {
            metrics.add(MetricDescriptor.measurement("network_rx_rate", "Network Receive Rate", "KiB/s", "data_rate", "mdi:download-network"));
            metrics.add(MetricDescriptor.measurement("network_tx_rate", "Network Send Rate", "KiB/s", "data_rate", "mdi:upload-network"));
        }
        if (enabled("disk")) {
            metrics.add(MetricDescriptor.total("disk_read", "Disk Read", "MiB", "data_size", "mdi:harddisk"));
            metrics.add(MetricDescriptor.total("disk_write", "Disk Write", "MiB", "data_size", "mdi:harddisk"));
        }
        if (enabled("disk_rate")) {
            metrics.add(MetricDescriptor.measurement("disk_read_rate", "Disk Read Rate", "KiB/s", "data_rate", "mdi:speedometer"));
            metrics.add(MetricDescriptor.measurement("disk_write_rate", "Disk Write Rate", "KiB/s", "data_rate", "mdi:speedometer"));
        }
        if (enabled("health")) {
            metrics.add(MetricDescriptor.text("health", "Health", "mdi:heart-pulse"));
        }
        if (enabled("uptime")) {
            metrics.add(MetricDescriptor.measurement("uptime", "Uptime", "s", "duration", "mdi:timer-outline"));
        }
    }

    @Override
    public CollectorResult collect() throws CollectionException {
        try {
            Optional<ContainerInfo> found = resolve();
            if (found.isEmpty()) {
                containerId = null;
                previous = null;
                return CollectorResult.notFound();
            }
            ContainerInfo container = found.get();
            containerId = container.id();
            String state = container.state() == null ? "unknown" : container.state();
            Map<String, Object> values = new LinkedHashMap<>();
            if (enabled("health")) {
                values.put("health", container.health());
            }
            if (enabled("uptime")) {
                values.put("uptime", "running".equals(state) ? uptime(container.startedAt()) : 0L);
            }
            if (!"running".equals(state)) {
                previous = null;
                return CollectorResult.of(state, values);
            }
            ContainerStats stats = runtime.stats(container.id());
            Instant now = clock.instant();
            double seconds = previousAt == null ? 0 : Duration.between(previousAt, now).toNanos() / 1e9;
            if (enabled("cpu")) {
                values.put("cpu_percent", round(stats.cpuPercent(), 1));
            }
            if (enabled("memory")) {
                values.put("memory", mib(stats.memoryUsage()));
                values.put("memory_percent", round(stats.memoryPercent(), 1));
            }
            if (enabled("network")) {
                values.put("network_rx", mib(stats.networkRx()));
                values.put("network_tx", mib(stats.networkTx()));
            }
            if (enabled("network_rate")) {
                values.put("network_rx_rate", rate(previous == null ? null : previous.networkRx(), stats.networkRx(), seconds));
                values.put("network_tx_rate", rate(previous == null ? null : previous.networkTx(), stats.networkTx(), seconds));
            }
            if (enabled("disk")) {
                values.put("disk_read", mib(stats.blockRead()));
                values.put("disk_write", mib(stats.blockWrite()));
            }
            if (enabled("disk_rate")) {
                values.put("disk_read_rate", rate(previous == null ? null : previous.blockRead(), stats.blockRead(), seconds));
                values.put("disk_write_rate", rate(previous == null ? null : previous.blockWrite(), stats.blockWrite(), seconds));
            }
            previous = stats;
            previousAt = now;
            return CollectorResult.of(state, values);
        } catch (IOException e) {
            throw new CollectionException("Cannot query container " + config.match().value() + ": " + e.getMessage(), e);
        }
    }

    private Optional<ContainerInfo> resolve() throws IOException {
        if (containerId != null) {
            Optional<ContainerInfo> known = runtime.inspect(containerId);
            if (known.isPresent()) {
                return known;
            }
        }
        Match match = config.match();
        if (match.kind() == Match.Kind.NAME) {
            return runtime.inspect(match.value());
        }
        for (ContainerInfo candidate : runtime.list(true)) {
            if (matches(candidate, match)) {
                return runtime.inspect(candidate.id());
            }
        }
        return Optional.empty();
    }

    private boolean matches(ContainerInfo container, Match match) {
        return switch (match.kind()) {
            case PATTERN -> pattern.matcher(container.name()).find();
            case IMAGE -> container.image() != null
                    && (container.image().equals(match.value()) || container.image().startsWith(match.value() + ":"));
            case LABEL -> {
                int eq = match.value().indexOf('=');
                if (eq < 0) {
                    yield container.labels().containsKey(match.value());
                }
                yield match.value().substring(eq + 1).equals(container.labels().get(match.value().substring(0, eq)));
            }
            default -> container.name().equals(match.value());
        };
    }

    private long uptime(String startedAt) {
        if (startedAt == null || startedAt.isEmpty()) {
            return 0;
        }
        try {
            return Math.max(0, Duration.between(Instant.parse(startedAt), clock.instant()).getSeconds());
        } catch (DateTimeParseException e) {
            return 0;
        }
    }

    private static double rate(Long before, long after, double seconds) {
        if (before == null || seconds <= 0) {
            return 0.0;
        }
        return round(Math.max(0, after - before) / seconds / 1024.0, 1);
    }
}
