package io.penguin.metrics.agent.collector;

import io.penguin.metrics.agent.probe.ProcessSample;
import io.penguin.metrics.agent.probe.ProcessTable;
import io.penguin.metrics.agent.probe.SystemdClient;
import io.penguin.metrics.config.model.Match;
import io.penguin.metrics.config.model.ServiceSource;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * State and resource usage of a systemd service, read from the unit's accounting properties.
 */
public class ServiceCollector extends AbstractCollector<ServiceSource> {

    static final List<String> PROPERTIES = List.of("LoadState", "ActiveState", "SubState", "NRestarts",
            "CPUUsageNSec", "MemoryCurrent", "IOReadBytes", "IOWriteBytes", "ControlGroup");

    private final SystemdClient systemd;
    private final ProcessTable processes;
    private final Path cgroupRoot;
    private final Clock clock;
    private final Pattern pattern;

    private String unit;
    private Long previousCpuNanos;
    private Long previousRead;
    private Long previousWrite;
    private Instant previousAt;

    public ServiceCollector(ServiceSource config, SystemdClient systemd, ProcessTable processes, Path cgroupRoot) {
        this(config, systemd, processes, cgroupRoot, Clock.systemUTC());
    }

    ServiceCollector(ServiceSource config, SystemdClient systemd, ProcessTable processes, Path cgroupRoot, Clock clock) {
        super(config);
        this.systemd = systemd;
        this.processes = processes;
        this.cgroupRoot = cgroupRoot;
        this.clock = clock;
        this.pattern = config.match().kind() == Match.Kind.PATTERN ? Pattern.compile(config.match().value()) : null;
    }

    @Override
    protected void declareMetrics(List<MetricDescriptor> metrics) {
        if (enabled("state")) {
            metrics.add(MetricDescriptor.text("state", "State", "mdi:cog"));
            metrics.add(MetricDescriptor.text("sub_state", "Sub State", "mdi:cog-outline"));
        }
        if (enabled("cpu")) {
            metrics.add(MetricDescriptor.measurement("cpu_percent", "CPU Usage", "%", null, "mdi:cpu-64-bit"));
        }
        if (enabled("memory")) {
            metrics.add(MetricDescriptor.measurement("memory", "Memory", "MiB", "data_size", "mdi:memory"));
        }
        if (enabled("smaps")) {
            metrics.add(MetricDescriptor.measurement("memory_pss", "Memory PSS", "MiB", "data_size", "mdi:memory"));
            metrics.add(MetricDescriptor.measurement("memory_uss", "Memory USS", "MiB", "data_size", "mdi:memory"));
        }
        if (enabled("restart_count")) {
            metrics.add(MetricDescriptor.total("restarts", "Restarts", null, null, "mdi:restart"));
        }
        if (enabled("disk")) {
            metrics.add(MetricDescriptor.total("disk_read", "Disk Read", "MiB", "data_size", "mdi:harddisk"));
            metrics.add(MetricDescriptor.total("disk_write", "Disk Write", "MiB", "data_size", "mdi:harddisk"));
        }
        if (enabled("disk_rate")) {
            metrics.add(MetricDescriptor.measurement("disk_read_rate", "Disk Read Rate", "KiB/s", "data_rate", "mdi:speedometer"));
            metrics.add(MetricDescriptor.measurement("disk_write_rate", "Disk Write Rate", "KiB/s", "data_rate", "mdi:speedometer"));
        }
    }

    @Override
    public CollectorResult collect() throws CollectionException {
        Map<String, String> props;
        try {
            Optional<String> resolved = resolveUnit();
            if (resolved.isEmpty()) {
                return CollectorResult.notFound();
            }
            props = systemd.show(resolved.get(), PROPERTIES);
        } catch (IOException e) {
            throw new CollectionException("Cannot query service " + config.match().value() + ": " + e.getMessage(), e);
        }
        if ("not-found".equals(props.get("LoadState"))) {
            unit = null;
            return CollectorResult.notFound();
        }

        Instant now = clock.instant();
        double seconds = previousAt == null ? 0 : (now.toEpochMilli() - previousAt.toEpochMilli()) / 1000.0;
        String activeState = props.getOrDefault("ActiveState", "unknown");
        Map<String, Object> values = new LinkedHashMap<>();
        if (enabled("state")) {
            values.put("sub_state", props.get("SubState"));
        }
        Long cpuNanos = number(props.get("CPUUsageNSec"));
        if (enabled("cpu")) {
            double percent = 0;
            if (cpuNanos != null && previousCpuNanos != null && seconds > 0) {
                percent = Math.max(0, cpuNanos - previousCpuNanos) / 1e9 / seconds * 100.0;
            }
            values.put("cpu_percent", round(percent, 1));
        }
        if (enabled("memory")) {
            Long memory = number(props.get("MemoryCurrent"));
            values.put("memory", memory == null ? null : mib(memory));
        }
        if (enabled("smaps")) {
            long[] smaps = smaps(props.get("ControlGroup"));
            values.put("memory_pss", mib(smaps[0]));
            values.put("memory_uss", mib(smaps[1]));
        }
        if (enabled("restart_count")) {
            values.put("restarts", number(props.get("NRestarts")));
        }
        Long read = number(props.get("IOReadBytes"));
        Long write = number(props.get("IOWriteBytes"));
        if (enabled("disk")) {
            values.put("disk_read", read == null ? null : mib(read));
            values.put("disk_write", write == null ? null : mib(write));
        }
        if (enabled("disk_rate")) {
            values.put("disk_read_rate", rate(previousRead, read, seconds));
            values.put("disk_write_rate", rate(previousWrite, write, seconds));
        }
        previousCpuNanos = cpuNanos;
        previousRead = read;
        previousWrite = write;
        previousAt = now;
        return CollectorResult.of(activeState, values);
    }

    private Optional<String> resolveUnit() throws IOException {
        if (pattern == null) {
            return Optional.of(config.match().value());
        }
        if (unit != null) {
            return Optional.of(unit);
        }
        for (String candidate : systemd.listServices()) {
            if (pattern.matcher(candidate).find()) {
                unit = candidate;
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    private long[] smaps(String controlGroup) {
        long pss = 0;
        long uss = 0;
        if (controlGroup == null || controlGroup.isEmpty()) {
            return new long[]{0, 0};
        }
        Path procs = cgroupRoot.resolve(controlGroup.startsWith("/") ? controlGroup.substring(1) : controlGroup)
                .resolve("cgroup.procs");
        try {
            for (String line : Files.readAllLines(procs, StandardCharsets.UTF_8)) {
                if (line.isBlank()) {
                    continue;
                }
                Optional<ProcessSample> sample = processes.sample(Long.parseLong(line.trim()), true);
                if (sample.isPresent()) {
                    pss += sample.get().pssBytes() == null ? 0 : sample.get().pssBytes();
                    uss += sample.get().ussBytes() == null ? 0 : sample.get().ussBytes();
                }
            }
        } catch (IOException e) {
            return new long[]{0, 0};
        }
        return new long[]{pss, uss};
    }

    private static Double rate(Long before, Long after, double seconds) {
        if (before == null || after == null || seconds <= 0) {
            return 0.0;
        }
        return round(Math.max(0, after - before) / seconds / 1024.0, 1);
    }

    /**
     * systemd reports unset accounting values as an empty string or {@code [not set]}, and
     * "infinity"-like sentinels as {@code 2^64-1}.
     */
    static Long number(String value) {
        if (value == null || value.isEmpty() || value.startsWith("[")) {
            return null;
        }
        try {
            long parsed = Long.parseUnsignedLong(value);
            return parsed < 0 ? null : parsed;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
