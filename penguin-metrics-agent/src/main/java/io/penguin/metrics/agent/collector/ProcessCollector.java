package io.penguin.metrics.agent.collector;

import io.penguin.metrics.agent.probe.ProcessInfo;
import io.penguin.metrics.agent.probe.ProcessSample;
import io.penguin.metrics.agent.probe.ProcessTable;
import io.penguin.metrics.agent.probe.Sysfs;
import io.penguin.metrics.config.model.Match;
import io.penguin.metrics.config.model.ProcessSource;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Resource usage of one process, or of every matching process summed up when {@code aggregate} is on.
 * CPU and I/O rates are computed between consecutive cycles, so the first cycle reports zero.
 */
public class ProcessCollector extends AbstractCollector<ProcessSource> {

    public static final String RUNNING = "running";

    private final ProcessTable table;
    private final Pattern pattern;
    private Map<Long, ProcessSample> previous = new HashMap<>();
    private long boundPid = -1;

    public ProcessCollector(ProcessSource config, ProcessTable table) {
        super(config);
        this.table = table;
        this.pattern = config.match().kind() == Match.Kind.PATTERN ? Pattern.compile(config.match().value()) : null;
    }

    @Override
    protected void declareMetrics(List<MetricDescriptor> metrics) {
        if (enabled("cpu")) {
            metrics.add(MetricDescriptor.measurement("cpu_percent", "CPU Usage", "%", null, "mdi:cpu-64-bit"));
        }
        if (enabled("memory")) {
            metrics.add(MetricDescriptor.measurement("memory_rss", "Memory RSS", "MiB", "data_size", "mdi:memory"));
        }
        if (enabled("smaps")) {
            metrics.add(MetricDescriptor.measurement("memory_pss", "Memory PSS", "MiB", "data_size", "mdi:memory"));
            metrics.add(MetricDescriptor.measurement("memory_uss", "Memory USS", "MiB", "data_size", "mdi:memory"));
        }
        if (enabled("disk")) {
            metrics.add(MetricDescriptor.total("disk_read", "Disk Read", "MiB", "data_size", "mdi:harddisk"));
            metrics.add(MetricDescriptor.total("disk_write", "Disk Write", "MiB", "data_size", "mdi:harddisk"));
        }
        if (enabled("disk_rate")) {
            metrics.add(MetricDescriptor.measurement("disk_read_rate", "Disk Read Rate", "KiB/s", "data_rate", "mdi:speedometer"));
            metrics.add(MetricDescriptor.measurement("disk_write_rate", "Disk Write Rate", "KiB/s", "data_rate", "mdi:speedometer"));
        }
        if (enabled("fds")) {
            metrics.add(MetricDescriptor.measurement("fds", "Open Files", null, null, "mdi:file-multiple"));
        }
        if (enabled("threads")) {
            metrics.add(MetricDescriptor.measurement("threads", "Threads", null, null, "mdi:format-list-numbered"));
        }
        if (config.aggregate()) {
            metrics.add(MetricDescriptor.measurement("count", "Process Count", null, null, "mdi:counter"));
        }
    }

    @Override
    public CollectorResult collect() throws CollectionException {
        List<ProcessSample> samples = new ArrayList<>();
        try {
            for (ProcessInfo process : targets()) {
                table.sample(process.pid(), enabled("smaps")).ifPresent(samples::add);
            }
        } catch (IOException e) {
            throw new CollectionException("Cannot read process table: " + e.getMessage(), e);
        }
        if (samples.isEmpty()) {
            previous = new HashMap<>();
            boundPid = -1;
            Map<String, Object> values = new HashMap<>();
            if (config.aggregate()) {
                values.put("count", 0);
            }
            return new CollectorResult(values, CollectorResult.NOT_FOUND, false, null, Instant.now());
        }

        double cpu = 0;
        long rss = 0;
        long pss = 0;
        long uss = 0;
        long read = 0;
        long write = 0;
        double readRate = 0;
        double writeRate = 0;
        long fds = 0;
        long threads = 0;
        Map<Long, ProcessSample> current = new HashMap<>();
        for (ProcessSample sample : samples) {
            current.put(sample.pid(), sample);
            ProcessSample before = previous.get(sample.pid());
            if (before != null) {
                double seconds = Duration.between(before.sampledAt(), sample.sampledAt()).toNanos() / 1e9;
                if (seconds > 0) {
                    cpu += Math.max(0, sample.cpuSeconds() - before.cpuSeconds()) / seconds * 100.0;
                    readRate += delta(before.readBytes(), sample.readBytes()) / seconds / 1024.0;
                    writeRate += delta(before.writeBytes(), sample.writeBytes()) / seconds / 1024.0;
                }
            }
            rss += sample.rssBytes();
            pss += orZero(sample.pssBytes());
            uss += orZero(sample.ussBytes());
            read += orZero(sample.readBytes());
            write += orZero(sample.writeBytes());
            fds += sample.openFds() == null ? 0 : sample.openFds();
            threads += sample.threads();
        }
        previous = current;

        Map<String, Object> values = new LinkedHashMap<>();
        if (enabled("cpu")) {
            values.put("cpu_percent", round(cpu, 1));
        }
        if (enabled("memory")) {
            values.put("memory_rss", mib(rss));
        }
        if (enabled("smaps")) {
            values.put("memory_pss", mib(pss));
            values.put("memory_uss", mib(uss));
        }
        if (enabled("disk")) {
            values.put("disk_read", mib(read));
            values.put("disk_write", mib(write));
        }
        if (enabled("disk_rate")) {
            values.put("disk_read_rate", round(readRate, 1));
            values.put("disk_write_rate", round(writeRate, 1));
        }
        if (enabled("fds")) {
            values.put("fds", fds);
        }
        if (enabled("threads")) {
            values.put("threads", threads);
        }
        if (config.aggregate()) {
            values.put("count", samples.size());
        }
        return CollectorResult.of(RUNNING, values);
    }

    private List<ProcessInfo> targets() throws IOException {
        List<ProcessInfo> matching = new ArrayList<>();
        Optional<Long> pidFromFile = config.match().kind() == Match.Kind.PIDFILE ? readPidFile() : Optional.empty();
        for (ProcessInfo process : table.list()) {
            if (matches(process, pidFromFile)) {
                matching.add(process);
            }
        }
        if (config.aggregate() || matching.size() <= 1) {
            return matching;
        }
        for (ProcessInfo process : matching) {
            if (process.pid() == boundPid) {
                return List.of(process);
            }
        }
        boundPid = matching.get(0).pid();
        return List.of(matching.get(0));
    }

    private boolean matches(ProcessInfo process, Optional<Long> pidFromFile) {
        String value = config.match().value();
        return switch (config.match().kind()) {
            case NAME -> process.comm().equals(value) || executable(process.cmdline()).equals(value);
            case PATTERN -> pattern.matcher(process.cmdline()).find();
            case PID -> Long.toString(process.pid()).equals(value);
            case PIDFILE -> pidFromFile.isPresent() && pidFromFile.get() == process.pid();
            case CMDLINE -> process.cmdline().contains(value);
            default -> false;
        };
    }

    private Optional<Long> readPidFile() {
        return Sysfs.read(Path.of(config.match().value())).flatMap(text -> {
            try {
                return Optional.of(Long.parseLong(text.trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        });
    }

    private static String executable(String cmdline) {
        String first = cmdline.split(" ", 2)[0];
        int slash = first.lastIndexOf('/');
        return slash >= 0 ? first.substring(slash + 1) : first;
    }

    private static long delta(Long before, Long after) {
        return before == null || after == null ? 0 : Math.max(0, after - before);
    }

    private static long orZero(Long value) {
        return value == null ? 0 : value;
    }
}
