package io.penguin.metrics.agent.collector;

import io.penguin.metrics.agent.probe.Procfs;
import io.penguin.metrics.config.model.DiskSource;

import java.io.IOException;
import java.nio.file.FileStore;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Space usage of a mounted filesystem, in GiB. The filesystem is found through {@code /proc/mounts}
 * by mount point or by block device.
 */
public class DiskCollector extends AbstractCollector<DiskSource> {

    private static final double GIB = 1024.0 * 1024.0 * 1024.0;

    private final Procfs procfs;

    public DiskCollector(DiskSource config, Procfs procfs) {
        super(config);
        this.procfs = procfs;
    }

    @Override
    protected void declareMetrics(List<MetricDescriptor> metrics) {
        if (enabled("total")) {
            metrics.add(MetricDescriptor.measurement("total", "Total", "GiB", "data_size", "mdi:harddisk"));
        }
        if (enabled("used")) {
            metrics.add(MetricDescriptor.measurement("used", "Used", "GiB", "data_size", "mdi:harddisk"));
        }
        if (enabled("free")) {
            metrics.add(MetricDescriptor.measurement("free", "Free", "GiB", "data_size", "mdi:harddisk"));
        }
        if (enabled("percent")) {
            metrics.add(MetricDescriptor.measurement("percent", "Usage", "%", null, "mdi:chart-donut"));
        }
    }

    @Override
    public CollectorResult collect() throws CollectionException {
        Optional<Path> mountpoint;
        try {
            mountpoint = mountpoint();
        } catch (IOException e) {
            throw new CollectionException("Cannot read mount table: " + e.getMessage(), e);
        }
        if (mountpoint.isEmpty()) {
            return CollectorResult.notFound();
        }
        long total;
        long free;
        try {
            FileStore store = Files.getFileStore(mountpoint.get());
            total = store.getTotalSpace();
            free = store.getUsableSpace();
        } catch (IOException e) {
            throw new CollectionException("Cannot stat " + mountpoint.get() + ": " + e.getMessage(), e);
        }
        long used = total - free;
        Map<String, Object> values = new LinkedHashMap<>();
        if (enabled("total")) {
            values.put("total", round(total / GIB, 2));
        }
        if (enabled("used")) {
            values.put("used", round(used / GIB, 2));
        }
        if (enabled("free")) {
            values.put("free", round(free / GIB, 2));
        }
        if (enabled("percent")) {
            values.put("percent", total == 0 ? 0.0 : round(100.0 * used / total, 1));
        }
        return CollectorResult.online(values);
    }

    private Optional<Path> mountpoint() throws IOException {
        String wantedMount = config.mountpoint();
        String wantedDevice = config.blockDevice() == null ? null : normalize(config.blockDevice());
        for (Procfs.Mount mount : procfs.mounts()) {
            if (wantedMount != null) {
                if (mount.mountpoint().equals(wantedMount)) {
                    return Optional.of(Path.of(mount.mountpoint()));
                }
            } else if (wantedDevice != null && normalize(mount.device()).equals(wantedDevice)) {
                return Optional.of(Path.of(mount.mountpoint()));
            }
        }
        if (wantedMount == null && wantedDevice == null) {
            return Optional.of(Path.of("/"));
        }
        return Optional.empty();
    }

    private static String normalize(String device) {
        return device.startsWith("/dev/") ? device.substring(5) : device;
    }
}
