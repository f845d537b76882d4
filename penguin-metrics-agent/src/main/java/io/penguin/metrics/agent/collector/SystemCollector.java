package io.penguin.metrics.agent.collector;

import io.penguin.metrics.agent.probe.GpuReading;
import io.penguin.metrics.agent.probe.GpuSysfs;
import io.penguin.metrics.agent.probe.Procfs;
import io.penguin.metrics.config.model.SystemSource;

import java.io.IOException;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Host-wide CPU, memory, swap, load and uptime, plus the primary GPU when {@code gpu} is on.
 */
public class SystemCollector extends AbstractCollector<SystemSource> {

    private final Procfs procfs;
    private final GpuSysfs gpu;
    private Map<String, Procfs.CpuTimes> previousCpu = new HashMap<>();

    public SystemCollector(SystemSource config, Procfs procfs, GpuSysfs gpu) {
        super(config);
        this.procfs = procfs;
        this.gpu = gpu;
    }

    @Override
    protected void declareMetrics(List<MetricDescriptor> metrics) {
        if (enabled("cpu")) {
            metrics.add(MetricDescriptor.measurement("cpu_percent", "CPU Usage", "%", null, "mdi:cpu-64-bit"));
        }
        if (enabled("cpu_per_core")) {
            for (int core = 0; core < cores(); core++) {
                metrics.add(MetricDescriptor.measurement("cpu" + core + "_percent", "CPU " + core + " Usage",
                        "%", null, "mdi:cpu-64-bit"));
            }
        }
        if (enabled("memory")) {
            metrics.add(MetricDescriptor.measurement("memory_used", "Memory Used", "MiB", "data_size", "mdi:memory"));
            metrics.add(MetricDescriptor.measurement("memory_total", "Memory Total", "MiB", "data_size", "mdi:memory"));
            metrics.add(MetricDescriptor.measurement("memory_percent", "Memory Usage", "%", null, "mdi:memory"));
        }
        if (enabled("swap")) {
            metrics.add(MetricDescriptor.measurement("swap_used", "Swap Used", "MiB", "data_size", "mdi:harddisk"));
            metrics.add(MetricDescriptor.measurement("swap_percent", "Swap Usage", "%", null, "mdi:harddisk"));
        }
        if (enabled("load")) {
            metrics.add(MetricDescriptor.measurement("load_1m", "Load (1m)", null, null, "mdi:gauge"));
            metrics.add(MetricDescriptor.measurement("load_5m", "Load (5m)", null, null, "mdi:gauge"));
            metrics.add(MetricDescriptor.measurement("load_15m", "Load (15m)", null, null, "mdi:gauge"));
        }
        if (enabled("uptime")) {
            metrics.add(MetricDescriptor.total("uptime", "Uptime", "s", "duration", "mdi:clock-outline"));
        }
        if (enabled("gpu")) {
            metrics.add(MetricDescriptor.measurement("gpu_utilization", "GPU Usage", "%", null, "mdi:chip"));
            metrics.add(MetricDescriptor.measurement("gpu_frequency", "GPU Frequency", "MHz", "frequency", "mdi:chip"));
            metrics.add(MetricDescriptor.measurement("gpu_temperature", "GPU Temperature", "°C", "temperature",
                    "mdi:thermometer"));
        }
    }

    @Override
    public void initialize() throws CollectionException {
        try {
            previousCpu = procfs.cpuTimes();
        } catch (IOException e) {
            throw new CollectionException("Cannot read CPU statistics: " + e.getMessage(), e);
        }
    }

    @Override
    public CollectorResult collect() throws CollectionException {
        Map<String, Object> values = new LinkedHashMap<>();
        try {
            if (enabled("cpu") || enabled("cpu_per_core")) {
                Map<String, Procfs.CpuTimes> current = procfs.cpuTimes();
                if (enabled("cpu")) {
                    values.put("cpu_percent", usage(current, "cpu"));
                }
                if (enabled("cpu_per_core")) {
                    for (int core = 0; core < cores(); core++) {
                        values.put("cpu" + core + "_percent", usage(current, "cpu" + core));
                    }
                }
                previousCpu = current;
            }
            if (enabled("memory") || enabled("swap")) {
                Map<String, Long> mem = procfs.meminfo();
                if (enabled("memory")) {
                    long total = mem.getOrDefault("MemTotal", 0L);
                    long available = mem.getOrDefault("MemAvailable", mem.getOrDefault("MemFree", 0L));
                    long used = total - available;
                    values.put("memory_used", mib(used));
                    values.put("memory_total", mib(total));
                    values.put("memory_percent", total == 0 ? 0.0 : round(100.0 * used / total, 1));
                }
                if (enabled("swap")) {
                    long total = mem.getOrDefault("SwapTotal", 0L);
                    long used = total - mem.getOrDefault("SwapFree", 0L);
                    values.put("swap_used", mib(used));
                    values.put("swap_percent", total == 0 ? 0.0 : round(100.0 * used / total, 1));
                }
            }
            if (enabled("load")) {
                double[] load = procfs.loadAverage();
                values.put("load_1m", load[0]);
                values.put("load_5m", load[1]);
                values.put("load_15m", load[2]);
            }
            if (enabled("uptime")) {
                values.put("uptime", (long) procfs.uptimeSeconds());
            }
            if (enabled("gpu")) {
                Optional<GpuReading> reading = gpu.read();
                values.put("gpu_utilization", reading.map(GpuReading::utilization).orElse(null));
                values.put("gpu_frequency", reading.map(GpuReading::frequencyMhz).orElse(null));
                values.put("gpu_temperature", reading.map(GpuReading::temperature).orElse(null));
            }
        } catch (IOException e) {
            throw new CollectionException("Cannot read system statistics: " + e.getMessage(), e);
        }
        return CollectorResult.online(values);
    }

    private static int cores() {
        return Runtime.getRuntime().availableProcessors();
    }

    private Double usage(Map<String, Procfs.CpuTimes> current, String key) {
        Procfs.CpuTimes now = current.get(key);
        Procfs.CpuTimes before = previousCpu.get(key);
        if (now == null) {
            return null;
        }
        return before == null ? 0.0 : round(now.usagePercentSince(before), 1);
    }
}
