package io.penguin.metrics.agent.probe;

/**
 * One stats reading of a container. CPU counters are cumulative nanoseconds; the
 * {@code pre*} fields hold the runtime's previous reading.
 */
public record ContainerStats(
        long cpuTotal,
        long preCpuTotal,
        long systemCpu,
        long preSystemCpu,
        int onlineCpus,
        long memoryUsage,
        long memoryLimit,
        long networkRx,
        long networkTx,
        long blockRead,
        long blockWrite) {

    public double cpuPercent() {
        long cpuDelta = cpuTotal - preCpuTotal;
        long systemDelta = systemCpu - preSystemCpu;
        if (cpuDelta <= 0 || systemDelta <= 0) {
            return 0.0;
        }
        return (double) cpuDelta / systemDelta * Math.max(1, onlineCpus) * 100.0;
    }

    public double memoryPercent() {
        return memoryLimit <= 0 ? 0.0 : 100.0 * memoryUsage / memoryLimit;
    }
}
