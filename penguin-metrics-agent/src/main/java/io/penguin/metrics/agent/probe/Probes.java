package io.penguin.metrics.agent.probe;

import java.nio.file.Path;

/**
 * Everything collectors and enumerators read the host through. Tests swap in fakes and
 * temporary directory trees.
 */
public record Probes(
        Procfs procfs,
        Path sysRoot,
        ProcessTable processes,
        SystemdClient systemd,
        ContainerRuntime containers,
        CommandRunner commands) {

    public Path procRoot() {
        return procfs.root();
    }

    public Path powerSupplies() {
        return sysRoot.resolve("class/power_supply");
    }

    public Path thermalZones() {
        return sysRoot.resolve("class/thermal");
    }

    public Path hwmon() {
        return sysRoot.resolve("class/hwmon");
    }

    public Path cgroupRoot() {
        return sysRoot.resolve("fs/cgroup");
    }
}
