package io.penguin.metrics.agent.collector;

import io.penguin.metrics.agent.probe.GpuSysfs;
import io.penguin.metrics.agent.probe.Probes;
import io.penguin.metrics.config.model.AcPowerSource;
import io.penguin.metrics.config.model.BatterySource;
import io.penguin.metrics.config.model.BinarySensorSource;
import io.penguin.metrics.config.model.ContainerSource;
import io.penguin.metrics.config.model.CustomSource;
import io.penguin.metrics.config.model.DiskSource;
import io.penguin.metrics.config.model.ProcessSource;
import io.penguin.metrics.config.model.ServiceSource;
import io.penguin.metrics.config.model.SourceConfig;
import io.penguin.metrics.config.model.SystemSource;
import io.penguin.metrics.config.model.TemperatureSource;

/**
 * Builds the collector for a source declaration, wiring in the probes it reads from.
 */
public class CollectorFactory {

    private final Probes probes;

    public CollectorFactory(Probes probes) {
        this.probes = probes;
    }

    public Collector create(SourceConfig source) {
        if (source instanceof SystemSource system) {
            return new SystemCollector(system, probes.procfs(), new GpuSysfs(probes.sysRoot()));
        } else if (source instanceof ProcessSource process) {
            return new ProcessCollector(process, probes.processes());
        } else if (source instanceof ServiceSource service) {
            return new ServiceCollector(service, probes.systemd(), probes.processes(), probes.cgroupRoot());
        } else if (source instanceof ContainerSource container) {
            return new ContainerCollector(container, probes.containers());
        } else if (source instanceof TemperatureSource temperature) {
            return new TemperatureCollector(temperature, probes.thermalZones(), probes.hwmon());
        } else if (source instanceof BatterySource battery) {
            return new BatteryCollector(battery, probes.powerSupplies());
        } else if (source instanceof AcPowerSource acPower) {
            return new AcPowerCollector(acPower, probes.powerSupplies());
        } else if (source instanceof DiskSource disk) {
            return new DiskCollector(disk, probes.procfs());
        } else if (source instanceof CustomSource custom) {
            return new CustomCollector(custom, probes.commands());
        } else if (source instanceof BinarySensorSource binary) {
            return new BinarySensorCollector(binary, probes.commands());
        }
        throw new IllegalArgumentException("Unsupported source type: " + source.type());
    }
}
