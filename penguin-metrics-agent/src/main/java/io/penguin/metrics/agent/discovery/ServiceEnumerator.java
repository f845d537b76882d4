package io.penguin.metrics.agent.discovery;

import io.penguin.metrics.agent.probe.SystemdClient;
import io.penguin.metrics.config.SourceType;
import io.penguin.metrics.config.model.AutoDiscoverySettings;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

public class ServiceEnumerator implements NamespaceEnumerator {

    private static final String SUFFIX = ".service";

    private final SystemdClient systemd;

    public ServiceEnumerator(SystemdClient systemd) {
        this.systemd = systemd;
    }

    @Override
    public SourceType type() {
        return SourceType.SERVICE;
    }

    @Override
    public List<NamespaceEntry> enumerate(AutoDiscoverySettings settings) throws IOException {
        List<NamespaceEntry> entries = new ArrayList<>();
        for (String unit : systemd.listServices()) {
            String name = unit.endsWith(SUFFIX) ? unit.substring(0, unit.length() - SUFFIX.length()) : unit;
            entries.add(new NamespaceEntry(name, unit, List.of(unit, name)));
        }
        return entries;
    }
}
