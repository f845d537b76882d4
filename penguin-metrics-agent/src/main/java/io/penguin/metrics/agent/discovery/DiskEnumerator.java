package io.penguin.metrics.agent.discovery;

import io.penguin.metrics.agent.probe.Procfs;
import io.penguin.metrics.config.SourceType;
import io.penguin.metrics.config.model.AutoDiscoverySettings;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Mounted block devices from {@code /proc/mounts}, one entry per device (first mount wins).
 */
public class DiskEnumerator implements NamespaceEnumerator {

    private static final String DEV = "/dev/";

    private final Procfs procfs;

    public DiskEnumerator(Procfs procfs) {
        this.procfs = procfs;
    }

    @Override
    public SourceType type() {
        return SourceType.DISK;
    }

    @Override
    public List<NamespaceEntry> enumerate(AutoDiscoverySettings settings) throws IOException {
        List<NamespaceEntry> entries = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (Procfs.Mount mount : procfs.mounts()) {
            if (!mount.device().startsWith(DEV) || mount.device().startsWith("/dev/loop")) {
                continue;
            }
            String device = mount.device().substring(DEV.length());
            if (seen.add(device)) {
                entries.add(new NamespaceEntry(device, device, List.of(device, mount.device(), mount.mountpoint())));
            }
        }
        return entries;
    }
}
