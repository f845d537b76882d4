package io.penguin.metrics.agent.discovery;

import io.penguin.metrics.agent.probe.ProcessInfo;
import io.penguin.metrics.agent.probe.ProcessTable;
import io.penguin.metrics.config.SourceType;
import io.penguin.metrics.config.model.AutoDiscoverySettings;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * User-space processes, one entry per pid named {@code <comm>_<pid>}. Kernel threads are skipped.
 */
public class ProcessEnumerator implements NamespaceEnumerator {

    private final ProcessTable processes;

    public ProcessEnumerator(ProcessTable processes) {
        this.processes = processes;
    }

    @Override
    public SourceType type() {
        return SourceType.PROCESS;
    }

    @Override
    public List<NamespaceEntry> enumerate(AutoDiscoverySettings settings) throws IOException {
        List<NamespaceEntry> entries = new ArrayList<>();
        for (ProcessInfo process : processes.list()) {
            if (process.cmdline().isEmpty()) {
                continue;
            }
            String pid = Long.toString(process.pid());
            entries.add(new NamespaceEntry(process.comm() + "_" + pid, pid,
                    List.of(process.comm(), process.cmdline())));
        }
        return entries;
    }
}
