package io.penguin.metrics.agent.discovery;

import io.penguin.metrics.agent.probe.ContainerInfo;
import io.penguin.metrics.agent.probe.ContainerRuntime;
import io.penguin.metrics.config.SourceType;
import io.penguin.metrics.config.model.AutoDiscoverySettings;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Running containers, filtered by name or image.
 */
public class ContainerEnumerator implements NamespaceEnumerator {

    private final ContainerRuntime runtime;

    public ContainerEnumerator(ContainerRuntime runtime) {
        this.runtime = runtime;
    }

    @Override
    public SourceType type() {
        return SourceType.CONTAINER;
    }

    @Override
    public List<NamespaceEntry> enumerate(AutoDiscoverySettings settings) throws IOException {
        List<NamespaceEntry> entries = new ArrayList<>();
        for (ContainerInfo container : runtime.list(false)) {
            List<String> labels = new ArrayList<>();
            labels.add(container.name());
            if (container.image() != null) {
                labels.add(container.image());
            }
            entries.add(new NamespaceEntry(container.name(), container.name(), labels));
        }
        return entries;
    }
}
