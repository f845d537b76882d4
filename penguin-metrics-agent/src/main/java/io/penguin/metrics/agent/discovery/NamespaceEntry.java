package io.penguin.metrics.agent.discovery;

import io.penguin.metrics.config.Identifiers;

import java.util.List;

/**
 * One discoverable object found in the OS namespace.
 *
 * @param name   display name of the source that would be created
 * @param target the value the created source binds to (pid, unit, container name, zone, path, device)
 * @param labels names matched against filters and excludes and against manual targets
 */
public record NamespaceEntry(String name, String target, List<String> labels) {

    public NamespaceEntry {
        labels = List.copyOf(labels);
    }

    public String id() {
        return Identifiers.sanitize(name);
    }
}
