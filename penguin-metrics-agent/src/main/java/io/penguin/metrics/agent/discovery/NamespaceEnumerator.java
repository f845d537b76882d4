package io.penguin.metrics.agent.discovery;

import io.penguin.metrics.config.SourceType;
import io.penguin.metrics.config.model.AutoDiscoverySettings;

import java.io.IOException;
import java.util.List;

/**
 * Lists the current objects of one discoverable source type.
 */
public interface NamespaceEnumerator {

    SourceType type();

    List<NamespaceEntry> enumerate(AutoDiscoverySettings settings) throws IOException;
}
