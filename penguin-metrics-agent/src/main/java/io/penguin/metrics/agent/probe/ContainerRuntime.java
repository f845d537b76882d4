package io.penguin.metrics.agent.probe;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Read access to the container engine.
 */
public interface ContainerRuntime {

    /**
     * @param all include stopped containers
     */
    List<ContainerInfo> list(boolean all) throws IOException;

    /**
     * @return empty when no container with that id or name exists
     */
    Optional<ContainerInfo> inspect(String idOrName) throws IOException;

    ContainerStats stats(String id) throws IOException;
}
