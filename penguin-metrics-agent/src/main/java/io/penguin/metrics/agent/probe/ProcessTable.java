package io.penguin.metrics.agent.probe;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Read access to the process namespace.
 */
public interface ProcessTable {

    List<ProcessInfo> list() throws IOException;

    /**
     * @param smaps also read proportional and unique set sizes, which is comparatively expensive
     * @return empty when the process no longer exists
     */
    Optional<ProcessSample> sample(long pid, boolean smaps) throws IOException;
}
