package io.penguin.metrics.agent.probe;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Queries the service manager.
 */
public interface SystemdClient {

    /**
     * @return names of all loaded service units, e.g. {@code docker.service}
     */
    List<String> listServices() throws IOException;

    /**
     * @return the requested unit properties; a property the manager does not report is absent
     */
    Map<String, String> show(String unit, List<String> properties) throws IOException;
}
