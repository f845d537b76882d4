package io.penguin.metrics.agent.probe;

import java.util.Map;

/**
 * @param state  runtime state such as {@code running} or {@code exited}
 * @param health health check status, {@code null} when the container has no health check
 */
public record ContainerInfo(String id, String name, String image, String state, String health,
                            String startedAt, Map<String, String> labels) {

    public ContainerInfo {
        labels = Map.copyOf(labels);
    }
}
