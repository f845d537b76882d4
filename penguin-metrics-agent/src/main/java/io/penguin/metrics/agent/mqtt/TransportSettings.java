package io.penguin.metrics.agent.mqtt;

import java.time.Duration;

/**
 * Tuning of the broker connection and the outbound queue.
 *
 * @param offlinePublishTimeout upper bound for the whole offline sequence on shutdown
 */
public record TransportSettings(
        Duration connectTimeout,
        Duration publishTimeout,
        Duration initialBackoff,
        Duration maxBackoff,
        int maxQueueSize,
        Duration maxMessageAge,
        Duration offlinePublishTimeout) {

    public static TransportSettings defaults() {
        return new TransportSettings(Duration.ofSeconds(10), Duration.ofSeconds(10), Duration.ofSeconds(1),
                Duration.ofSeconds(60), 10_000, Duration.ofMinutes(10), Duration.ofSeconds(5));
    }
}
