package io.penguin.metrics.agent.mqtt;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

/**
 * A message waiting in the outbound queue.
 *
 * @param enqueuedAt used to expire messages older than the queue's age bound
 */
public record OutboundMessage(String topic, String payload, int qos, boolean retain, Instant enqueuedAt) {

    public byte[] payloadBytes() {
        return payload.getBytes(StandardCharsets.UTF_8);
    }
}
