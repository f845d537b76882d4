package io.penguin.metrics.agent.mqtt;

/**
 * Fire-and-forget publishing. Messages are queued and delivered in call order.
 */
public interface MessagePublisher {

    void publish(String topic, String payload, boolean retain);
}
