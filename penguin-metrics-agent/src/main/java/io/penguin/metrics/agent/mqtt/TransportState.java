package io.penguin.metrics.agent.mqtt;

public enum TransportState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED,
    RECONNECTING
}
