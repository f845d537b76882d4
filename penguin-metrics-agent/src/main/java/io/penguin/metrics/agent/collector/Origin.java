package io.penguin.metrics.agent.collector;

public enum Origin {
    MANUAL,
    AUTO_DISCOVERED
}
