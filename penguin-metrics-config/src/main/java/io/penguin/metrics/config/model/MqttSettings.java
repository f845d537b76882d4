package io.penguin.metrics.config.model;

/**
 * Broker connection settings from the {@code mqtt} block.
 */
public record MqttSettings(
        String host,
        int port,
        String username,
        String password,
        String clientId,
        String topicPrefix,
        int qos,
        boolean retain,
        int keepaliveSeconds) {

    public static final String DEFAULT_HOST = "localhost";
    public static final int DEFAULT_PORT = 1883;
    public static final String DEFAULT_TOPIC_PREFIX = "penguin_metrics";

    public static MqttSettings defaults() {
        return new MqttSettings(DEFAULT_HOST, DEFAULT_PORT, null, null, null, DEFAULT_TOPIC_PREFIX, 1, true, 60);
    }

    public String brokerUri() {
        return "tcp://" + host + ":" + port;
    }

    /** Topic carrying the global {@code online}/{@code offline} availability. */
    public String statusTopic() {
        return topicPrefix + "/status";
    }

    @Override
    public String toString() {
        return "MqttSettings{host=" + host + ", port=" + port + ", username=" + username
                + ", password=" + (password == null ? "null" : "***") + ", clientId=" + clientId
                + ", topicPrefix=" + topicPrefix + ", qos=" + qos + ", retain=" + retain
                + ", keepalive=" + keepaliveSeconds + "}";
    }
}
