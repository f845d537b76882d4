package io.penguin.metrics.agent.mqtt;

import java.util.function.Consumer;

/**
 * One client session with the broker. Implementations block until the broker has accepted
 * a publish, so a returned call means the message left the process.
 */
public interface BrokerConnection {

    /**
     * Connects and registers the last will on the status topic.
     *
     * @param onConnectionLost called from the client's own thread when an established session drops
     */
    void connect(Consumer<Throwable> onConnectionLost) throws TransportException;

    boolean isConnected();

    void publish(String topic, byte[] payload, int qos, boolean retain) throws TransportException;

    void disconnect() throws TransportException;
}
