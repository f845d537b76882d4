package io.penguin.metrics.agent.mqtt;

/**
 * Failure talking to the broker. The transport retries on its own; callers never see it.
 */
public class TransportException extends Exception {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
