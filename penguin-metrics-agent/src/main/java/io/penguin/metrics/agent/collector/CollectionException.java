package io.penguin.metrics.agent.collector;

/**
 * Raised by a collector when initialization or a collection cycle fails.
 */
public class CollectionException extends Exception {

    public CollectionException(String message) {
        super(message);
    }

    public CollectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
