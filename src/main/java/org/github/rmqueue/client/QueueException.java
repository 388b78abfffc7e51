package org.github.rmqueue.client;

/**
 * Base class of the errors reported by {@link Queue} operations.
 * The underlying client exception, if any, is kept as the cause.
 */
public class QueueException extends Exception {

    public QueueException(String message) {
        super(message);
    }

    public QueueException(String message, Throwable cause) {
        super(message, cause);
    }
}
