package org.github.rmqueue.client;

/**
 * The queue client lost, or could not establish, its connection to the broker.
 */
public class QueueConnectionException extends QueueException {

    public QueueConnectionException(String message) {
        super(message);
    }

    public QueueConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
