package org.github.rmqueue.client;

/**
 * A queue operation failed for a reason other than the connection.
 */
public class QueueOperationException extends QueueException {

    public QueueOperationException(String message) {
        super(message);
    }

    public QueueOperationException(String message, Throwable cause) {
        super(message, cause);
    }
}
