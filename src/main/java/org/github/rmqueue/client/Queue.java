package org.github.rmqueue.client;

/**
 * Interface of a single message queue behind a broker connection.
 *
 * Typical producer code looks like this:
 * <pre>{@code
 *     queue.connect();
 *     try {
 *         queue.push(element);
 *     } finally {
 *         queue.disconnect();
 *     }
 * }</pre>
 *
 * Typical consumer code looks like this:
 * <pre>{@code
 *     queue.connect();
 *     while (running) {
 *         QE e = queue.pop();
 *         process(e.getElement());
 *     }
 *     queue.disconnect();
 * }</pre>
 *
 * @param <I> class of message identifier in the queue
 * @param <E> class of message payload in the queue
 * @param <M> class of metadata of a message in the queue
 * @param <QE> class of queue element (it's a triple of id, element and metadata).
 *            So it should be consistent with I, E, M classes.
 */
public interface Queue<I, E, M, QE extends QueueElement<I, E, M>> {

    /**
     * Opens the connection, retrying until it succeeds.
     */
    default void connect() throws QueueException {
        connect(true);
    }

    /**
     * Opens the connection.
     *
     * @param retry keep retrying on connection failures instead of failing
     *              with {@link QueueConnectionException}
     */
    void connect(boolean retry) throws QueueException;

    /**
     * Closes the connection. Failures are logged and never propagated:
     * the queue is always disconnected afterwards.
     */
    void disconnect();

    /**
     * @return true while the queue holds an open connection
     */
    boolean isConnected();

    /**
     * Puts {@code element} to the queue.
     *
     * @param element element to put
     */
    void push(E element) throws QueueException;

    /**
     * Takes one element from the queue, blocking until it is available.
     *
     * @return taken element wrapped into {@link QueueElement}
     */
    QE pop() throws QueueException;

    /**
     * Acknowledges a taken element.
     *
     * @param id which element to acknowledge
     */
    void ack(I id) throws QueueException;

    /**
     * Negatively acknowledges a taken element.
     *
     * @param id which element to reject
     * @param requeue put the element back to the queue
     */
    void nack(I id, boolean requeue) throws QueueException;
}
