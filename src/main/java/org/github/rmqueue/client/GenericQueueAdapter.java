package org.github.rmqueue.client;

import java.util.function.Function;

/**
 * Typed view over a queue of raw payloads. Elements are serialized on
 * {@link #push} and deserialized on {@link #pop}; ids and metadata pass through.
 */
public class GenericQueueAdapter<I, E, M, QE extends QueueElement<I, E, M>, BE> implements Queue<I, E, M, QE> {

    private final Queue<I, BE, M, ? extends QueueElement<I, BE, M>> queue;

    private final Function<E, BE> elementSerializer;
    private final Function<BE, E> elementDeserializer;

    private final QueueElementCreator<I, E, M, QE> queueElementCreator;

    public GenericQueueAdapter(Queue<I, BE, M, ? extends QueueElement<I, BE, M>> queue,
                               Function<E, BE> elementSerializer,
                               Function<BE, E> elementDeserializer,
                               QueueElementCreator<I, E, M, QE> queueElementCreator) {

        this.queue = queue;
        this.elementSerializer = elementSerializer;
        this.elementDeserializer = elementDeserializer;
        this.queueElementCreator = queueElementCreator;
    }

    @Override
    public void connect(boolean retry) throws QueueException {
        queue.connect(retry);
    }

    @Override
    public void disconnect() {
        queue.disconnect();
    }

    @Override
    public boolean isConnected() {
        return queue.isConnected();
    }

    @Override
    public void push(E element) throws QueueException {
        queue.push(elementSerializer.apply(element));
    }

    @Override
    public QE pop() throws QueueException {
        return deserializeQueueElement(queue.pop());
    }

    @Override
    public void ack(I id) throws QueueException {
        queue.ack(id);
    }

    @Override
    public void nack(I id, boolean requeue) throws QueueException {
        queue.nack(id, requeue);
    }

    public Queue<I, BE, M, ? extends QueueElement<I, BE, M>> getQueue() {
        return queue;
    }

    private QE deserializeQueueElement(QueueElement<I, BE, M> e) {
        if (e == null) {
            return null;
        }
        E element = elementDeserializer.apply(e.getElement());
        return queueElementCreator.create(e.getId(), element, e.getMetadata());
    }
}
