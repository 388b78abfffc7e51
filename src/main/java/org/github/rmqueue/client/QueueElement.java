package org.github.rmqueue.client;

/**
 * Envelope of a message popped from a {@link Queue}.
 *
 * <p>The id is what the broker delivered the message under (the delivery tag for RabbitMQ)
 * and the element is the message body, raw or deserialized depending on the queue.
 * Metadata carries whatever else the broker handed over with the body, e.g. AMQP properties.
 *
 * @param <I> class of delivery identifier
 * @param <E> class of message body
 * @param <M> class of delivery metadata
 */
public class QueueElement<I, E, M> {

    final I id;
    final E element;
    final M metadata;

    public QueueElement(I id, E element, M metadata) {
        this.id = id;
        this.element = element;
        this.metadata = metadata;
    }

    public I getId() {
        return id;
    }

    public E getElement() {
        return element;
    }

    public M getMetadata() {
        return metadata;
    }

    @Override
    public String toString() {
        return "QueueElement{" +
                "id=" + id +
                ", element=" + element +
                ", metadata=" + metadata +
                '}';
    }
}
