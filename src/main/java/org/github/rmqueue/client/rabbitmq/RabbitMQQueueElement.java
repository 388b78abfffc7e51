package org.github.rmqueue.client.rabbitmq;

import com.rabbitmq.client.AMQP;
import org.github.rmqueue.client.QueueElement;

/**
 * A delivery popped from a {@link RabbitMQQueue}: the delivery tag, the raw body
 * and the properties the message was published with.
 */
public class RabbitMQQueueElement extends QueueElement<Long, byte[], AMQP.BasicProperties> {

    private final boolean redeliver;

    public RabbitMQQueueElement(final Long deliveryTag, final byte[] body,
                                final AMQP.BasicProperties properties, final boolean redeliver) {
        super(deliveryTag, body, properties);
        this.redeliver = redeliver;
    }

    public long getDeliveryTag() {
        return getId();
    }

    public boolean isRedeliver() {
        return redeliver;
    }

    @Override
    public String toString() {
        return "RabbitMQQueueElement{" +
                "deliveryTag=" + getId() +
                ", body=" + (getElement() == null ? "null" : getElement().length + " byte(s)") +
                ", redeliver=" + redeliver +
                '}';
    }
}
