package org.github.rmqueue.client.rabbitmq;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.ConsumerCancelledException;
import com.rabbitmq.client.DefaultConsumer;
import com.rabbitmq.client.Delivery;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.ShutdownSignalException;

import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Buffers deliveries pushed by the client's dispatch thread so they can be taken
 * one at a time by a blocking caller.
 */
class BlockingMessageConsumer extends DefaultConsumer {

    // marks the end of the stream, never handed out
    private static final Delivery END = new Delivery(null, null, null);

    private final BlockingQueue<Delivery> deliveries = new LinkedBlockingQueue<>();
    private final ConsumeOptions options;

    private volatile String tag;
    private volatile RuntimeException failure;

    BlockingMessageConsumer(final Channel channel, final ConsumeOptions options) {
        super(channel);
        this.options = options;
    }

    ConsumeOptions getOptions() {
        return options;
    }

    String getTag() {
        return tag;
    }

    void setTag(final String tag) {
        this.tag = tag;
    }

    @Override
    public void handleDelivery(final String consumerTag, final Envelope envelope,
                               final AMQP.BasicProperties properties, final byte[] body) {
        deliveries.add(new Delivery(envelope, properties, body));
    }

    @Override
    public void handleCancel(final String consumerTag) {
        end(new ConsumerCancelledException());
    }

    @Override
    public void handleShutdownSignal(final String consumerTag, final ShutdownSignalException sig) {
        end(sig);
    }

    /**
     * Takes the next delivery.
     *
     * @param timeout how long to wait, null to wait until a delivery arrives
     * @return the delivery, null if the timeout elapsed
     * @throws ShutdownSignalException if the channel was shut down
     * @throws ConsumerCancelledException if the broker cancelled the consumer
     */
    Delivery next(final Duration timeout) throws InterruptedException {
        final Delivery delivery = timeout == null
                ? deliveries.take()
                : deliveries.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (delivery == END) {
            deliveries.add(END);
            throw failure;
        }
        return delivery;
    }

    private void end(final RuntimeException cause) {
        failure = cause;
        deliveries.add(END);
    }
}
