package org.github.rmqueue.client.rabbitmq;

import com.google.common.base.Preconditions;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.client.Delivery;
import com.rabbitmq.client.ShutdownSignalException;
import org.github.rmqueue.client.BackOffDelayPolicy;
import org.github.rmqueue.client.Queue;
import org.github.rmqueue.client.QueueConnectionException;
import org.github.rmqueue.client.QueueException;
import org.github.rmqueue.client.QueueOperationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * {@link Queue} on top of a single RabbitMQ queue.
 *
 * <p>Messages are published to the configured exchange with the configured routing key
 * and consumed from the queue. The instance owns one connection and one channel and is
 * meant to be used from a single thread.
 *
 * <p>Acknowledgments are not supported: consume with {@link ConsumeOptions#isAutoAck()}
 * or let unacknowledged messages be requeued when the channel closes.
 */
public class RabbitMQQueue implements Queue<Long, byte[], AMQP.BasicProperties, RabbitMQQueueElement> {

    private static final Logger LOGGER = LoggerFactory.getLogger(RabbitMQQueue.class);

    private final RabbitMQSettings settings;

    private Connection conn;
    private Channel channel;
    private BlockingMessageConsumer consumer;

    public RabbitMQQueue(final String queue) {
        this(RabbitMQSettings.builder(queue).build());
    }

    public RabbitMQQueue(final RabbitMQSettings settings) {
        this.settings = Preconditions.checkNotNull(settings, "settings");
        reset();
    }

    public String getName() {
        return settings.getQueue();
    }

    public RabbitMQSettings getSettings() {
        return settings;
    }

    /**
     * Opens a connection and a channel. On connection failures either fails right away or,
     * with {@code retry}, waits as the connect back-off policy says and tries again until the
     * policy times out. Interrupting the calling thread stops retrying.
     *
     * @throws QueueConnectionException if the broker could not be reached
     * @throws QueueOperationException if the channel could not be opened for another reason
     * @throws IllegalStateException if the queue is already connected
     */
    @Override
    public void connect(final boolean retry) throws QueueException {
        if (isConnected()) {
            throw new IllegalStateException(String.format("Queue '%s' is already connected", getName()));
        }
        if (conn != null || channel != null) {
            disconnect();
        }

        final ConnectionFactory connectionFactory = settings.createConnectionFactory();
        int attempt = 0;
        while (true) {
            attempt++;
            LOGGER.info("Connecting to queue '{}'...", getName());
            final Exception failure = tryConnect(connectionFactory);
            if (failure == null) {
                LOGGER.info("Connected to queue '{}'", getName());
                return;
            }

            LOGGER.error("Failed to connect to queue '{}': {}", getName(), failure.toString());
            if (!retry) {
                throw new QueueConnectionException(
                        String.format("Failed to connect to queue '%s'", getName()), failure);
            }
            waitBeforeRetry(attempt, failure);
        }
    }

    /**
     * Cancels the consumer, then closes the channel and the connection. Every failure is
     * logged and ignored, the queue always ends up disconnected.
     */
    @Override
    public void disconnect() {
        LOGGER.info("Disconnecting from queue '{}'...", getName());
        if (consumer != null && channel != null) {
            try {
                channel.basicCancel(consumer.getTag());
            } catch (final Exception e) {
                LOGGER.error("Failed to cancel consumer of queue '{}': {}", getName(), e.toString());
            }
        }

        closeQuietly(channel, "channel");
        closeQuietly(conn, "connection");

        reset();
        LOGGER.info("Disconnected from queue '{}'", getName());
    }

    @Override
    public boolean isConnected() {
        return channel != null && channel.isOpen();
    }

    @Override
    public void push(final byte[] message) throws QueueException {
        push(message, PublishOptions.DEFAULT);
    }

    public void push(final byte[] message, final PublishOptions options) throws QueueException {
        Preconditions.checkNotNull(message, "message");
        Preconditions.checkNotNull(options, "options");

        final Channel ch = requireChannel();
        try {
            ch.basicPublish(settings.getExchange(), settings.getRoutingKey(),
                    options.isMandatory(), options.getProperties(), message);
        } catch (final IOException | RuntimeException e) {
            throw RabbitMQExceptions.translate(
                    String.format("Failed to push message to queue '%s'", getName()), e);
        }
        LOGGER.debug("Pushed {} byte(s) to exchange '{}' with routing key '{}'",
                message.length, settings.getExchange(), settings.getRoutingKey());
    }

    /**
     * Takes one message using the consume options from the settings.
     */
    @Override
    public RabbitMQQueueElement pop() throws QueueException {
        return pop(settings.getConsumeOptions());
    }

    /**
     * Takes one message, blocking until it arrives. The first call starts consuming from the
     * queue with {@code options}; later calls must describe the same consumer.
     *
     * @return the message, or null if the inactivity timeout of {@code options} elapsed
     * @throws QueueOperationException if {@code options} don't match the active consumer
     */
    public RabbitMQQueueElement pop(final ConsumeOptions options) throws QueueException {
        Preconditions.checkNotNull(options, "options");

        final Channel ch = requireChannel();
        final Delivery delivery;
        try {
            delivery = consumerFor(ch, options).next(options.getInactivityTimeout());
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new QueueOperationException(
                    String.format("Interrupted while popping from queue '%s'", getName()), e);
        } catch (final IOException | RuntimeException e) {
            throw RabbitMQExceptions.translate(
                    String.format("Failed to pop message from queue '%s'", getName()), e);
        }

        if (delivery == null) {
            LOGGER.debug("No message in queue '{}' within {}", getName(), options.getInactivityTimeout());
            return null;
        }
        return new RabbitMQQueueElement(
                delivery.getEnvelope().getDeliveryTag(),
                delivery.getBody(),
                delivery.getProperties(),
                delivery.getEnvelope().isRedeliver());
    }

    @Override
    public void ack(final Long deliveryTag) {
        throw new UnsupportedOperationException("Sorry, RabbitMQQueue cannot ack, consume with autoAck instead");
    }

    @Override
    public void nack(final Long deliveryTag, final boolean requeue) {
        throw new UnsupportedOperationException("Sorry, RabbitMQQueue cannot nack, consume with autoAck instead");
    }

    private void reset() {
        conn = null;
        channel = null;
        consumer = null;
    }

    /**
     * @return null on success, the connection failure otherwise
     */
    private Exception tryConnect(final ConnectionFactory connectionFactory) throws QueueOperationException {
        try {
            conn = connectionFactory.newConnection();
        } catch (final IOException | TimeoutException e) {
            reset();
            return e;
        }

        try {
            channel = conn.createChannel();
            if (channel == null) {
                throw new IOException("No channel number available");
            }
            return null;
        } catch (final IOException | ShutdownSignalException e) {
            closeQuietly(conn, "connection");
            reset();
            if (RabbitMQExceptions.isConnectionFailure(e)) {
                return e;
            }
            throw new QueueOperationException(
                    String.format("Failed to open channel for queue '%s'", getName()), e);
        }
    }

    private void waitBeforeRetry(final int attempt, final Exception failure) throws QueueConnectionException {
        final Duration delay = Preconditions.checkNotNull(settings.getConnectBackOff().delay(attempt),
                "Back-off policy %s returned no delay for attempt %s", settings.getConnectBackOff(), attempt);
        if (BackOffDelayPolicy.TIMEOUT.equals(delay)) {
            throw new QueueConnectionException(String.format(
                    "Could not connect to queue '%s' after %d attempt(s)", getName(), attempt), failure);
        }
        LOGGER.debug("Retrying to connect to queue '{}' in {} ms", getName(), delay.toMillis());
        if (delay.isZero()) {
            return;
        }
        try {
            Thread.sleep(delay.toMillis());
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new QueueConnectionException(
                    String.format("Interrupted while connecting to queue '%s'", getName()), e);
        }
    }

    private Channel requireChannel() throws QueueOperationException {
        if (channel == null) {
            throw new QueueOperationException(String.format("Queue '%s' is not connected", getName()));
        }
        return channel;
    }

    private BlockingMessageConsumer consumerFor(final Channel ch, final ConsumeOptions options)
            throws IOException, QueueOperationException {
        if (consumer == null) {
            final BlockingMessageConsumer newConsumer = new BlockingMessageConsumer(ch, options);
            newConsumer.setTag(ch.basicConsume(getName(), options.isAutoAck(), "", false,
                    options.isExclusive(), options.getArguments(), newConsumer));
            consumer = newConsumer;
            LOGGER.debug("Started consumer '{}' on queue '{}' with {}", consumer.getTag(), getName(), options);
        } else if (!consumer.getOptions().describesSameConsumer(options)) {
            throw new QueueOperationException(String.format(
                    "Queue '%s' is consumed with %s, can't pop with %s",
                    getName(), consumer.getOptions(), options));
        }
        return consumer;
    }

    private void closeQuietly(final AutoCloseable closeable, final String what) {
        if (closeable == null) {
            return;
        }
        try {
            closeable.close();
        } catch (final Exception e) {
            LOGGER.error("Failed to close {} of queue '{}': {}", what, getName(), e.toString());
        }
    }
}
