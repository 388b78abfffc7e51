package org.github.rmqueue.client.rabbitmq;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.client.Consumer;
import com.rabbitmq.client.Envelope;
import org.github.rmqueue.client.BackOffDelayPolicy;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Mocked client objects behind a {@link RabbitMQQueue} named {@code test}.
 * Messages enqueued before a consumer exists are delivered as soon as it is registered.
 */
class MockRabbitMQ {

    static final String QUEUE = "test";

    final ConnectionFactory connectionFactory = mock(ConnectionFactory.class);
    final Connection connection = mock(Connection.class);
    final Channel channel = mock(Channel.class);

    private final List<Consumer> consumers = new ArrayList<>();
    private final List<String> pending = new ArrayList<>();
    private long deliveryTag;

    MockRabbitMQ() throws Exception {
        when(connectionFactory.clone()).thenReturn(connectionFactory);
        when(connectionFactory.newConnection()).thenReturn(connection);
        when(connection.createChannel()).thenReturn(channel);
        when(channel.isOpen()).thenReturn(true);
        when(channel.basicConsume(anyString(), anyBoolean(), anyString(), anyBoolean(), anyBoolean(),
                anyMap(), any(Consumer.class))).thenAnswer(invocation -> {
            consumers.add(invocation.getArgument(6));
            for (String body : pending) {
                deliver(body);
            }
            pending.clear();
            return "ctag-" + consumers.size();
        });
    }

    RabbitMQSettings.Builder settings() {
        return RabbitMQSettings.builder(QUEUE)
                .connectionFactory(connectionFactory)
                .connectBackOff(BackOffDelayPolicy.fixed(Duration.ZERO));
    }

    RabbitMQQueue queue() {
        return new RabbitMQQueue(settings().build());
    }

    void enqueue(String body) {
        if (consumers.isEmpty()) {
            pending.add(body);
        } else {
            deliver(body);
        }
    }

    Consumer lastConsumer() {
        return consumers.get(consumers.size() - 1);
    }

    int consumerCount() {
        return consumers.size();
    }

    private void deliver(String body) {
        deliveryTag++;
        try {
            lastConsumer().handleDelivery("ctag-" + consumers.size(),
                    new Envelope(deliveryTag, false, "", QUEUE),
                    new AMQP.BasicProperties.Builder().contentType("text/plain").build(),
                    body.getBytes(UTF_8));
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }
}
