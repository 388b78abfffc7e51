package org.github.rmqueue.client.rabbitmq;

import com.rabbitmq.client.AlreadyClosedException;
import com.rabbitmq.client.ShutdownSignalException;
import org.github.rmqueue.client.QueueOperationException;
import org.junit.Before;
import org.junit.Test;
import org.mockito.InOrder;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.Assert.assertFalse;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

public class RabbitMQQueueDisconnectTest {

    private MockRabbitMQ rabbit;
    private RabbitMQQueue queue;

    @Before
    public void setUp() throws Exception {
        rabbit = new MockRabbitMQ();
        queue = rabbit.queue();
        queue.connect();
    }

    @Test
    public void testDisconnectCancelsConsumerThenClosesChannelAndConnection() throws Exception {
        rabbit.enqueue("test-1");
        queue.pop(ConsumeOptions.builder().autoAck(true).build());

        queue.disconnect();

        InOrder order = inOrder(rabbit.channel, rabbit.connection);
        order.verify(rabbit.channel).basicCancel("ctag-1");
        order.verify(rabbit.channel).close();
        order.verify(rabbit.connection).close();
        assertFalse(queue.isConnected());
    }

    @Test
    public void testDisconnectWithoutConsumerDoesNotCancel() throws Exception {
        queue.disconnect();

        verify(rabbit.channel, never()).basicCancel(anyString());
        verify(rabbit.channel).close();
        verify(rabbit.connection).close();
    }

    @Test
    public void testDisconnectSwallowsEveryFailure() throws Exception {
        rabbit.enqueue("test-1");
        queue.pop();
        doThrow(new IOException("cancel failed")).when(rabbit.channel).basicCancel(anyString());
        doThrow(new TimeoutException("close timed out")).when(rabbit.channel).close();
        doThrow(new AlreadyClosedException(new ShutdownSignalException(true, false, null, rabbit.connection)))
                .when(rabbit.connection).close();

        queue.disconnect();

        verify(rabbit.connection).close();
        assertFalse(queue.isConnected());
    }

    @Test
    public void testConnectionIsClosedWhenChannelCloseFails() throws Exception {
        doThrow(new IOException("close failed")).when(rabbit.channel).close();

        queue.disconnect();

        verify(rabbit.connection).close();
    }

    @Test(expected = QueueOperationException.class)
    public void testPushAfterDisconnectFails() throws Exception {
        queue.disconnect();
        queue.push("test-1".getBytes(UTF_8));
    }

    @Test
    public void testDisconnectIsIdempotent() {
        queue.disconnect();
        queue.disconnect();

        assertFalse(queue.isConnected());
    }

    @Test
    public void testDisconnectWithoutConnect() {
        RabbitMQQueue other = rabbit.queue();

        other.disconnect();

        assertFalse(other.isConnected());
    }
}
