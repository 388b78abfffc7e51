package org.github.rmqueue.client.rabbitmq;

import com.rabbitmq.client.AMQP;
import org.github.rmqueue.client.Queue;
import org.github.rmqueue.client.QueueElement;
import org.github.rmqueue.client.Queues;

import java.io.BufferedReader;
import java.io.InputStreamReader;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Manual check against a running broker: connects, waits for Enter, pushes one message
 * and then prints everything popped from the queue until killed.
 *
 * <p>Reads {@code rmqueue.properties} from the classpath when present, otherwise uses
 * queue {@code testq} on a local broker.
 */
public final class RabbitMQQueueConsole {

    static final String CONFIG_RESOURCE = "rmqueue.properties";
    static final String DEFAULT_QUEUE = "testq";

    private RabbitMQQueueConsole() {}

    public static void main(String[] args) throws Exception {
        final RabbitMQQueue rabbitQueue = new RabbitMQQueue(settings().build());
        final Queue<Long, String, AMQP.BasicProperties, QueueElement<Long, String, AMQP.BasicProperties>> queue =
                Queues.createStringQueue(rabbitQueue);

        queue.connect();
        try {
            System.out.println("Connected to " + rabbitQueue.getName() + ", press Enter to push a message");
            new BufferedReader(new InputStreamReader(System.in, UTF_8)).readLine();
            queue.push("blah");
            while (true) {
                System.out.println(queue.pop());
            }
        } finally {
            queue.disconnect();
        }
    }

    static RabbitMQSettings.Builder settings() {
        final RabbitMQSettings.Builder builder =
                RabbitMQQueueConsole.class.getClassLoader().getResource(CONFIG_RESOURCE) != null
                        ? RabbitMQQueues.settingsFromResource(CONFIG_RESOURCE)
                        : RabbitMQSettings.builder(DEFAULT_QUEUE);
        return builder.consumeOptions(ConsumeOptions.builder().autoAck(true).build());
    }
}
