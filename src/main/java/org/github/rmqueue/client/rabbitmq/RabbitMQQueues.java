package org.github.rmqueue.client.rabbitmq;

import com.google.common.base.Strings;
import org.github.rmqueue.client.BackOffDelayPolicy;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Properties;
import java.util.function.Consumer;

/**
 * Creates {@link RabbitMQQueue}s from properties.
 *
 * <p>Recognized keys: {@code queue} (required), {@code host}, {@code port}, {@code virtual.host},
 * {@code username}, {@code password}, {@code exchange}, {@code routing.key},
 * {@code connect.retry.delay.ms}, {@code connect.max.attempts} and {@code consume.auto.ack}.
 * Keys starting with {@code rabbitmq.} are passed to the connection factory without the prefix.
 */
public class RabbitMQQueues {

    static final String CONNECTION_PROPERTY_PREFIX = "rabbitmq.";

    private RabbitMQQueues() {}

    public static RabbitMQQueue fromProperties(final Properties properties) {
        return new RabbitMQQueue(settingsFromProperties(properties).build());
    }

    public static RabbitMQQueue fromResource(final String resource) {
        return new RabbitMQQueue(settingsFromResource(resource).build());
    }

    public static RabbitMQSettings.Builder settingsFromResource(final String resource) {
        try (InputStream in = RabbitMQQueues.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalArgumentException(String.format("Resource '%s' not found", resource));
            }
            final Properties properties = new Properties();
            properties.load(in);
            return settingsFromProperties(properties);
        } catch (final IOException e) {
            throw new UncheckedIOException(String.format("Failed to read resource '%s'", resource), e);
        }
    }

    public static RabbitMQSettings.Builder settingsFromProperties(final Properties properties) {
        final String queue = properties.getProperty("queue");
        if (Strings.isNullOrEmpty(queue)) {
            throw new IllegalArgumentException("Property 'queue' is null or empty");
        }

        final RabbitMQSettings.Builder builder = RabbitMQSettings.builder(queue);
        ifPresent(properties, "host", builder::host);
        ifPresent(properties, "port", v -> builder.port(parseInt("port", v)));
        ifPresent(properties, "virtual.host", builder::virtualHost);
        builder.credentials(
                properties.getProperty("username", RabbitMQSettings.DEFAULT_USERNAME),
                properties.getProperty("password", RabbitMQSettings.DEFAULT_PASSWORD));
        ifPresent(properties, "exchange", builder::exchange);
        ifPresent(properties, "routing.key", builder::routingKey);
        ifPresent(properties, "consume.auto.ack", v -> builder.consumeOptions(
                ConsumeOptions.builder().autoAck(Boolean.parseBoolean(v)).build()));

        final long retryDelay = parseLong("connect.retry.delay.ms", properties.getProperty(
                "connect.retry.delay.ms", String.valueOf(RabbitMQSettings.DEFAULT_CONNECT_RETRY_DELAY.toMillis())));
        final int maxAttempts = parseInt("connect.max.attempts", properties.getProperty("connect.max.attempts", "0"));
        builder.connectBackOff(BackOffDelayPolicy.fixed(Duration.ofMillis(retryDelay), maxAttempts));

        for (final String key : properties.stringPropertyNames()) {
            if (key.startsWith(CONNECTION_PROPERTY_PREFIX)) {
                builder.connectionProperty(key.substring(CONNECTION_PROPERTY_PREFIX.length()), properties.getProperty(key));
            }
        }
        return builder;
    }

    private static void ifPresent(final Properties properties, final String key, final Consumer<String> setter) {
        final String value = properties.getProperty(key);
        if (value != null) {
            setter.accept(value);
        }
    }

    private static int parseInt(final String key, final String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (final NumberFormatException e) {
            throw new IllegalArgumentException(String.format("Property '%s' is not a number: '%s'", key, value), e);
        }
    }

    private static long parseLong(final String key, final String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (final NumberFormatException e) {
            throw new IllegalArgumentException(String.format("Property '%s' is not a number: '%s'", key, value), e);
        }
    }
}
