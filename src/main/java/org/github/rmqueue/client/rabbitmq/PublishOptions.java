package org.github.rmqueue.client.rabbitmq;

import com.rabbitmq.client.AMQP;

/**
 * Options passed through to {@code basicPublish}.
 */
public final class PublishOptions {

    public static final PublishOptions DEFAULT = new PublishOptions(false, null);

    private final boolean mandatory;
    private final AMQP.BasicProperties properties;

    private PublishOptions(final boolean mandatory, final AMQP.BasicProperties properties) {
        this.mandatory = mandatory;
        this.properties = properties;
    }

    public static PublishOptions of(final AMQP.BasicProperties properties) {
        return new PublishOptions(false, properties);
    }

    public PublishOptions mandatory(final boolean mandatory) {
        return new PublishOptions(mandatory, properties);
    }

    public PublishOptions properties(final AMQP.BasicProperties properties) {
        return new PublishOptions(mandatory, properties);
    }

    public boolean isMandatory() {
        return mandatory;
    }

    /**
     * @return message properties, null to publish without any
     */
    public AMQP.BasicProperties getProperties() {
        return properties;
    }

    @Override
    public String toString() {
        return "PublishOptions{" +
                "mandatory=" + mandatory +
                ", properties=" + properties +
                '}';
    }
}
