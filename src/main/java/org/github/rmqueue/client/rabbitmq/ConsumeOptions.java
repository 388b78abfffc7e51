package org.github.rmqueue.client.rabbitmq;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Options passed through to {@code basicConsume} when a queue starts consuming.
 *
 * <p>{@code autoAck}, {@code exclusive} and {@code arguments} describe the consumer
 * and can't change while it is active. {@code inactivityTimeout} only bounds the
 * wait of a single pop.
 */
public final class ConsumeOptions {

    public static final ConsumeOptions DEFAULT = builder().build();

    private final boolean autoAck;
    private final boolean exclusive;
    private final Map<String, Object> arguments;
    private final Duration inactivityTimeout;

    private ConsumeOptions(final Builder builder) {
        this.autoAck = builder.autoAck;
        this.exclusive = builder.exclusive;
        this.arguments = ImmutableMap.copyOf(builder.arguments);
        this.inactivityTimeout = builder.inactivityTimeout;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .autoAck(autoAck)
                .exclusive(exclusive)
                .arguments(arguments)
                .inactivityTimeout(inactivityTimeout);
    }

    public boolean isAutoAck() {
        return autoAck;
    }

    public boolean isExclusive() {
        return exclusive;
    }

    public Map<String, Object> getArguments() {
        return arguments;
    }

    /**
     * @return how long a pop waits for a message, null to wait forever
     */
    public Duration getInactivityTimeout() {
        return inactivityTimeout;
    }

    boolean describesSameConsumer(final ConsumeOptions other) {
        return autoAck == other.autoAck
                && exclusive == other.exclusive
                && Objects.equals(arguments, other.arguments);
    }

    @Override
    public String toString() {
        return "ConsumeOptions{" +
                "autoAck=" + autoAck +
                ", exclusive=" + exclusive +
                ", arguments=" + arguments +
                ", inactivityTimeout=" + inactivityTimeout +
                '}';
    }

    public static final class Builder {

        private boolean autoAck;
        private boolean exclusive;
        private Map<String, Object> arguments = ImmutableMap.of();
        private Duration inactivityTimeout;

        private Builder() {}

        public Builder autoAck(final boolean autoAck) {
            this.autoAck = autoAck;
            return this;
        }

        public Builder exclusive(final boolean exclusive) {
            this.exclusive = exclusive;
            return this;
        }

        public Builder arguments(final Map<String, Object> arguments) {
            this.arguments = Preconditions.checkNotNull(arguments, "arguments");
            return this;
        }

        public Builder inactivityTimeout(final Duration inactivityTimeout) {
            Preconditions.checkArgument(inactivityTimeout == null || !inactivityTimeout.isNegative(),
                    "Inactivity timeout should not be negative: %s", inactivityTimeout);
            this.inactivityTimeout = inactivityTimeout;
            return this;
        }

        public ConsumeOptions build() {
            return new ConsumeOptions(this);
        }
    }
}
