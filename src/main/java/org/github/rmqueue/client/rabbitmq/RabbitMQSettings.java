package org.github.rmqueue.client.rabbitmq;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.rabbitmq.client.ConnectionFactory;
import org.github.rmqueue.client.BackOffDelayPolicy;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Connection parameters and addressing of a {@link RabbitMQQueue}.
 *
 * <p>Extra connection properties are handed to {@link ConnectionFactory#load(Map)} as they are,
 * e.g. {@code connection.heartbeat} or {@code connection.timeout}.
 */
public final class RabbitMQSettings {

    public static final String DEFAULT_HOST = "localhost";
    public static final int DEFAULT_PORT = ConnectionFactory.DEFAULT_AMQP_PORT;
    public static final String DEFAULT_VIRTUAL_HOST = "/";
    public static final String DEFAULT_USERNAME = "guest";
    public static final String DEFAULT_PASSWORD = "guest";
    public static final String DEFAULT_EXCHANGE = "";
    public static final Duration DEFAULT_CONNECT_RETRY_DELAY = Duration.ofSeconds(1);

    private static final String CONNECTION_PROPERTIES_PREFIX = "rabbitmq.";

    // set through the dedicated builder methods only
    private static final Set<String> RESERVED_CONNECTION_PROPERTIES =
            ImmutableSet.of("host", "port", "virtual.host", "username", "password", "uri");

    private final String queue;
    private final String host;
    private final int port;
    private final String virtualHost;
    private final String username;
    private final String password;
    private final String exchange;
    private final String routingKey;
    private final ConnectionFactory connectionFactory;
    private final Map<String, String> connectionProperties;
    private final BackOffDelayPolicy connectBackOff;
    private final ConsumeOptions consumeOptions;

    private RabbitMQSettings(final Builder builder) {
        this.queue = builder.queue;
        this.host = builder.host;
        this.port = builder.port;
        this.virtualHost = builder.virtualHost;
        this.username = builder.username;
        this.password = builder.password;
        this.exchange = builder.exchange;
        this.routingKey = Strings.isNullOrEmpty(builder.routingKey) ? builder.queue : builder.routingKey;
        this.connectionFactory = builder.connectionFactory;
        this.connectionProperties = ImmutableMap.copyOf(builder.connectionProperties);
        this.connectBackOff = builder.connectBackOff;
        this.consumeOptions = builder.consumeOptions;
    }

    public static Builder builder(final String queue) {
        return new Builder(queue);
    }

    public String getQueue() {
        return queue;
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    public String getVirtualHost() {
        return virtualHost;
    }

    public String getUsername() {
        return username;
    }

    public String getExchange() {
        return exchange;
    }

    public String getRoutingKey() {
        return routingKey;
    }

    public Map<String, String> getConnectionProperties() {
        return connectionProperties;
    }

    public BackOffDelayPolicy getConnectBackOff() {
        return connectBackOff;
    }

    public ConsumeOptions getConsumeOptions() {
        return consumeOptions;
    }

    /**
     * Applies these settings to a copy of the configured connection factory, or to a new one.
     * The configured factory itself is left untouched so it can be shared between queues.
     * Automatic recovery is off unless the extra connection properties enable it.
     */
    ConnectionFactory createConnectionFactory() {
        final ConnectionFactory factory = connectionFactory == null ? new ConnectionFactory() : connectionFactory.clone();
        factory.setAutomaticRecoveryEnabled(false);
        if (!connectionProperties.isEmpty()) {
            final Map<String, String> prefixed = new LinkedHashMap<>();
            connectionProperties.forEach((k, v) -> prefixed.put(CONNECTION_PROPERTIES_PREFIX + k, v));
            factory.load(prefixed, CONNECTION_PROPERTIES_PREFIX);
        }
        factory.setHost(host);
        factory.setPort(port);
        factory.setVirtualHost(virtualHost);
        factory.setUsername(username);
        factory.setPassword(password);
        return factory;
    }

    @Override
    public String toString() {
        return "RabbitMQSettings{" +
                "queue='" + queue + '\'' +
                ", host='" + host + '\'' +
                ", port=" + port +
                ", virtualHost='" + virtualHost + '\'' +
                ", username='" + username + '\'' +
                ", exchange='" + exchange + '\'' +
                ", routingKey='" + routingKey + '\'' +
                ", connectionProperties=" + connectionProperties.keySet() +
                ", connectBackOff=" + connectBackOff +
                ", consumeOptions=" + consumeOptions +
                '}';
    }

    public static final class Builder {

        private final String queue;
        private String host = DEFAULT_HOST;
        private int port = DEFAULT_PORT;
        private String virtualHost = DEFAULT_VIRTUAL_HOST;
        private String username = DEFAULT_USERNAME;
        private String password = DEFAULT_PASSWORD;
        private String exchange = DEFAULT_EXCHANGE;
        private String routingKey;
        private ConnectionFactory connectionFactory;
        private final Map<String, String> connectionProperties = new LinkedHashMap<>();
        private BackOffDelayPolicy connectBackOff = BackOffDelayPolicy.fixed(DEFAULT_CONNECT_RETRY_DELAY);
        private ConsumeOptions consumeOptions = ConsumeOptions.DEFAULT;

        private Builder(final String queue) {
            if (Strings.isNullOrEmpty(queue)) {
                throw new IllegalArgumentException("Argument queue is null or empty");
            }
            this.queue = queue;
        }

        public Builder host(final String host) {
            this.host = Preconditions.checkNotNull(host, "host");
            return this;
        }

        public Builder port(final int port) {
            Preconditions.checkArgument(port > 0 && port <= 0xFFFF, "Invalid port: %s", port);
            this.port = port;
            return this;
        }

        public Builder virtualHost(final String virtualHost) {
            this.virtualHost = Preconditions.checkNotNull(virtualHost, "virtualHost");
            return this;
        }

        public Builder credentials(final String username, final String password) {
            this.username = Preconditions.checkNotNull(username, "username");
            this.password = Preconditions.checkNotNull(password, "password");
            return this;
        }

        public Builder exchange(final String exchange) {
            this.exchange = Preconditions.checkNotNull(exchange, "exchange");
            return this;
        }

        /**
         * @param routingKey routing key used on publish, null or empty for the queue name
         */
        public Builder routingKey(final String routingKey) {
            this.routingKey = routingKey;
            return this;
        }

        /**
         * Overrides the factory the connection is opened with. Every connect works on a clone
         * of it, so the same factory can back several queues.
         */
        public Builder connectionFactory(final ConnectionFactory connectionFactory) {
            this.connectionFactory = connectionFactory;
            return this;
        }

        public Builder connectionProperty(final String key, final String value) {
            Preconditions.checkNotNull(key, "key");
            Preconditions.checkNotNull(value, "value");
            if (RESERVED_CONNECTION_PROPERTIES.contains(key)) {
                throw new IllegalArgumentException(String.format(
                        "Connection property '%s' duplicates an explicit parameter", key));
            }
            connectionProperties.put(key, value);
            return this;
        }

        public Builder connectionProperties(final Map<String, String> properties) {
            properties.forEach(this::connectionProperty);
            return this;
        }

        public Builder connectBackOff(final BackOffDelayPolicy connectBackOff) {
            this.connectBackOff = Preconditions.checkNotNull(connectBackOff, "connectBackOff");
            return this;
        }

        /**
         * Options used by {@link RabbitMQQueue#pop()}.
         */
        public Builder consumeOptions(final ConsumeOptions consumeOptions) {
            this.consumeOptions = Preconditions.checkNotNull(consumeOptions, "consumeOptions");
            return this;
        }

        public RabbitMQSettings build() {
            return new RabbitMQSettings(this);
        }
    }
}
