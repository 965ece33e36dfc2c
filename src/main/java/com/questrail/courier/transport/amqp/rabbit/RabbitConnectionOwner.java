package com.questrail.courier.transport.amqp.rabbit;

import com.questrail.courier.api.BrokerException;
import com.questrail.courier.config.BrokerConfig;

import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;

import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.TimeoutException;

/**
 * RabbitConnectionOwner
 * =============================================================================
 * Owns the single RabbitMQ {@link Connection} shared by every channel of a
 * runtime.
 *
 * <h2>Recovery policy</h2>
 * Automatic connection recovery is enabled, topology recovery is not: after a
 * recovery each {@link RabbitBrokerChannel} reports itself connected again and
 * its owner re-declares and re-consumes what it needs. Randomized queue names
 * are therefore fresh after every recovery.
 *
 * <p>The connection is opened on first use. The client library does not retry
 * a failed <em>initial</em> connection; that failure surfaces as a
 * {@link BrokerException}.</p>
 */
public final class RabbitConnectionOwner implements AutoCloseable
{
    private final ConnectionFactory factory;
    private final String connectionName;
    private final Object lock = new Object();

    private Connection connection;

    public RabbitConnectionOwner(BrokerConfig config, String connectionName) {
        Objects.requireNonNull(config, "config");
        this.connectionName = Objects.requireNonNull(connectionName, "connectionName");

        ConnectionFactory f = new ConnectionFactory();
        f.setHost(config.host());
        f.setPort(config.port());
        f.setUsername(config.username());
        f.setPassword(config.password());
        f.setVirtualHost(config.virtualHost());
        f.setAutomaticRecoveryEnabled(true);
        f.setTopologyRecoveryEnabled(false);
        this.factory = f;
    }

    /**
     * Returns the open connection, opening it if necessary.
     */
    public Connection connection() {
        synchronized (lock) {
            if (connection == null) {
                try {
                    connection = factory.newConnection(connectionName);
                } catch (IOException | TimeoutException e) {
                    throw new BrokerException("Cannot connect to " + factory.getHost() + ":" + factory.getPort(), e);
                }
            }
            return connection;
        }
    }

    @Override
    public void close() {
        final Connection toClose;
        synchronized (lock) {
            toClose = connection;
            connection = null;
        }
        if (toClose != null && toClose.isOpen()) {
            try {
                toClose.close();
            } catch (IOException e) {
                throw new BrokerException("Failed to close connection " + connectionName, e);
            }
        }
    }
}
