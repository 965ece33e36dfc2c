package com.questrail.courier.transport.amqp.rabbit;

import com.questrail.courier.api.BrokerException;
import com.questrail.courier.config.ChannelParameters;
import com.questrail.courier.config.ExchangeParameters;
import com.questrail.courier.config.QueueParameters;
import com.questrail.courier.transport.BrokerChannel;
import com.questrail.courier.transport.BrokerChannelListener;
import com.questrail.courier.transport.InboundMessage;
import com.questrail.courier.transport.InboundReturn;
import com.questrail.courier.transport.OutboundProperties;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.AlreadyClosedException;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.DefaultConsumer;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.Recoverable;
import com.rabbitmq.client.RecoveryListener;
import com.rabbitmq.client.Return;
import com.rabbitmq.client.ShutdownSignalException;

import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * RabbitBrokerChannel
 * =============================================================================
 * RabbitMQ-backed implementation of the {@link BrokerChannel} port.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>. It MUST NOT decode
 * bodies, correlate replies or emit {@code RequesterEvent}s.
 *
 * <h2>RabbitMQ containment rule</h2>
 * {@code com.rabbitmq.client} types MUST NOT escape this package. Inbound
 * messages are copied into {@link InboundMessage} / {@link InboundReturn}
 * before reaching the listener.
 *
 * <h2>Lifecycle</h2>
 * <ul>
 *   <li>{@link #start()} opens the channel and reports {@code onConnected}.</li>
 *   <li>A connection loss reports {@code onDisconnected(cause)}; the client's
 *       automatic recovery later reports {@code onConnected} again. Consumers are
 *       not recovered: the listener re-consumes.</li>
 *   <li>{@link #stop()} closes the channel and reports {@code onDisconnected(null)}.</li>
 * </ul>
 */
public final class RabbitBrokerChannel implements BrokerChannel
{
    private final RabbitConnectionOwner connectionOwner;
    private final AtomicBoolean up = new AtomicBoolean(false);

    private volatile BrokerChannelListener listener;
    private volatile Channel channel;

    public RabbitBrokerChannel(RabbitConnectionOwner connectionOwner) {
        this.connectionOwner = Objects.requireNonNull(connectionOwner, "connectionOwner");
    }

    @Override
    public void setListener(BrokerChannelListener listener) {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void start() {
        BrokerChannelListener l = requireListener();

        final Channel ch;
        try {
            ch = connectionOwner.connection().createChannel();
        } catch (IOException e) {
            throw new BrokerException("Cannot open channel", e);
        }
        if (ch == null) {
            throw new BrokerException("Cannot open channel: channel limit reached", null);
        }

        ch.addShutdownListener(this::onShutdown);
        ch.addReturnListener((Return r) -> l.onReturned(new InboundReturn(
                r.getReplyCode(),
                r.getReplyText(),
                r.getExchange(),
                r.getRoutingKey(),
                r.getProperties().getContentEncoding(),
                r.getProperties().getContentType(),
                r.getProperties().getCorrelationId(),
                r.getBody())));
        if (ch instanceof Recoverable recoverable) {
            recoverable.addRecoveryListener(new RecoveryListener() {
                @Override
                public void handleRecovery(Recoverable recovered) {
                    markUp();
                }

                @Override
                public void handleRecoveryStarted(Recoverable recovering) {
                    // onDisconnected has already been reported by the shutdown listener
                }
            });
        }

        channel = ch;
        markUp();
    }

    @Override
    public void stop() {
        Channel ch = channel;
        channel = null;
        if (ch != null && ch.isOpen()) {
            try {
                ch.close();
            } catch (IOException | TimeoutException | AlreadyClosedException e) {
                markDown(e);
                return;
            }
        }
        markDown(null);
    }

    @Override
    public void publish(String exchange,
                        String routingKey,
                        boolean mandatory,
                        boolean immediate,
                        OutboundProperties properties,
                        byte[] body) {
        AMQP.BasicProperties props = new AMQP.BasicProperties.Builder()
                .contentEncoding(properties.contentEncoding())
                .contentType(properties.contentType())
                .correlationId(properties.correlationId())
                .replyTo(properties.replyTo())
                .deliveryMode(properties.deliveryMode())
                .build();
        try {
            requireChannel().basicPublish(exchange, routingKey, mandatory, immediate, props, body);
        } catch (IOException | AlreadyClosedException e) {
            throw new BrokerException("Publish to '" + exchange + "' with key '" + routingKey + "' failed", e);
        }
    }

    @Override
    public String declareQueue(QueueParameters queue) {
        try {
            Channel ch = requireChannel();
            AMQP.Queue.DeclareOk ok = queue.passive()
                    ? ch.queueDeclarePassive(queue.name())
                    : ch.queueDeclare(queue.name(), queue.durable(), queue.exclusive(), queue.autodelete(), null);
            return ok.getQueue();
        } catch (IOException | AlreadyClosedException e) {
            throw new BrokerException("Declaring queue '" + queue.name() + "' failed", e);
        }
    }

    @Override
    public void declareExchange(ExchangeParameters exchange) {
        if (exchange.isDefaultExchange()) {
            return;
        }
        try {
            Channel ch = requireChannel();
            if (exchange.passive()) {
                ch.exchangeDeclarePassive(exchange.name());
            } else {
                ch.exchangeDeclare(exchange.name(), exchange.type(), exchange.durable(), exchange.autodelete(), null);
            }
        } catch (IOException | AlreadyClosedException e) {
            throw new BrokerException("Declaring exchange '" + exchange.name() + "' failed", e);
        }
    }

    @Override
    public void bind(String exchange, String queue, String routingKey) {
        try {
            requireChannel().queueBind(queue, exchange, routingKey);
        } catch (IOException | AlreadyClosedException e) {
            throw new BrokerException("Binding '" + queue + "' to '" + exchange + "' failed", e);
        }
    }

    @Override
    public void consume(String queue) {
        Channel ch = requireChannel();
        try {
            ch.basicConsume(queue, false, new InboundConsumer(ch));
        } catch (IOException | AlreadyClosedException e) {
            throw new BrokerException("Consuming from '" + queue + "' failed", e);
        }
    }

    @Override
    public void ack(long deliveryTag) {
        try {
            requireChannel().basicAck(deliveryTag, false);
        } catch (IOException | AlreadyClosedException e) {
            throw new BrokerException("Ack of delivery " + deliveryTag + " failed", e);
        }
    }

    @Override
    public void qos(ChannelParameters parameters) {
        try {
            requireChannel().basicQos(parameters.prefetchCount(), parameters.prefetchIsGlobal());
        } catch (IOException | AlreadyClosedException e) {
            throw new BrokerException("Setting prefetch failed", e);
        }
    }

    // -------------------------------------------------------------------------
    // Lifecycle notifications
    // -------------------------------------------------------------------------

    private void onShutdown(ShutdownSignalException cause) {
        markDown(cause.isInitiatedByApplication() ? null : cause);
    }

    private void markUp() {
        BrokerChannelListener l = listener;
        if (up.compareAndSet(false, true) && l != null) {
            l.onConnected();
        }
    }

    private void markDown(Throwable cause) {
        BrokerChannelListener l = listener;
        if (up.compareAndSet(true, false) && l != null) {
            l.onDisconnected(cause);
        }
    }

    private Channel requireChannel() {
        Channel ch = channel;
        if (ch == null) {
            throw new BrokerException("Channel is not open", null);
        }
        return ch;
    }

    private BrokerChannelListener requireListener() {
        BrokerChannelListener l = listener;
        if (l == null) {
            throw new IllegalStateException("BrokerChannelListener must be set before start()");
        }
        return l;
    }

    /**
     * Copies RabbitMQ deliveries into {@link InboundMessage}s for the listener.
     */
    private final class InboundConsumer extends DefaultConsumer
    {
        InboundConsumer(Channel channel) {
            super(channel);
        }

        @Override
        public void handleDelivery(String consumerTag,
                                   Envelope envelope,
                                   AMQP.BasicProperties properties,
                                   byte[] body) {
            BrokerChannelListener l = listener;
            if (l == null) {
                return;
            }
            l.onDelivery(new InboundMessage(
                    envelope.getDeliveryTag(),
                    properties.getContentEncoding(),
                    properties.getContentType(),
                    properties.getCorrelationId(),
                    properties.getReplyTo(),
                    body));
        }
    }
}
