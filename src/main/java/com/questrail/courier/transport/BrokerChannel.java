package com.questrail.courier.transport;

import com.questrail.courier.api.BrokerException;
import com.questrail.courier.config.ChannelParameters;
import com.questrail.courier.config.ExchangeParameters;
import com.questrail.courier.config.QueueParameters;

/**
 * BrokerChannel
 * -----------------------------------------------------------------------------
 * Minimal port for one AMQP channel.
 *
 * <p>A channel may be lost and re-established any number of times while
 * started. Each transition is reported to the listener; everything declared or
 * consumed on the previous incarnation must be assumed gone.</p>
 *
 * <p>All operations throw {@link BrokerException} when the broker or the
 * connection rejects them.</p>
 */
public interface BrokerChannel
{
    /**
     * Register the listener that receives deliveries, returns and lifecycle
     * events. Must be called before {@link #start()}.
     */
    void setListener(BrokerChannelListener listener);

    /**
     * Open the channel. On success the listener is notified via
     * {@link BrokerChannelListener#onConnected()}.
     */
    void start();

    /**
     * Close the channel. The listener is notified via
     * {@link BrokerChannelListener#onDisconnected(Throwable)} at most once.
     */
    void stop();

    void publish(String exchange,
                 String routingKey,
                 boolean mandatory,
                 boolean immediate,
                 OutboundProperties properties,
                 byte[] body);

    /**
     * Declare a queue.
     *
     * @return the declared name; the broker's choice when {@code queue.name()} is empty
     */
    String declareQueue(QueueParameters queue);

    /**
     * Declare an exchange. The default exchange is never declared.
     */
    void declareExchange(ExchangeParameters exchange);

    void bind(String exchange, String queue, String routingKey);

    /**
     * Start consuming with manual acknowledgement. Deliveries are reported via
     * {@link BrokerChannelListener#onDelivery(InboundMessage)}.
     */
    void consume(String queue);

    void ack(long deliveryTag);

    void qos(ChannelParameters channel);
}
