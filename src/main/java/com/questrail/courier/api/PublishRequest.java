package com.questrail.courier.api;

import java.util.Objects;

/**
 * A single message to publish as part of a request.
 *
 * @param exchange     target exchange ({@code ""} is the default exchange)
 * @param routingKey   routing key
 * @param envelope     serialized message
 * @param mandatory    ask the broker to return the message if it cannot be routed
 * @param immediate    AMQP immediate flag; most brokers reject it, leave it off
 * @param deliveryMode 1 for transient, 2 for persistent
 */
public record PublishRequest(String exchange,
                             String routingKey,
                             Envelope envelope,
                             boolean mandatory,
                             boolean immediate,
                             int deliveryMode)
{
    public static final int TRANSIENT = 1;
    public static final int PERSISTENT = 2;

    public PublishRequest {
        Objects.requireNonNull(exchange, "exchange");
        Objects.requireNonNull(routingKey, "routingKey");
        Objects.requireNonNull(envelope, "envelope");
        if (deliveryMode != TRANSIENT && deliveryMode != PERSISTENT) {
            throw new IllegalArgumentException("deliveryMode must be 1 or 2, was " + deliveryMode);
        }
    }

    /**
     * Mandatory, non-immediate, transient publish.
     */
    public static PublishRequest of(String exchange, String routingKey, Envelope envelope) {
        return new PublishRequest(exchange, routingKey, envelope, true, false, TRANSIENT);
    }
}
