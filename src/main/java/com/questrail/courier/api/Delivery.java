package com.questrail.courier.api;

import java.util.Objects;
import java.util.Optional;

/**
 * One inbound message instance as seen above the transport boundary.
 *
 * @param deliveryTag   transport acknowledgement handle
 * @param properties    envelope metadata decoded from the wire convention
 * @param body          message body
 * @param replyTo       reply address supplied by the sender, or {@code null}
 * @param correlationId correlation id supplied by the sender, or {@code null}
 */
public record Delivery(long deliveryTag,
                       MessageProperties properties,
                       byte[] body,
                       String replyTo,
                       String correlationId)
{
    public Delivery {
        Objects.requireNonNull(properties, "properties");
        Objects.requireNonNull(body, "body");
    }

    public Optional<String> replyAddress() {
        return Optional.ofNullable(replyTo);
    }

    public Envelope envelope() {
        return new Envelope(body, properties);
    }
}
