package com.questrail.courier.api;

import java.util.Objects;

/**
 * A published message the broker could not route to any queue.
 *
 * <p>The broker hands back the original body and properties, which is how the
 * requester recovers the correlation id of the request it belongs to.</p>
 */
public record ReturnedMessage(int replyCode,
                              String replyText,
                              String exchange,
                              String routingKey,
                              MessageProperties properties,
                              String correlationId,
                              byte[] body)
{
    public ReturnedMessage {
        Objects.requireNonNull(properties, "properties");
        Objects.requireNonNull(body, "body");
    }
}
