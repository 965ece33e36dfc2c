package com.questrail.courier.transport;

import java.util.Objects;

/**
 * One delivery as received from the channel, before envelope decoding.
 */
public record InboundMessage(long deliveryTag,
                             String contentEncoding,
                             String contentType,
                             String correlationId,
                             String replyTo,
                             byte[] body)
{
    public InboundMessage {
        Objects.requireNonNull(body, "body");
    }
}
