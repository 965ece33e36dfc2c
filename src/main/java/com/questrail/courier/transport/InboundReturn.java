package com.questrail.courier.transport;

import java.util.Objects;

/**
 * A message handed back by the broker, with the properties it was published with.
 */
public record InboundReturn(int replyCode,
                            String replyText,
                            String exchange,
                            String routingKey,
                            String contentEncoding,
                            String contentType,
                            String correlationId,
                            byte[] body)
{
    public InboundReturn {
        Objects.requireNonNull(body, "body");
    }
}
