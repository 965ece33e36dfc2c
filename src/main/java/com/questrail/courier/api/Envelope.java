package com.questrail.courier.api;

import java.util.Objects;

/**
 * One serialized application message: body bytes plus {@link MessageProperties}.
 */
public record Envelope(byte[] body, MessageProperties properties)
{
    public Envelope {
        Objects.requireNonNull(body, "body");
        Objects.requireNonNull(properties, "properties");
    }
}
