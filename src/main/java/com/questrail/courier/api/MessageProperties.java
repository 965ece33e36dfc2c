package com.questrail.courier.api;

import java.util.Optional;

/**
 * Envelope metadata carried next to a serialized body.
 *
 * <p>{@code serializerId} names the serializer that produced the body and is
 * resolved through the serializer registry on the receiving side.
 * {@code typeName} is the runtime class name of the encoded message; it is
 * diagnostic only and never drives routing or dispatch.</p>
 *
 * <p>Both fields may be {@code null} for messages published by foreign
 * producers.</p>
 */
public record MessageProperties(String serializerId, String typeName)
{
    public static MessageProperties empty() {
        return new MessageProperties(null, null);
    }

    public Optional<String> serializer() {
        return Optional.ofNullable(serializerId);
    }

    public Optional<String> type() {
        return Optional.ofNullable(typeName);
    }
}
