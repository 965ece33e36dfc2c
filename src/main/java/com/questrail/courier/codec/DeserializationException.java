package com.questrail.courier.codec;

import com.questrail.courier.api.CourierException;

/**
 * A received body could not be decoded with the serializer its metadata resolved to.
 */
public final class DeserializationException extends CourierException
{
    public DeserializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
