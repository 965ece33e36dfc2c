package com.questrail.courier.codec;

import com.questrail.courier.api.CourierException;

/**
 * A message could not be encoded. Raised locally, before anything is published.
 */
public final class SerializationException extends CourierException
{
    public SerializationException(String message) {
        super(message);
    }

    public SerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
