package com.questrail.courier.api;

/**
 * A request was rejected because the broker connection is down. Nothing was published.
 */
public final class NotConnectedException extends CourierException
{
    public NotConnectedException(String message) {
        super(message);
    }
}
