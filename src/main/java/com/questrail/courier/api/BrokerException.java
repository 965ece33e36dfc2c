package com.questrail.courier.api;

/**
 * A broker operation (publish, declare, ack, ...) failed at the transport.
 */
public final class BrokerException extends CourierException
{
    public BrokerException(String message, Throwable cause) {
        super(message, cause);
    }
}
