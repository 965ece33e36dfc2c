package com.questrail.courier.api;

/**
 * Root of the failures a request handle can complete with.
 */
public class CourierException extends RuntimeException
{
    public CourierException(String message) {
        super(message);
    }

    public CourierException(String message, Throwable cause) {
        super(message, cause);
    }
}
