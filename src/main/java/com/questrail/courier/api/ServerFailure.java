package com.questrail.courier.api;

/**
 * Failure payload a server sends back when processing a request raised an error.
 *
 * @param message           the error message
 * @param throwableAsString {@code Throwable.toString()} of the error, for context
 */
public record ServerFailure(String message, String throwableAsString)
{
    public static ServerFailure of(Throwable error) {
        return new ServerFailure(error.getMessage(), error.toString());
    }
}
