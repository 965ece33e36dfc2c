package com.questrail.courier.api;

/**
 * The remote processor failed and replied with a {@link ServerFailure}.
 */
public final class RemoteProcessingException extends CourierException
{
    private final String remoteDetail;

    public RemoteProcessingException(String message, String remoteDetail) {
        super(message);
        this.remoteDetail = remoteDetail;
    }

    public static RemoteProcessingException from(ServerFailure failure) {
        return new RemoteProcessingException(failure.message(), failure.throwableAsString());
    }

    /**
     * {@code toString()} of the remote error, as reported by the server.
     */
    public String remoteDetail() {
        return remoteDetail;
    }
}
