package com.questrail.courier.observability;

/**
 * No-op implementation of CourierObservabilitySink.
 */
public final class NullObservabilitySink implements CourierObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onStateTransition(RequesterStateTransitionEvent event) {}

    @Override
    public void onProtocolEvent(CourierProtocolEvent event) {}

    @Override
    public void onTransportEvent(CourierTransportEvent event) {}

    @Override
    public void onError(CourierErrorEvent event) {}
}
