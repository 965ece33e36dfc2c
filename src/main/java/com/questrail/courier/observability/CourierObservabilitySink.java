package com.questrail.courier.observability;

/**
 * Receives observability events from requesters and server adapters.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface CourierObservabilitySink {
    /**
     * Called after the requester applied one event to its state.
     * @param event the transition event details
     */
    void onStateTransition(RequesterStateTransitionEvent event);

    /**
     * Called for protocol-level happenings that do not surface to any caller
     * (unmatched replies, cleared pending requests, suppressed replies, ...).
     * @param event the protocol event
     */
    void onProtocolEvent(CourierProtocolEvent event);

    /**
     * Called when a broker channel goes up or down.
     * @param event the transport event
     */
    void onTransportEvent(CourierTransportEvent event);

    /**
     * Called when an error occurs that has no caller to be delivered to.
     * @param event the error event
     */
    void onError(CourierErrorEvent event);
}
