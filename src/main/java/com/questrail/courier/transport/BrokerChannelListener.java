package com.questrail.courier.transport;

/**
 * BrokerChannelListener
 * -----------------------------------------------------------------------------
 * Callback sink for {@link BrokerChannel}.
 *
 * <p>Callbacks may arrive on transport threads. Listeners hand them over to
 * their own owner thread and return quickly.</p>
 */
public interface BrokerChannelListener
{
    /**
     * The channel became usable. Called again after each automatic recovery.
     */
    void onConnected();

    /**
     * The channel became unusable.
     *
     * @param cause diagnostic cause; {@code null} for orderly shutdown
     */
    void onDisconnected(Throwable cause);

    void onDelivery(InboundMessage message);

    /**
     * A mandatory publish could not be routed.
     */
    void onReturned(InboundReturn returned);
}
