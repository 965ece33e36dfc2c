package com.questrail.courier.internal.state;

/**
 * Whether the requester can accept requests.
 *
 * <p>{@link #CONNECTED} means the transport is up <em>and</em> the reply queue is
 * bound. Everything else is {@link #DISCONNECTED}.</p>
 */
public enum ConnectionState {
    DISCONNECTED,
    CONNECTED
}
