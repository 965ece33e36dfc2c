package com.questrail.courier.observability;

import com.questrail.courier.internal.events.RequesterEvent;
import com.questrail.courier.internal.state.RequesterIntents;
import com.questrail.courier.internal.state.RequesterState;

import java.time.Instant;

/**
 * Record representing one requester state transition.
 */
public record RequesterStateTransitionEvent(
    Instant timestamp,
    String component,
    RequesterState oldState,
    RequesterState newState,
    RequesterEvent triggeringEvent,
    RequesterIntents resultingIntents
) {
    /**
     * Checks if the connection state changed during this transition.
     */
    public boolean isConnectionChange() {
        return oldState.connection() != newState.connection();
    }

    /**
     * Change in the number of pending requests.
     */
    public int pendingDelta() {
        return newState.table().size() - oldState.table().size();
    }
}
