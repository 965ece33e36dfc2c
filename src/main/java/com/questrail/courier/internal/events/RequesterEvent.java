package com.questrail.courier.internal.events;

import java.time.Instant;
import java.util.Objects;

/**
 * RequesterEvent
 * -----------------------------------------------------------------------------
 * Marker interface for all events processed by a requester's owner loop.
 *
 * <h2>Role in the architecture</h2>
 * The requester is modeled as an actor: every change to its correlation table
 * and connection state happens in response to a {@link RequesterEvent},
 * processed one at a time on a single thread. This includes:
 * <ul>
 *   <li>caller requests</li>
 *   <li>replies and returned messages from the broker</li>
 *   <li>transport lifecycle changes</li>
 *   <li>outcomes of executor side effects (reply queue bound, publish failed)</li>
 * </ul>
 *
 * <h2>Design constraints</h2>
 * <ul>
 *   <li>Events are immutable apart from the caller handle they may carry</li>
 *   <li>Events carry only the information needed to advance state</li>
 * </ul>
 */
public interface RequesterEvent
{
    /**
     * Time at which the event occurred or was generated.
     */
    Instant timestamp();

    /**
     * Convenience base class for simple events.
     */
    abstract class Base implements RequesterEvent {
        private final Instant timestamp;

        protected Base(Instant timestamp) {
            this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        }

        @Override
        public Instant timestamp() {
            return timestamp;
        }
    }
}
