package com.questrail.courier.internal.events;

import java.time.Instant;
import java.util.Objects;

/**
 * RequesterTransportEvent
 * -----------------------------------------------------------------------------
 * Changes in the availability of the requester's broker channel.
 *
 * <p>{@link TransportUp} alone does not make the requester usable: the reply
 * destination must be bound first, which is reported by {@link ReplyQueueBound}.
 * A binding carries the attempt number it answers, so a binding that completes
 * after its channel already went down can be told apart from the current one.</p>
 */
public sealed interface RequesterTransportEvent extends RequesterEvent
        permits RequesterTransportEvent.TransportUp,
                RequesterTransportEvent.ReplyQueueBound,
                RequesterTransportEvent.TransportDown
{
    /** Channel became available. */
    final class TransportUp extends RequesterEvent.Base implements RequesterTransportEvent {
        public TransportUp(Instant timestamp) {
            super(timestamp);
        }
    }

    /** Reply queue declared and consumed; replies will arrive at {@link #replyAddress()}. */
    final class ReplyQueueBound extends RequesterEvent.Base implements RequesterTransportEvent {
        private final long attempt;
        private final String replyAddress;

        public ReplyQueueBound(Instant timestamp, long attempt, String replyAddress) {
            super(timestamp);
            this.attempt = attempt;
            this.replyAddress = Objects.requireNonNull(replyAddress, "replyAddress");
        }

        /** The {@code OpenReplyQueue} attempt this binding completes. */
        public long attempt() {
            return attempt;
        }

        public String replyAddress() {
            return replyAddress;
        }
    }

    /** Channel became unavailable or unusable. */
    final class TransportDown extends RequesterEvent.Base implements RequesterTransportEvent {
        public TransportDown(Instant timestamp) {
            super(timestamp);
        }
    }
}
