package com.questrail.courier.internal.events;

import com.questrail.courier.api.Delivery;
import com.questrail.courier.api.ReturnedMessage;

import java.time.Instant;
import java.util.Objects;

/**
 * RequesterBrokerEvent
 * -----------------------------------------------------------------------------
 * Messages the broker pushed to the requester, already translated from wire
 * properties into envelope metadata.
 */
public sealed interface RequesterBrokerEvent extends RequesterEvent
        permits RequesterBrokerEvent.DeliveryReceived,
                RequesterBrokerEvent.MessageReturned,
                RequesterBrokerEvent.PublishFailed
{
    /** A reply arrived on the reply queue. */
    final class DeliveryReceived extends RequesterEvent.Base implements RequesterBrokerEvent {
        private final Delivery delivery;

        public DeliveryReceived(Instant timestamp, Delivery delivery) {
            super(timestamp);
            this.delivery = Objects.requireNonNull(delivery, "delivery");
        }

        public Delivery delivery() {
            return delivery;
        }
    }

    /** A mandatory publish could not be routed and was handed back. */
    final class MessageReturned extends RequesterEvent.Base implements RequesterBrokerEvent {
        private final ReturnedMessage returned;

        public MessageReturned(Instant timestamp, ReturnedMessage returned) {
            super(timestamp);
            this.returned = Objects.requireNonNull(returned, "returned");
        }

        public ReturnedMessage returned() {
            return returned;
        }
    }

    /**
     * Publishing a request failed at the transport. The caller handle has
     * already been failed by the executor; the reducer only drops the entry.
     */
    final class PublishFailed extends RequesterEvent.Base implements RequesterBrokerEvent {
        private final String correlationId;
        private final Throwable cause;

        public PublishFailed(Instant timestamp, String correlationId, Throwable cause) {
            super(timestamp);
            this.correlationId = Objects.requireNonNull(correlationId, "correlationId");
            this.cause = Objects.requireNonNull(cause, "cause");
        }

        public String correlationId() {
            return correlationId;
        }

        public Throwable cause() {
            return cause;
        }
    }
}
