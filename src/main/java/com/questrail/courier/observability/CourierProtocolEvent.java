package com.questrail.courier.observability;

import java.time.Instant;
import java.util.Objects;

/**
 * Protocol-level happening worth logging.
 *
 * @param component     name of the requester or server adapter reporting it
 * @param correlationId the correlation id involved, or {@code null}
 * @param detail        free-form description
 */
public record CourierProtocolEvent(
    Instant timestamp,
    Kind kind,
    String component,
    String correlationId,
    String detail
) {
    public enum Kind {
        /** A reply arrived for a correlation id with no pending request. */
        UNMATCHED_DELIVERY,
        /** The broker returned a message whose correlation id has no pending request. */
        UNMATCHED_RETURN,
        /** Pending requests were dropped on a connection transition; their callers are not notified. */
        PENDING_CLEARED,
        /** A request was rejected without publishing. */
        REQUEST_REJECTED,
        /** A publish failed at the transport and its pending request was dropped. */
        PUBLISH_FAILED,
        /** A processor result carried no value, or the request had no reply address. */
        REPLY_SUPPRESSED,
        /** A processor failed and a failure reply was produced. */
        PROCESSING_FAILED,
        /** A reply queue binding completed after its channel went down and was ignored. */
        STALE_BINDING
    }

    public CourierProtocolEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(component, "component");
    }
}
