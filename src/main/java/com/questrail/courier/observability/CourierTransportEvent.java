package com.questrail.courier.observability;

import java.time.Instant;

/**
 * A broker channel became usable or unusable.
 *
 * @param cause diagnostic cause for {@code up == false}; may be {@code null}
 */
public record CourierTransportEvent(
    Instant timestamp,
    String component,
    boolean up,
    Throwable cause
) {
}
