package com.questrail.courier.observability;

import java.time.Instant;

/**
 * Record representing an error or anomaly with no caller to report to.
 */
public record CourierErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
