package com.questrail.courier.api;

import java.util.List;
import java.util.Objects;

/**
 * RpcOutcome
 * -----------------------------------------------------------------------------
 * Successful resolution of a request handle.
 *
 * <p>Exactly one outcome is produced per request. Failures (not connected,
 * serialization, remote processing, transport) are not outcomes: they complete
 * the same handle exceptionally.</p>
 *
 * <p>{@link Undelivered} is a success value, distinct from both a normal reply
 * and a remote failure.</p>
 */
public sealed interface RpcOutcome permits RpcOutcome.Response, RpcOutcome.Undelivered
{
    /**
     * All expected replies, in arrival order. Empty for fire-and-forget requests.
     */
    record Response(List<Delivery> deliveries) implements RpcOutcome {
        public Response {
            deliveries = List.copyOf(Objects.requireNonNull(deliveries, "deliveries"));
        }

        public static Response acknowledged() {
            return new Response(List.of());
        }
    }

    /**
     * The broker returned the request because no queue was bound for it.
     */
    record Undelivered(ReturnedMessage returned) implements RpcOutcome {
        public Undelivered {
            Objects.requireNonNull(returned, "returned");
        }
    }
}
