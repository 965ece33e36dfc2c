package com.questrail.courier.internal.state;

import com.questrail.courier.api.PublishRequest;
import com.questrail.courier.api.RpcOutcome;
import com.questrail.courier.observability.CourierProtocolEvent;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * RequesterIntent
 * -----------------------------------------------------------------------------
 * One action the requester should perform, as decided by
 * {@link RequesterStateReducer}. Intents describe <b>what</b> to do; the
 * executor decides <b>how</b>.
 */
public sealed interface RequesterIntent
        permits RequesterIntent.OpenReplyQueue,
                RequesterIntent.Publish,
                RequesterIntent.Acknowledge,
                RequesterIntent.Resolve,
                RequesterIntent.Reject,
                RequesterIntent.Report
{
    /**
     * Declare and consume the reply destination, then report it bound under the
     * same {@code attempt}.
     */
    record OpenReplyQueue(long attempt) implements RequesterIntent {}

    /**
     * Publish every message of a request.
     *
     * @param correlationId stamped on every message, {@code null} for fire-and-forget
     * @param replyTo       stamped on every message, {@code null} for fire-and-forget
     * @param handle        failed by the executor if publishing fails
     */
    record Publish(List<PublishRequest> messages,
                   String correlationId,
                   String replyTo,
                   CompletableFuture<RpcOutcome> handle) implements RequesterIntent {
        public Publish {
            messages = List.copyOf(Objects.requireNonNull(messages, "messages"));
            Objects.requireNonNull(handle, "handle");
        }
    }

    /** Acknowledge an inbound delivery at the transport. */
    record Acknowledge(long deliveryTag) implements RequesterIntent {}

    /** Complete a caller handle successfully. */
    record Resolve(CompletableFuture<RpcOutcome> handle, RpcOutcome outcome) implements RequesterIntent {
        public Resolve {
            Objects.requireNonNull(handle, "handle");
            Objects.requireNonNull(outcome, "outcome");
        }
    }

    /** Complete a caller handle exceptionally. */
    record Reject(CompletableFuture<RpcOutcome> handle, Throwable error) implements RequesterIntent {
        public Reject {
            Objects.requireNonNull(handle, "handle");
            Objects.requireNonNull(error, "error");
        }
    }

    /** Hand a protocol event to the observability sink. */
    record Report(CourierProtocolEvent event) implements RequesterIntent {
        public Report {
            Objects.requireNonNull(event, "event");
        }
    }
}
