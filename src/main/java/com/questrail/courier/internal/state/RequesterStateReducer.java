package com.questrail.courier.internal.state;

import com.questrail.courier.api.Delivery;
import com.questrail.courier.api.NotConnectedException;
import com.questrail.courier.api.ReturnedMessage;
import com.questrail.courier.api.RpcOutcome;
import com.questrail.courier.internal.events.RequesterBrokerEvent;
import com.questrail.courier.internal.events.RequesterEvent;
import com.questrail.courier.internal.events.RequesterRequestEvent;
import com.questrail.courier.internal.events.RequesterTransportEvent;
import com.questrail.courier.observability.CourierProtocolEvent;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * RequesterStateReducer
 * -----------------------------------------------------------------------------
 * Pure, deterministic state transition engine for a requester.
 *
 * <h2>Role in the architecture</h2>
 * Given a prior {@link RequesterState} and a single {@link RequesterEvent}, the
 * reducer computes:
 * <ul>
 *   <li>a new {@link RequesterState}</li>
 *   <li>an ordered list of {@link RequesterIntent}s describing what the requester
 *       should do next (publish, acknowledge, resolve a caller handle, ...)</li>
 * </ul>
 *
 * The reducer never performs those actions and never completes a caller handle
 * itself. Execution belongs to the
 * {@link com.questrail.courier.internal.exec.RequesterIntentExecutor}.
 *
 * <h2>Correlation rules</h2>
 * <ul>
 *   <li>Requests expecting at least one reply get the next correlation id and a
 *       table entry; fire-and-forget requests get neither.</li>
 *   <li>An entry resolves exactly once: either when its expected number of
 *       replies has arrived, or when the broker returns the request as
 *       unroutable, whichever comes first. The entry is removed at that point,
 *       so anything arriving later for the same id is unmatched.</li>
 *   <li>Every connection transition empties the table. Callers of the dropped
 *       entries are not notified.</li>
 * </ul>
 */
public final class RequesterStateReducer
{
    /**
     * Result of applying an event to a requester state.
     *
     * @param newState the updated state
     * @param intents  actions to be executed by the caller, in order
     */
    public record Result(RequesterState newState,
                         RequesterIntents intents) {}

    private final String component;

    /**
     * @param component name used on reported protocol events
     */
    public RequesterStateReducer(String component) {
        this.component = Objects.requireNonNull(component, "component");
    }

    /**
     * Applies a single event to the current state.
     *
     * @param state the current state (must not be {@code null})
     * @param event the event to apply (must not be {@code null})
     * @return the resulting state and intents
     */
    public Result apply(RequesterState state, RequesterEvent event) {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(event, "event");

        if (event instanceof RequesterTransportEvent.TransportUp e) {
            return onTransportUp(state, e);
        }
        if (event instanceof RequesterTransportEvent.ReplyQueueBound e) {
            return onReplyQueueBound(state, e);
        }
        if (event instanceof RequesterTransportEvent.TransportDown e) {
            return onTransportDown(state, e);
        }
        if (event instanceof RequesterRequestEvent.RequestSubmitted e) {
            return onRequestSubmitted(state, e);
        }
        if (event instanceof RequesterBrokerEvent.DeliveryReceived e) {
            return onDeliveryReceived(state, e);
        }
        if (event instanceof RequesterBrokerEvent.MessageReturned e) {
            return onMessageReturned(state, e);
        }
        if (event instanceof RequesterBrokerEvent.PublishFailed e) {
            return onPublishFailed(state, e);
        }

        return new Result(state, RequesterIntents.none());
    }

    // ---------------------------------------------------------------------
    // Connection transitions
    // ---------------------------------------------------------------------

    private Result onTransportUp(RequesterState state,
                                 RequesterTransportEvent.TransportUp e) {
        // Not usable until the reply destination is bound.
        RequesterIntents.Builder intents = RequesterIntents.builder();
        RequesterState cleared = clearTable(state, e.timestamp(), intents);

        RequesterState binding = cleared.binding(e.timestamp());
        intents.add(new RequesterIntent.OpenReplyQueue(binding.bindingAttempt()));
        return new Result(binding, intents.build());
    }

    private Result onReplyQueueBound(RequesterState state,
                                     RequesterTransportEvent.ReplyQueueBound e) {
        if (!state.bindingPending() || e.attempt() != state.bindingAttempt()) {
            // The channel this queue was bound on is already gone.
            return new Result(state, RequesterIntents.of(report(e.timestamp(),
                    CourierProtocolEvent.Kind.STALE_BINDING, null,
                    "reply queue " + e.replyAddress() + " bound by attempt " + e.attempt()
                            + " ignored; current attempt " + state.bindingAttempt()
                            + (state.bindingPending() ? " pending" : " not pending"))));
        }

        RequesterIntents.Builder intents = RequesterIntents.builder();
        RequesterState cleared = clearTable(state, e.timestamp(), intents);

        return new Result(cleared.connected(e.replyAddress(), e.timestamp()), intents.build());
    }

    private Result onTransportDown(RequesterState state,
                                   RequesterTransportEvent.TransportDown e) {
        RequesterIntents.Builder intents = RequesterIntents.builder();
        RequesterState cleared = clearTable(state, e.timestamp(), intents);

        return new Result(cleared.disconnected(e.timestamp()), intents.build());
    }

    private RequesterState clearTable(RequesterState state,
                                      Instant now,
                                      RequesterIntents.Builder intents) {
        int dropped = state.table().size();
        if (dropped == 0) {
            return state;
        }
        intents.add(report(now, CourierProtocolEvent.Kind.PENDING_CLEARED, null,
                dropped + " pending request(s) dropped on connection transition"));
        return state.withTable(CorrelationTable.empty(), now);
    }

    // ---------------------------------------------------------------------
    // Requests
    // ---------------------------------------------------------------------

    private Result onRequestSubmitted(RequesterState state,
                                      RequesterRequestEvent.RequestSubmitted e) {
        final Instant now = e.timestamp();
        final int expected = e.expectedReplies();

        if (expected < 0) {
            return new Result(state, RequesterIntents.of(new RequesterIntent.Reject(e.handle(),
                    new IllegalArgumentException("expected replies must be >= 0, was " + expected))));
        }

        Optional<String> replyAddress = state.replyAddress();
        if (!state.isConnected() || replyAddress.isEmpty()) {
            return new Result(state, RequesterIntents.of(
                    new RequesterIntent.Reject(e.handle(),
                            new NotConnectedException("Requester " + component + " is not connected")),
                    report(now, CourierProtocolEvent.Kind.REQUEST_REJECTED, null, "not connected")));
        }

        if (expected == 0) {
            // Fire-and-forget: no id, no entry. Publish first, then resolve.
            return new Result(state, RequesterIntents.of(
                    new RequesterIntent.Publish(e.messages(), null, null, e.handle()),
                    new RequesterIntent.Resolve(e.handle(), RpcOutcome.Response.acknowledged())));
        }

        long nextId = state.lastCorrelationId() + 1;
        String correlationId = Long.toString(nextId);

        PendingRequest pending = PendingRequest.awaiting(correlationId, e.handle(), expected);
        RequesterState newState = state
                .withLastCorrelationId(nextId, now)
                .withTable(state.table().with(pending), now);

        return new Result(newState, RequesterIntents.of(
                new RequesterIntent.Publish(e.messages(), correlationId, replyAddress.get(), e.handle())));
    }

    // ---------------------------------------------------------------------
    // Broker traffic
    // ---------------------------------------------------------------------

    private Result onDeliveryReceived(RequesterState state,
                                      RequesterBrokerEvent.DeliveryReceived e) {
        final Delivery delivery = e.delivery();
        final Instant now = e.timestamp();

        if (!state.isConnected()) {
            // Delivery tags belong to the channel that is gone; nothing to acknowledge.
            return new Result(state, RequesterIntents.of(
                    report(now, CourierProtocolEvent.Kind.UNMATCHED_DELIVERY, delivery.correlationId(),
                            "delivery ignored while disconnected")));
        }

        RequesterIntents.Builder intents = RequesterIntents.builder()
                .add(new RequesterIntent.Acknowledge(delivery.deliveryTag()));

        Optional<PendingRequest> match = state.table().find(delivery.correlationId());
        if (match.isEmpty()) {
            intents.add(report(now, CourierProtocolEvent.Kind.UNMATCHED_DELIVERY, delivery.correlationId(),
                    "no pending request for delivery"));
            return new Result(state, intents.build());
        }

        PendingRequest updated = match.get().withDelivery(delivery);
        if (!updated.isComplete()) {
            return new Result(state.withTable(state.table().with(updated), now), intents.build());
        }

        intents.add(new RequesterIntent.Resolve(updated.destination(),
                new RpcOutcome.Response(updated.receivedDeliveries())));
        return new Result(state.withTable(state.table().without(updated.correlationId()), now), intents.build());
    }

    private Result onMessageReturned(RequesterState state,
                                     RequesterBrokerEvent.MessageReturned e) {
        final ReturnedMessage returned = e.returned();
        final Instant now = e.timestamp();

        Optional<PendingRequest> match = state.table().find(returned.correlationId());
        if (match.isEmpty()) {
            return new Result(state, RequesterIntents.of(
                    report(now, CourierProtocolEvent.Kind.UNMATCHED_RETURN, returned.correlationId(),
                            "returned " + returned.replyCode() + " " + returned.replyText())));
        }

        PendingRequest pending = match.get();
        return new Result(
                state.withTable(state.table().without(pending.correlationId()), now),
                RequesterIntents.of(new RequesterIntent.Resolve(pending.destination(),
                        new RpcOutcome.Undelivered(returned))));
    }

    private Result onPublishFailed(RequesterState state,
                                   RequesterBrokerEvent.PublishFailed e) {
        // The executor has already failed the handle.
        RequesterIntent reportIntent = report(e.timestamp(), CourierProtocolEvent.Kind.PUBLISH_FAILED,
                e.correlationId(), String.valueOf(e.cause()));
        if (state.table().find(e.correlationId()).isEmpty()) {
            return new Result(state, RequesterIntents.of(reportIntent));
        }
        return new Result(
                state.withTable(state.table().without(e.correlationId()), e.timestamp()),
                RequesterIntents.of(reportIntent));
    }

    private RequesterIntent report(Instant now,
                                   CourierProtocolEvent.Kind kind,
                                   String correlationId,
                                   String detail) {
        return new RequesterIntent.Report(new CourierProtocolEvent(now, kind, component, correlationId, detail));
    }
}
