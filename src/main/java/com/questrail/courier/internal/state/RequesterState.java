package com.questrail.courier.internal.state;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * RequesterState
 * -----------------------------------------------------------------------------
 * Immutable snapshot of a requester's logical state.
 *
 * <h2>Role in the architecture</h2>
 * Consumed and produced by {@link RequesterStateReducer}. It is deliberately:
 * <ul>
 *   <li>Pure data (no behavior beyond copy-on-write helpers)</li>
 *   <li>Immutable</li>
 *   <li>Explicit about every fact the reducer decides on</li>
 * </ul>
 *
 * <h2>Reply queue binding</h2>
 * Every transport-up starts a new binding attempt. {@link #bindingPending()} is
 * set from then until the attempt's binding is reported or the transport goes
 * down again; only the binding of the current, still pending attempt may make
 * the requester connected.
 *
 * <h2>Correlation id counter</h2>
 * {@link #lastCorrelationId()} only grows. Clearing the table on a connection
 * transition does not reset it, so ids are never reused within the lifetime of
 * one requester.
 */
public final class RequesterState
{
    private final ConnectionState connection;
    private final String replyAddress;
    private final long lastCorrelationId;
    private final long bindingAttempt;
    private final boolean bindingPending;
    private final CorrelationTable table;
    private final Instant lastTransition;

    private RequesterState(ConnectionState connection,
                           String replyAddress,
                           long lastCorrelationId,
                           long bindingAttempt,
                           boolean bindingPending,
                           CorrelationTable table,
                           Instant lastTransition) {
        this.connection = Objects.requireNonNull(connection, "connection");
        this.replyAddress = replyAddress;
        this.lastCorrelationId = lastCorrelationId;
        this.bindingAttempt = bindingAttempt;
        this.bindingPending = bindingPending;
        this.table = Objects.requireNonNull(table, "table");
        this.lastTransition = Objects.requireNonNull(lastTransition, "lastTransition");
    }

    public ConnectionState connection() {
        return connection;
    }

    /**
     * Address replies are sent to, present only while connected.
     */
    public Optional<String> replyAddress() {
        return Optional.ofNullable(replyAddress);
    }

    public long lastCorrelationId() {
        return lastCorrelationId;
    }

    /** Number of the most recent binding attempt, 0 before the first transport-up. */
    public long bindingAttempt() {
        return bindingAttempt;
    }

    public boolean bindingPending() {
        return bindingPending;
    }

    public CorrelationTable table() {
        return table;
    }

    public Instant lastTransition() {
        return lastTransition;
    }

    public boolean isConnected() {
        return connection == ConnectionState.CONNECTED;
    }

    // ---------------------------------------------------------------------
    // Factory helpers
    // ---------------------------------------------------------------------

    /**
     * Initial state: disconnected, no pending requests, counter at zero.
     */
    public static RequesterState initial(Instant now) {
        return new RequesterState(ConnectionState.DISCONNECTED, null, 0L, 0L, false, CorrelationTable.empty(), now);
    }

    /**
     * Disconnected, waiting for the binding of the next attempt.
     */
    public RequesterState binding(Instant now) {
        return new RequesterState(ConnectionState.DISCONNECTED, null, lastCorrelationId,
                bindingAttempt + 1, true, table, now);
    }

    public RequesterState connected(String replyAddress, Instant now) {
        Objects.requireNonNull(replyAddress, "replyAddress");
        return new RequesterState(ConnectionState.CONNECTED, replyAddress, lastCorrelationId,
                bindingAttempt, false, table, now);
    }

    public RequesterState disconnected(Instant now) {
        return new RequesterState(ConnectionState.DISCONNECTED, null, lastCorrelationId,
                bindingAttempt, false, table, now);
    }

    public RequesterState withTable(CorrelationTable newTable, Instant now) {
        return new RequesterState(connection, replyAddress, lastCorrelationId,
                bindingAttempt, bindingPending, newTable, now);
    }

    public RequesterState withLastCorrelationId(long id, Instant now) {
        if (id < lastCorrelationId) {
            throw new IllegalArgumentException("Correlation ids never go backwards: " + id + " < " + lastCorrelationId);
        }
        return new RequesterState(connection, replyAddress, id, bindingAttempt, bindingPending, table, now);
    }
}
