package com.questrail.courier.internal.state;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * CorrelationTable
 * -----------------------------------------------------------------------------
 * Correlation id → {@link PendingRequest}, for one requester instance.
 *
 * <p>Immutable: every mutator returns a new table. Only the owning requester's
 * reducer produces new tables, so a table is never shared across requesters.</p>
 */
public final class CorrelationTable
{
    private static final CorrelationTable EMPTY = new CorrelationTable(Map.of());

    private final Map<String, PendingRequest> entries;

    private CorrelationTable(Map<String, PendingRequest> entries) {
        this.entries = Map.copyOf(entries);
    }

    public static CorrelationTable empty() {
        return EMPTY;
    }

    public Optional<PendingRequest> find(String correlationId) {
        if (correlationId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(entries.get(correlationId));
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public Collection<PendingRequest> entries() {
        return entries.values();
    }

    /**
     * Adds or replaces the entry for {@code request.correlationId()}.
     */
    public CorrelationTable with(PendingRequest request) {
        Objects.requireNonNull(request, "request");
        Map<String, PendingRequest> updated = new HashMap<>(entries);
        updated.put(request.correlationId(), request);
        return new CorrelationTable(updated);
    }

    public CorrelationTable without(String correlationId) {
        if (!entries.containsKey(correlationId)) {
            return this;
        }
        Map<String, PendingRequest> updated = new HashMap<>(entries);
        updated.remove(correlationId);
        return updated.isEmpty() ? EMPTY : new CorrelationTable(updated);
    }
}
