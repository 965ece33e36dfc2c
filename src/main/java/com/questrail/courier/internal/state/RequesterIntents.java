package com.questrail.courier.internal.state;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * RequesterIntents
 * -----------------------------------------------------------------------------
 * Immutable, ordered collection of {@link RequesterIntent}s emitted by the
 * {@link RequesterStateReducer} for a single event.
 *
 * <h2>Ordering</h2>
 * Intents are executed in the order they were added. The reducer relies on
 * this, e.g. a delivery is acknowledged before the handle it completes is
 * resolved, and a fire-and-forget request is published before it resolves.
 */
public final class RequesterIntents
{
    private static final RequesterIntents NONE = new RequesterIntents(List.of());

    private final List<RequesterIntent> intents;

    private RequesterIntents(List<RequesterIntent> intents) {
        this.intents = List.copyOf(intents);
    }

    public static RequesterIntents none() {
        return NONE;
    }

    public static RequesterIntents of(RequesterIntent... intents) {
        return new RequesterIntents(List.of(intents));
    }

    public List<RequesterIntent> list() {
        return intents;
    }

    public int size() {
        return intents.size();
    }

    public boolean isEmpty() {
        return intents.isEmpty();
    }

    /**
     * First intent of the given type, or {@code null}. Mostly for tests.
     */
    public <T extends RequesterIntent> T first(Class<T> type) {
        for (RequesterIntent intent : intents) {
            if (type.isInstance(intent)) {
                return type.cast(intent);
            }
        }
        return null;
    }

    public boolean contains(Class<? extends RequesterIntent> type) {
        return first(type) != null;
    }

    @Override
    public String toString() {
        return "RequesterIntents" + intents;
    }

    // ---------------------------------------------------------------------
    // Builder (reducer-friendly)
    // ---------------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final List<RequesterIntent> intents = new ArrayList<>();

        private Builder() {}

        public Builder add(RequesterIntent intent) {
            intents.add(Objects.requireNonNull(intent, "intent"));
            return this;
        }

        public RequesterIntents build() {
            return intents.isEmpty() ? NONE : new RequesterIntents(intents);
        }
    }
}
