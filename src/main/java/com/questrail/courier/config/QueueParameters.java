package com.questrail.courier.config;

import java.util.Objects;
import java.util.UUID;

/**
 * Queue declaration settings.
 *
 * <p>When {@code randomize} is set, {@link #resolve()} appends a fresh
 * {@code -<uuid>} suffix on every call. A resolved name identifies one
 * declaration only and must not be persisted.</p>
 *
 * <p>An empty name asks the broker to generate one.</p>
 */
public record QueueParameters(
    String name,
    boolean randomize,
    boolean durable,
    boolean exclusive,
    boolean autodelete,
    boolean passive
) {
    public QueueParameters {
        Objects.requireNonNull(name, "name");
    }

    /**
     * Durable, autodelete queue with a randomized name.
     */
    public static QueueParameters randomized(String name) {
        return new QueueParameters(name, true, true, false, true, false);
    }

    /**
     * Fixed-name, durable, autodelete queue.
     */
    public static QueueParameters named(String name) {
        return new QueueParameters(name, false, true, false, true, false);
    }

    /**
     * Exclusive, non-durable queue whose name is assigned by the broker.
     */
    public static QueueParameters privateReplyQueue() {
        return new QueueParameters("", false, false, true, true, false);
    }

    /**
     * Returns the parameters to declare with: the name gets a fresh unique
     * suffix if {@code randomize} is set, otherwise this instance is returned.
     */
    public QueueParameters resolve() {
        if (!randomize) {
            return this;
        }
        String resolved = name + "-" + UUID.randomUUID();
        return new QueueParameters(resolved, false, durable, exclusive, autodelete, passive);
    }
}
