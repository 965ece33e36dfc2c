package com.questrail.courier.internal.state;

import com.questrail.courier.api.Delivery;
import com.questrail.courier.api.RpcOutcome;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * A request waiting for its replies.
 *
 * <p>Immutable. {@link #withDelivery(Delivery)} returns a copy with one more
 * reply, appended in arrival order.</p>
 */
public final class PendingRequest
{
    private final String correlationId;
    private final CompletableFuture<RpcOutcome> destination;
    private final int expectedCount;
    private final List<Delivery> receivedDeliveries;

    private PendingRequest(String correlationId,
                           CompletableFuture<RpcOutcome> destination,
                           int expectedCount,
                           List<Delivery> receivedDeliveries) {
        this.correlationId = Objects.requireNonNull(correlationId, "correlationId");
        this.destination = Objects.requireNonNull(destination, "destination");
        if (expectedCount < 1) {
            throw new IllegalArgumentException("expectedCount must be >= 1, was " + expectedCount);
        }
        this.expectedCount = expectedCount;
        this.receivedDeliveries = List.copyOf(receivedDeliveries);
    }

    public static PendingRequest awaiting(String correlationId,
                                          CompletableFuture<RpcOutcome> destination,
                                          int expectedCount) {
        return new PendingRequest(correlationId, destination, expectedCount, List.of());
    }

    public String correlationId() {
        return correlationId;
    }

    /**
     * The caller handle to resolve.
     */
    public CompletableFuture<RpcOutcome> destination() {
        return destination;
    }

    public int expectedCount() {
        return expectedCount;
    }

    public List<Delivery> receivedDeliveries() {
        return receivedDeliveries;
    }

    public boolean isComplete() {
        return receivedDeliveries.size() >= expectedCount;
    }

    public PendingRequest withDelivery(Delivery delivery) {
        Objects.requireNonNull(delivery, "delivery");
        List<Delivery> updated = new ArrayList<>(receivedDeliveries.size() + 1);
        updated.addAll(receivedDeliveries);
        updated.add(delivery);
        return new PendingRequest(correlationId, destination, expectedCount, updated);
    }
}
