package com.questrail.courier.internal.exec;

import com.questrail.courier.api.NotConnectedException;
import com.questrail.courier.internal.events.RequesterEvent;
import com.questrail.courier.internal.events.RequesterRequestEvent;
import com.questrail.courier.internal.state.RequesterState;
import com.questrail.courier.internal.state.RequesterStateReducer;
import com.questrail.courier.internal.time.SystemWallClock;
import com.questrail.courier.internal.time.WallClock;
import com.questrail.courier.observability.CourierErrorEvent;
import com.questrail.courier.observability.CourierObservabilitySink;
import com.questrail.courier.observability.NullObservabilitySink;
import com.questrail.courier.observability.RequesterStateTransitionEvent;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * RequesterOperationalDriver
 * =============================================================================
 * The single thread that owns a requester's {@link RequesterState}.
 *
 * <p>Callers, broker callbacks and executor feedback never touch the state.
 * They enqueue {@link RequesterEvent}s with {@link #submitEvent}. The owner
 * thread takes one event at a time, lets the {@link RequesterStateReducer}
 * compute the next state, publishes the transition to the observability sink
 * and only then runs the intents through the {@link RequesterIntentExecutor}.
 * Intents therefore see events in exactly the order they were queued, and every
 * channel operation a requester performs is issued from this thread.</p>
 *
 * <p>An exception escaping the reducer or the executor is reported as an error
 * event; the next event is processed normally.</p>
 *
 * <p>After {@link #stop()} nothing more is applied. Requests that were queued
 * but never reached the reducer fail with {@link NotConnectedException}.</p>
 */
public final class RequesterOperationalDriver {

    private static final long STOP_JOIN_MILLIS = 5000;

    private final String component;
    private final RequesterStateReducer reducer;
    private final RequesterIntentExecutor executor;
    private final Supplier<RequesterState> initialStateSupplier;
    private final WallClock clock;
    private final CourierObservabilitySink observabilitySink;

    private final BlockingQueue<RequesterEvent> inbox = new LinkedBlockingQueue<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Object stateLock = new Object();

    private RequesterState currentState;
    private volatile Thread owner;

    public RequesterOperationalDriver(String component,
                                      RequesterStateReducer reducer,
                                      RequesterIntentExecutor executor,
                                      Supplier<RequesterState> initialStateSupplier,
                                      CourierObservabilitySink observabilitySink)
    {
        this(component, reducer, executor, initialStateSupplier, SystemWallClock.INSTANCE, observabilitySink);
    }

    /**
     * @param component            requester name; names the owner thread and tags reported events
     * @param initialStateSupplier state to (re)start from on every {@link #start()}
     * @param clock                timestamps transitions and errors
     * @param observabilitySink    {@code null} for none
     */
    public RequesterOperationalDriver(String component,
                                      RequesterStateReducer reducer,
                                      RequesterIntentExecutor executor,
                                      Supplier<RequesterState> initialStateSupplier,
                                      WallClock clock,
                                      CourierObservabilitySink observabilitySink)
    {
        this.component = Objects.requireNonNull(component, "component");
        this.reducer = Objects.requireNonNull(reducer, "reducer");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.initialStateSupplier = Objects.requireNonNull(initialStateSupplier, "initialStateSupplier");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
        this.currentState = initialStateSupplier.get();
    }

    /**
     * Starts the owner thread. Has no effect while already running.
     */
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        synchronized (stateLock) {
            currentState = initialStateSupplier.get();
        }
        Thread thread = new Thread(this::drainInbox, "courier-requester-" + component);
        thread.setDaemon(true);
        owner = thread;
        thread.start();
    }

    /**
     * Stops the owner thread and waits for it to finish the event in hand.
     * Requests already published stay unresolved.
     */
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        Thread thread = owner;
        if (thread != null && thread != Thread.currentThread()) {
            thread.interrupt();
            try {
                thread.join(STOP_JOIN_MILLIS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        rejectUnprocessedRequests();
    }

    /**
     * Queues an event for the owner thread.
     *
     * @return {@code false} when the driver is not running; the event is dropped
     */
    public boolean submitEvent(RequesterEvent event) {
        Objects.requireNonNull(event, "event");
        if (!running.get()) {
            return false;
        }
        inbox.offer(event);
        return true;
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Latest state; safe to call from any thread.
     */
    public RequesterState currentState() {
        synchronized (stateLock) {
            return currentState;
        }
    }

    private void drainInbox() {
        try {
            while (running.get()) {
                RequesterEvent event = inbox.take();
                if (!running.get()) {
                    // Stopped while waiting; leave it for rejectUnprocessedRequests.
                    inbox.offer(event);
                    return;
                }
                try {
                    apply(event);
                } catch (RuntimeException e) {
                    reportError("Failed to apply " + event.getClass().getSimpleName(), e);
                }
            }
        } catch (InterruptedException e) {
            if (running.get()) {
                reportError("Owner thread interrupted while running", e);
            }
        }
    }

    private void apply(RequesterEvent event) {
        RequesterState before;
        RequesterStateReducer.Result result;
        synchronized (stateLock) {
            before = currentState;
            result = reducer.apply(before, event);
            currentState = result.newState();
        }

        observabilitySink.onStateTransition(new RequesterStateTransitionEvent(
                clock.now(), component, before, result.newState(), event, result.intents()));

        if (!result.intents().isEmpty()) {
            executor.execute(result.intents());
        }
    }

    private void rejectUnprocessedRequests() {
        List<RequesterEvent> unprocessed = new ArrayList<>();
        inbox.drainTo(unprocessed);
        for (RequesterEvent event : unprocessed) {
            if (event instanceof RequesterRequestEvent.RequestSubmitted submitted) {
                submitted.handle().completeExceptionally(
                        new NotConnectedException("Requester " + component + " stopped"));
            }
        }
    }

    private void reportError(String message, Throwable cause) {
        observabilitySink.onError(new CourierErrorEvent(clock.now(), "[" + component + "] " + message, cause));
    }
}
