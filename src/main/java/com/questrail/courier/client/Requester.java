package com.questrail.courier.client;

import com.questrail.courier.api.NotConnectedException;
import com.questrail.courier.api.PublishRequest;
import com.questrail.courier.api.RpcOutcome;
import com.questrail.courier.codec.WireConvention;
import com.questrail.courier.config.QueueParameters;
import com.questrail.courier.internal.events.RequesterRequestEvent;
import com.questrail.courier.internal.exec.RequesterOperationalDriver;
import com.questrail.courier.internal.state.ConnectionState;
import com.questrail.courier.internal.state.RequesterState;
import com.questrail.courier.internal.state.RequesterStateReducer;
import com.questrail.courier.internal.time.SystemWallClock;
import com.questrail.courier.internal.time.WallClock;
import com.questrail.courier.observability.CourierObservabilitySink;
import com.questrail.courier.observability.NullObservabilitySink;
import com.questrail.courier.transport.BrokerChannel;
import com.questrail.courier.transport.amqp.BrokerRequesterExecutor;
import com.questrail.courier.transport.amqp.RequesterTransportAdapter;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Requester
 * -----------------------------------------------------------------------------
 * Request/response over one broker channel.
 *
 * <p>{@link #sendRequest(List, int)} publishes a request and returns a handle
 * that resolves exactly once: with a {@link RpcOutcome.Response} once the
 * expected number of replies has arrived, with {@link RpcOutcome.Undelivered}
 * if the broker returns the request, or exceptionally. There is no timeout; use
 * {@link CompletableFuture#orTimeout} on the handle if you need one. A handle
 * whose request was pending when the connection dropped never resolves.</p>
 *
 * <h2>Composition</h2>
 * <pre>
 *   BrokerChannel ──callbacks──▶ RequesterTransportAdapter ──events──▶ RequesterOperationalDriver
 *                                                                        │ RequesterStateReducer
 *   BrokerChannel ◀──publish/ack/declare── BrokerRequesterExecutor ◀──intents
 * </pre>
 *
 * <p>Handles are completed on the requester's owner thread. Dependent stages
 * attached with the non-async {@code then*} methods run on that thread too and
 * must not block.</p>
 */
public final class Requester
{
    private final String name;
    private final BrokerChannel channel;
    private final RequesterOperationalDriver driver;
    private final WallClock clock;

    private Requester(String name,
                      BrokerChannel channel,
                      RequesterOperationalDriver driver,
                      WallClock clock) {
        this.name = name;
        this.channel = channel;
        this.driver = driver;
        this.clock = clock;
    }

    /**
     * Builds a requester over {@code channel}. The channel's listener is replaced.
     *
     * @param replyQueue static reply queue settings, or {@code null} for a
     *                   broker-named, exclusive private queue
     */
    public static Requester create(String name,
                                   BrokerChannel channel,
                                   WireConvention wire,
                                   QueueParameters replyQueue,
                                   CourierObservabilitySink observabilitySink) {
        return create(name, channel, wire, replyQueue, observabilitySink, SystemWallClock.INSTANCE);
    }

    public static Requester create(String name,
                                   BrokerChannel channel,
                                   WireConvention wire,
                                   QueueParameters replyQueue,
                                   CourierObservabilitySink observabilitySink,
                                   WallClock clock) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(channel, "channel");
        Objects.requireNonNull(wire, "wire");
        Objects.requireNonNull(clock, "clock");
        CourierObservabilitySink sink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);

        // Executor feedback goes to the driver, which is built after the executor.
        AtomicReference<RequesterOperationalDriver> loop = new AtomicReference<>();

        BrokerRequesterExecutor executor = new BrokerRequesterExecutor(
                name, channel, wire, replyQueue, event -> loop.get().submitEvent(event), clock, sink);

        RequesterOperationalDriver driver = new RequesterOperationalDriver(
                name,
                new RequesterStateReducer(name),
                executor,
                () -> RequesterState.initial(clock.now()),
                clock,
                sink);
        loop.set(driver);

        channel.setListener(new RequesterTransportAdapter(name, driver::submitEvent, wire, clock, sink));
        return new Requester(name, channel, driver, clock);
    }

    public String name() {
        return name;
    }

    /**
     * Starts the owner loop, then the channel.
     */
    public void start() {
        driver.start();
        channel.start();
    }

    /**
     * Stops the channel, then the owner loop.
     */
    public void stop() {
        try {
            channel.stop();
        } finally {
            driver.stop();
        }
    }

    /**
     * Publish {@code messages} and wait for {@code expectedReplies} replies.
     *
     * <p>With {@code expectedReplies == 0} the handle resolves with an empty
     * {@link RpcOutcome.Response} as soon as everything is published.</p>
     *
     * @return a handle that fails with {@link NotConnectedException} when the
     *         requester is not connected, with {@link IllegalArgumentException}
     *         for a negative count or no messages, and with
     *         {@link com.questrail.courier.api.BrokerException} if publishing fails
     */
    public CompletableFuture<RpcOutcome> sendRequest(List<PublishRequest> messages, int expectedReplies) {
        Objects.requireNonNull(messages, "messages");

        CompletableFuture<RpcOutcome> handle = new CompletableFuture<>();
        if (messages.isEmpty()) {
            handle.completeExceptionally(new IllegalArgumentException("A request needs at least one message"));
            return handle;
        }

        RequesterRequestEvent.RequestSubmitted event =
                new RequesterRequestEvent.RequestSubmitted(clock.now(), messages, expectedReplies, handle);
        if (!driver.submitEvent(event)) {
            handle.completeExceptionally(new NotConnectedException("Requester " + name + " is not running"));
        }
        return handle;
    }

    public CompletableFuture<RpcOutcome> sendRequest(PublishRequest message, int expectedReplies) {
        return sendRequest(List.of(message), expectedReplies);
    }

    public ConnectionState connectionState() {
        return driver.currentState().connection();
    }

    /**
     * Snapshot of the requester's state. Mostly for diagnostics and tests.
     */
    public RequesterState state() {
        return driver.currentState();
    }
}
