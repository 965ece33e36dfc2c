package com.questrail.courier.server;

import com.questrail.courier.api.Delivery;
import com.questrail.courier.api.MessageProcessor;
import com.questrail.courier.api.MessageProperties;
import com.questrail.courier.api.ProcessResult;
import com.questrail.courier.api.PublishRequest;
import com.questrail.courier.codec.WireConvention;
import com.questrail.courier.config.EndpointConfig;
import com.questrail.courier.config.ExchangeParameters;
import com.questrail.courier.internal.time.WallClock;
import com.questrail.courier.observability.CourierErrorEvent;
import com.questrail.courier.observability.CourierObservabilitySink;
import com.questrail.courier.observability.CourierProtocolEvent;
import com.questrail.courier.observability.CourierTransportEvent;
import com.questrail.courier.observability.NullObservabilitySink;
import com.questrail.courier.transport.BrokerChannel;
import com.questrail.courier.transport.BrokerChannelListener;
import com.questrail.courier.transport.InboundMessage;
import com.questrail.courier.transport.InboundReturn;
import com.questrail.courier.transport.OutboundProperties;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * RpcServerAdapter
 * =============================================================================
 * Hosts a {@link MessageProcessor} on one endpoint's queue and publishes its
 * results as replies.
 *
 * <h2>Per delivery</h2>
 * <pre>
 *   InboundMessage
 *      → ack (owner thread)
 *      → MessageProcessor.process (processing executor)
 *      → on failure: MessageProcessor.onFailure
 *      → reply publish to the default exchange, routing key = reply address,
 *        carrying the request's correlation id (owner thread)
 * </pre>
 *
 * <p>No reply is published when the request has no reply address or the result
 * has no value. Acknowledgement is not tied to processing: a request
 * redelivered after a connection loss is processed again, and duplicates are
 * not detected.</p>
 *
 * <h2>Topology</h2>
 * On every (re)connection the adapter applies the endpoint's prefetch, declares
 * its exchange and queue (a randomized queue gets a fresh name), binds the
 * queue with the endpoint name as routing key, and starts consuming.
 *
 * <h2>Threading</h2>
 * Channel I/O is confined to a single owner thread. Processing runs on the
 * supplied executor and never touches the channel.
 */
public final class RpcServerAdapter implements BrokerChannelListener
{
    private final String name;
    private final BrokerChannel channel;
    private final EndpointConfig endpoint;
    private final MessageProcessor processor;
    private final WireConvention wire;
    private final Executor processingExecutor;
    private final WallClock clock;
    private final CourierObservabilitySink observabilitySink;
    private final ExecutorService owner;

    private volatile String consumedQueue;

    public RpcServerAdapter(BrokerChannel channel,
                            EndpointConfig endpoint,
                            MessageProcessor processor,
                            WireConvention wire,
                            Executor processingExecutor,
                            WallClock clock,
                            CourierObservabilitySink observabilitySink) {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.name = endpoint.name();
        this.processor = Objects.requireNonNull(processor, "processor");
        this.wire = Objects.requireNonNull(wire, "wire");
        this.processingExecutor = Objects.requireNonNull(processingExecutor, "processingExecutor");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
        this.owner = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "courier-server-" + name);
            t.setDaemon(true);
            return t;
        });

        this.channel.setListener(this);
    }

    public String name() {
        return name;
    }

    public void start() {
        channel.start();
    }

    /**
     * Stops the channel and the owner thread. Replies for requests still being
     * processed are dropped.
     */
    public void stop() {
        try {
            channel.stop();
        } finally {
            owner.shutdown();
            try {
                if (!owner.awaitTermination(5, TimeUnit.SECONDS)) {
                    owner.shutdownNow();
                }
            } catch (InterruptedException e) {
                owner.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * The queue currently consumed, once bound. Its name changes on every
     * (re)connection when the queue is randomized.
     */
    public Optional<String> consumedQueue() {
        return Optional.ofNullable(consumedQueue);
    }

    // -------------------------------------------------------------------------
    // BrokerChannelListener
    // -------------------------------------------------------------------------

    @Override
    public void onConnected() {
        observabilitySink.onTransportEvent(new CourierTransportEvent(clock.now(), name, true, null));
        runOnOwner(this::bindAndConsume);
    }

    @Override
    public void onDisconnected(Throwable cause) {
        consumedQueue = null;
        observabilitySink.onTransportEvent(new CourierTransportEvent(clock.now(), name, false, cause));
    }

    @Override
    public void onDelivery(InboundMessage message) {
        Objects.requireNonNull(message, "message");
        runOnOwner(() -> handleDelivery(message));
    }

    @Override
    public void onReturned(InboundReturn returned) {
        observabilitySink.onProtocolEvent(new CourierProtocolEvent(clock.now(),
                CourierProtocolEvent.Kind.UNMATCHED_RETURN, name, returned.correlationId(),
                "reply returned " + returned.replyCode() + " " + returned.replyText()));
    }

    // -------------------------------------------------------------------------
    // Owner thread
    // -------------------------------------------------------------------------

    private void bindAndConsume() {
        ExchangeParameters exchange = endpoint.exchange();

        channel.qos(endpoint.channel());
        channel.declareExchange(exchange);
        String queue = channel.declareQueue(endpoint.queue().resolve());
        if (!exchange.isDefaultExchange()) {
            channel.bind(exchange.name(), queue, endpoint.routingKey());
        }
        channel.consume(queue);
        consumedQueue = queue;
    }

    private void handleDelivery(InboundMessage message) {
        channel.ack(message.deliveryTag());

        Delivery delivery = new Delivery(
                message.deliveryTag(),
                wire.fromWire(message.contentEncoding(), message.contentType()),
                message.body(),
                message.replyTo(),
                message.correlationId());

        CompletableFuture
                .supplyAsync(() -> processor.process(delivery), processingExecutor)
                .thenCompose(stage -> stage)
                .handle((result, error) -> error == null ? result : failureResult(delivery, error))
                .thenAcceptAsync(result -> reply(delivery, result), owner)
                .exceptionally(error -> {
                    reportError("Reply for correlationId=" + delivery.correlationId() + " failed", error);
                    return null;
                });
    }

    private ProcessResult failureResult(Delivery delivery, Throwable error) {
        Throwable cause = unwrap(error);
        observabilitySink.onProtocolEvent(new CourierProtocolEvent(clock.now(),
                CourierProtocolEvent.Kind.PROCESSING_FAILED, name, delivery.correlationId(), String.valueOf(cause)));
        return processor.onFailure(delivery, cause);
    }

    private void reply(Delivery delivery, ProcessResult result) {
        if (delivery.replyTo() == null) {
            suppressed(delivery, "request has no reply address");
            return;
        }
        if (result == null || result.value().isEmpty()) {
            suppressed(delivery, "result has no value");
            return;
        }

        MessageProperties properties = result.properties().orElse(MessageProperties.empty());
        channel.publish(
                ExchangeParameters.DEFAULT_EXCHANGE,
                delivery.replyTo(),
                false,
                false,
                new OutboundProperties(
                        wire.contentEncoding(properties),
                        wire.contentType(properties),
                        delivery.correlationId(),
                        null,
                        PublishRequest.TRANSIENT),
                result.value().get());
    }

    private void suppressed(Delivery delivery, String detail) {
        observabilitySink.onProtocolEvent(new CourierProtocolEvent(clock.now(),
                CourierProtocolEvent.Kind.REPLY_SUPPRESSED, name, delivery.correlationId(), detail));
    }

    private void runOnOwner(Runnable task) {
        try {
            owner.execute(() -> {
                try {
                    task.run();
                } catch (RuntimeException e) {
                    reportError("Server adapter task failed", e);
                }
            });
        } catch (RejectedExecutionException e) {
            reportError("Server adapter is stopped", e);
        }
    }

    private void reportError(String message, Throwable error) {
        observabilitySink.onError(new CourierErrorEvent(clock.now(), "[" + name + "] " + message, unwrap(error)));
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }
}
