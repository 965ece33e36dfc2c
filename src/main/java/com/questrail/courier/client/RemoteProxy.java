package com.questrail.courier.client;

import com.questrail.courier.api.Delivery;
import com.questrail.courier.api.Envelope;
import com.questrail.courier.api.PublishRequest;
import com.questrail.courier.api.RemoteProcessingException;
import com.questrail.courier.api.RpcOutcome;
import com.questrail.courier.api.ServerFailure;
import com.questrail.courier.codec.EnvelopeCodec;
import com.questrail.courier.codec.SerializationException;
import com.questrail.courier.codec.Serializer;
import com.questrail.courier.config.EndpointConfig;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Typed client for one remote endpoint.
 *
 * <p>{@link #ask(Object)} sends one request and decodes the single reply:</p>
 * <ul>
 *   <li>a {@link ServerFailure} reply fails the future with {@link RemoteProcessingException}</li>
 *   <li>a returned (unroutable) request completes the future with the
 *       {@link RpcOutcome.Undelivered} value itself</li>
 *   <li>a message that cannot be encoded fails the future with
 *       {@link SerializationException}; nothing is published</li>
 * </ul>
 *
 * <p>{@link #tell(Object)} publishes without waiting for replies.</p>
 */
public final class RemoteProxy
{
    private final Requester requester;
    private final EnvelopeCodec codec;
    private final Serializer serializer;
    private final String exchange;
    private final String routingKey;
    private final boolean mandatory;
    private final boolean immediate;
    private final int deliveryMode;

    public RemoteProxy(Requester requester,
                       EnvelopeCodec codec,
                       Serializer serializer,
                       String exchange,
                       String routingKey,
                       boolean mandatory,
                       boolean immediate,
                       int deliveryMode) {
        this.requester = Objects.requireNonNull(requester, "requester");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.serializer = Objects.requireNonNull(serializer, "serializer");
        this.exchange = Objects.requireNonNull(exchange, "exchange");
        this.routingKey = Objects.requireNonNull(routingKey, "routingKey");
        this.mandatory = mandatory;
        this.immediate = immediate;
        this.deliveryMode = deliveryMode;
    }

    /**
     * Proxy publishing to the endpoint's exchange with the endpoint name as
     * routing key: mandatory, not immediate, transient.
     */
    public static RemoteProxy forEndpoint(Requester requester, EnvelopeCodec codec, EndpointConfig endpoint) {
        return new RemoteProxy(requester, codec, codec.registry().defaultSerializer(),
                endpoint.exchange().name(), endpoint.routingKey(),
                true, false, PublishRequest.TRANSIENT);
    }

    public Requester requester() {
        return requester;
    }

    public CompletableFuture<Object> ask(Object message) {
        final PublishRequest request;
        try {
            request = toPublishRequest(message);
        } catch (SerializationException e) {
            return CompletableFuture.failedFuture(e);
        }

        return requester.sendRequest(request, 1).thenApply(this::decodeReply);
    }

    /**
     * Fire-and-forget. The future completes once the message is published.
     */
    public CompletableFuture<Void> tell(Object message) {
        final PublishRequest request;
        try {
            request = toPublishRequest(message);
        } catch (SerializationException e) {
            return CompletableFuture.failedFuture(e);
        }

        return requester.sendRequest(request, 0).thenApply(outcome -> null);
    }

    private PublishRequest toPublishRequest(Object message) {
        Envelope envelope = codec.serialize(message, serializer);
        return new PublishRequest(exchange, routingKey, envelope, mandatory, immediate, deliveryMode);
    }

    private Object decodeReply(RpcOutcome outcome) {
        if (outcome instanceof RpcOutcome.Undelivered) {
            return outcome;
        }

        Delivery reply = ((RpcOutcome.Response) outcome).deliveries().get(0);
        Object decoded = codec.deserialize(reply.envelope()).message();
        if (decoded instanceof ServerFailure failure) {
            throw RemoteProcessingException.from(failure);
        }
        return decoded;
    }
}
