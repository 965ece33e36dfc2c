package com.questrail.courier.server;

import com.questrail.courier.api.Delivery;
import com.questrail.courier.api.MessageProcessor;
import com.questrail.courier.api.ProcessResult;
import com.questrail.courier.api.ServerFailure;
import com.questrail.courier.codec.EnvelopeCodec;
import com.questrail.courier.codec.Serializer;

import java.util.Objects;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;

/**
 * {@link MessageProcessor} over a plain message handler.
 *
 * <p>The request is decoded with the serializer named in its envelope and the
 * handler's result is encoded with that same serializer. A {@code null} result
 * means no reply. Failures are replied as a {@link ServerFailure}.</p>
 */
public final class HandlerProcessor implements MessageProcessor
{
    private final Function<Object, ? extends CompletionStage<?>> handler;
    private final EnvelopeCodec codec;

    public HandlerProcessor(Function<Object, ? extends CompletionStage<?>> handler, EnvelopeCodec codec) {
        this.handler = Objects.requireNonNull(handler, "handler");
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    @Override
    public CompletionStage<ProcessResult> process(Delivery delivery) {
        EnvelopeCodec.Decoded request = codec.deserialize(delivery.envelope());
        CompletionStage<?> result = Objects.requireNonNull(
                handler.apply(request.message()), "handler returned no completion stage");

        return result.thenApply(value -> value == null
                ? ProcessResult.noReply()
                : ProcessResult.reply(codec.serialize(value, request.serializer())));
    }

    @Override
    public ProcessResult onFailure(Delivery delivery, Throwable error) {
        Serializer serializer = codec.registry().lookup(delivery.properties().serializerId());
        return ProcessResult.reply(codec.serialize(ServerFailure.of(error), serializer));
    }
}
