package com.questrail.courier.server;

import com.questrail.courier.api.Delivery;
import com.questrail.courier.api.Envelope;
import com.questrail.courier.api.MessageProperties;
import com.questrail.courier.api.ProcessResult;
import com.questrail.courier.api.ServerFailure;
import com.questrail.courier.codec.DeserializationException;
import com.questrail.courier.codec.EnvelopeCodec;
import com.questrail.courier.codec.impl.DefaultSerializerRegistry;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class HandlerProcessorTest {

    record Order(String item, int quantity) {}

    private final EnvelopeCodec codec = new EnvelopeCodec(DefaultSerializerRegistry.standard(List.of()));

    @Test
    void replyIsEncodedWithRequestSerializer() throws Exception {
        HandlerProcessor processor = new HandlerProcessor(
                message -> CompletableFuture.completedFuture(((Order) message).quantity() * 2), codec);

        Delivery request = delivery(new Order("bolt", 21), DefaultSerializerRegistry.GZIP_JSON);
        ProcessResult result = processor.process(request).toCompletableFuture().get(5, TimeUnit.SECONDS);

        assertEquals(DefaultSerializerRegistry.GZIP_JSON, result.properties().orElseThrow().serializerId());
        assertEquals(Integer.class.getName(), result.properties().get().typeName());
        assertEquals(42, codec.deserialize(new Envelope(result.value().orElseThrow(), result.properties().get())).message());
    }

    @Test
    void nullResultMeansNoReply() throws Exception {
        HandlerProcessor processor = new HandlerProcessor(message -> CompletableFuture.completedFuture(null), codec);

        ProcessResult result = processor.process(delivery("ping", DefaultSerializerRegistry.JSON))
                .toCompletableFuture().get(5, TimeUnit.SECONDS);

        assertTrue(result.value().isEmpty());
    }

    @Test
    void failureIsEncodedAsServerFailure() {
        HandlerProcessor processor = new HandlerProcessor(message -> CompletableFuture.completedFuture(null), codec);

        ProcessResult result = processor.onFailure(delivery("ping", DefaultSerializerRegistry.JSON),
                new IllegalStateException("out of stock"));

        Object decoded = codec.deserialize(new Envelope(result.value().orElseThrow(), result.properties().orElseThrow())).message();
        ServerFailure failure = assertInstanceOf(ServerFailure.class, decoded);
        assertEquals("out of stock", failure.message());
        assertTrue(failure.throwableAsString().contains("IllegalStateException"));
    }

    @Test
    void undecodableRequestFailsProcessing() {
        HandlerProcessor processor = new HandlerProcessor(message -> CompletableFuture.completedFuture(message), codec);
        Delivery garbage = new Delivery(1, new MessageProperties("json", "?"),
                new byte[] {'{', 'x'}, "reply", "c-1");

        assertThrows(DeserializationException.class, () -> processor.process(garbage));
    }

    private Delivery delivery(Object message, String serializerId) {
        Envelope envelope = codec.serialize(message, codec.registry().lookup(serializerId));
        return new Delivery(1, envelope.properties(), envelope.body(), "amq.gen-client", "c-1");
    }
}
