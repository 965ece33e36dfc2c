package com.questrail.courier.client;

import com.questrail.courier.api.Envelope;
import com.questrail.courier.api.RemoteProcessingException;
import com.questrail.courier.api.RpcOutcome;
import com.questrail.courier.api.ServerFailure;
import com.questrail.courier.codec.EnvelopeCodec;
import com.questrail.courier.codec.SerializationException;
import com.questrail.courier.codec.WireConvention;
import com.questrail.courier.codec.impl.DefaultSerializerRegistry;
import com.questrail.courier.config.EndpointConfig;
import com.questrail.courier.internal.state.ConnectionState;
import com.questrail.courier.testing.Await;
import com.questrail.courier.transport.FakeBrokerChannel;
import com.questrail.courier.transport.InboundMessage;
import com.questrail.courier.transport.InboundReturn;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class RemoteProxyTest {

    record Quote(String symbol, int price) {}

    private FakeBrokerChannel channel;
    private EnvelopeCodec codec;
    private Requester requester;
    private RemoteProxy proxy;

    @BeforeEach
    void setUp() {
        channel = new FakeBrokerChannel();
        codec = new EnvelopeCodec(DefaultSerializerRegistry.standard(List.of()));
        requester = Requester.create("quotes", channel, WireConvention.standard(), null, null);
        proxy = RemoteProxy.forEndpoint(requester, codec, EndpointConfig.defaults("quotes"));

        requester.start();
        Await.until(() -> requester.connectionState() == ConnectionState.CONNECTED, "requester connected");
    }

    @AfterEach
    void tearDown() {
        requester.stop();
    }

    @Test
    void askPublishesToEndpointAndDecodesReply() throws Exception {
        CompletableFuture<Object> answer = proxy.ask(new Quote("ACME", 0));
        FakeBrokerChannel.Published request = awaitPublished();

        assertEquals("quotes", request.exchange());
        assertEquals("quotes", request.routingKey());
        assertTrue(request.mandatory());
        assertFalse(request.immediate());
        assertEquals("json", request.properties().contentEncoding());
        assertEquals(Quote.class.getName(), request.properties().contentType());
        assertEquals(new Quote("ACME", 0), codec.deserialize(request.body(),
                WireConvention.standard().fromWire(request.properties().contentEncoding(),
                        request.properties().contentType())).message());

        replyWith(request, new Quote("ACME", 101));

        assertEquals(new Quote("ACME", 101), answer.get(5, TimeUnit.SECONDS));
    }

    @Test
    void serverFailureBecomesRemoteProcessingException() {
        CompletableFuture<Object> answer = proxy.ask(new Quote("FAIL", 0));
        replyWith(awaitPublished(), new ServerFailure("no such symbol", "java.lang.IllegalArgumentException: no such symbol"));

        ExecutionException e = assertThrows(ExecutionException.class, () -> answer.get(5, TimeUnit.SECONDS));
        RemoteProcessingException remote = assertInstanceOf(RemoteProcessingException.class, e.getCause());
        assertEquals("no such symbol", remote.getMessage());
        assertTrue(remote.remoteDetail().startsWith("java.lang.IllegalArgumentException"));
    }

    @Test
    void undeliverableRequestIsReturnedAsValue() throws Exception {
        CompletableFuture<Object> answer = proxy.ask(new Quote("LOST", 0));
        FakeBrokerChannel.Published request = awaitPublished();

        channel.returned(new InboundReturn(312, "NO_ROUTE", request.exchange(), request.routingKey(),
                request.properties().contentEncoding(), request.properties().contentType(),
                request.properties().correlationId(), request.body()));

        assertInstanceOf(RpcOutcome.Undelivered.class, answer.get(5, TimeUnit.SECONDS));
    }

    @Test
    void unencodableMessageFailsWithoutPublishing() {
        CompletableFuture<Object> answer = proxy.ask(null);

        ExecutionException e = assertThrows(ExecutionException.class, answer::get);
        assertInstanceOf(SerializationException.class, e.getCause());
        assertTrue(channel.published().isEmpty());
    }

    @Test
    void tellPublishesWithoutCorrelation() throws Exception {
        proxy.tell(new Quote("ACME", 5)).get(5, TimeUnit.SECONDS);

        FakeBrokerChannel.Published published = channel.published().get(0);
        assertNull(published.properties().correlationId());
        assertNull(published.properties().replyTo());
    }

    private FakeBrokerChannel.Published awaitPublished() {
        Await.until(() -> !channel.published().isEmpty(), "request published");
        return channel.published().get(0);
    }

    private void replyWith(FakeBrokerChannel.Published request, Object reply) {
        Envelope envelope = codec.serialize(reply, codec.registry().defaultSerializer());
        channel.deliver(new InboundMessage(1,
                envelope.properties().serializerId(),
                envelope.properties().typeName(),
                request.properties().correlationId(),
                null,
                envelope.body()));
    }
}
