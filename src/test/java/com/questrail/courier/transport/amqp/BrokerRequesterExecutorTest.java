package com.questrail.courier.transport.amqp;

import com.questrail.courier.api.BrokerException;
import com.questrail.courier.api.Envelope;
import com.questrail.courier.api.MessageProperties;
import com.questrail.courier.api.PublishRequest;
import com.questrail.courier.api.RpcOutcome;
import com.questrail.courier.codec.WireConvention;
import com.questrail.courier.config.QueueParameters;
import com.questrail.courier.internal.events.RequesterBrokerEvent;
import com.questrail.courier.internal.events.RequesterEvent;
import com.questrail.courier.internal.events.RequesterTransportEvent;
import com.questrail.courier.internal.state.RequesterIntent;
import com.questrail.courier.internal.state.RequesterIntents;
import com.questrail.courier.internal.time.ManualWallClock;
import com.questrail.courier.observability.CourierProtocolEvent;
import com.questrail.courier.observability.RecordingObservabilitySink;
import com.questrail.courier.transport.FakeBrokerChannel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;

class BrokerRequesterExecutorTest {

    private FakeBrokerChannel channel;
    private List<RequesterEvent> feedback;
    private RecordingObservabilitySink sink;

    @BeforeEach
    void setUp() {
        channel = new FakeBrokerChannel();
        feedback = new ArrayList<>();
        sink = new RecordingObservabilitySink();
    }

    @Test
    void opensPrivateReplyQueueWhenNoneConfigured() {
        channel.setBrokerQueueName("amq.gen-42");
        executor(null, WireConvention.standard()).execute(RequesterIntents.of(new RequesterIntent.OpenReplyQueue(1)));

        QueueParameters declared = channel.declaredQueues().get(0);
        assertEquals("", declared.name());
        assertTrue(declared.exclusive());
        assertEquals(List.of("amq.gen-42"), channel.consumed());

        RequesterTransportEvent.ReplyQueueBound bound =
                assertInstanceOf(RequesterTransportEvent.ReplyQueueBound.class, feedback.get(0));
        assertEquals("amq.gen-42", bound.replyAddress());
        assertEquals(1, bound.attempt());
    }

    @Test
    void staticReplyQueueGetsFreshNameOnEveryOpen() {
        BrokerRequesterExecutor executor = executor(QueueParameters.randomized("replies"), WireConvention.standard());

        executor.execute(RequesterIntents.of(new RequesterIntent.OpenReplyQueue(1)));
        executor.execute(RequesterIntents.of(new RequesterIntent.OpenReplyQueue(1)));

        String first = channel.consumed().get(0);
        String second = channel.consumed().get(1);
        assertTrue(first.startsWith("replies-"));
        assertTrue(second.startsWith("replies-"));
        assertNotEquals(first, second);
    }

    @Test
    void publishStampsCorrelationAndMetadata() {
        executor(null, WireConvention.standard()).execute(RequesterIntents.of(
                new RequesterIntent.Publish(List.of(request()), "7", "reply-q", new CompletableFuture<>())));

        FakeBrokerChannel.Published p = channel.published().get(0);
        assertEquals("requests", p.exchange());
        assertTrue(p.mandatory());
        assertEquals("7", p.properties().correlationId());
        assertEquals("reply-q", p.properties().replyTo());
        assertEquals("json", p.properties().contentEncoding());
        assertEquals("java.lang.String", p.properties().contentType());
        assertEquals(PublishRequest.TRANSIENT, p.properties().deliveryMode());
    }

    @Test
    void legacyConventionSwapsMetadataFields() {
        executor(null, WireConvention.legacy()).execute(RequesterIntents.of(
                new RequesterIntent.Publish(List.of(request()), "7", "reply-q", new CompletableFuture<>())));

        FakeBrokerChannel.Published p = channel.published().get(0);
        assertEquals("java.lang.String", p.properties().contentEncoding());
        assertEquals("json", p.properties().contentType());
    }

    @Test
    void publishFailureFailsHandleSkipsRestAndFeedsBack() {
        channel.failPublishesAfter(1);
        CompletableFuture<RpcOutcome> handle = new CompletableFuture<>();

        executor(null, WireConvention.standard()).execute(RequesterIntents.of(
                new RequesterIntent.Publish(List.of(request(), request(), request()), "3", "reply-q", handle)));

        assertEquals(1, channel.published().size());
        ExecutionException e = assertThrows(ExecutionException.class, handle::get);
        assertInstanceOf(BrokerException.class, e.getCause());

        RequesterBrokerEvent.PublishFailed failed =
                assertInstanceOf(RequesterBrokerEvent.PublishFailed.class, feedback.get(0));
        assertEquals("3", failed.correlationId());
    }

    @Test
    void fireAndForgetPublishFailureIsNotResolvedAfterwards() {
        channel.failNextPublishes(1);
        CompletableFuture<RpcOutcome> handle = new CompletableFuture<>();

        executor(null, WireConvention.standard()).execute(RequesterIntents.of(
                new RequesterIntent.Publish(List.of(request()), null, null, handle),
                new RequesterIntent.Resolve(handle, RpcOutcome.Response.acknowledged())));

        assertTrue(handle.isCompletedExceptionally());
        assertTrue(feedback.isEmpty());
    }

    @Test
    void acknowledgesResolvesRejectsAndReports() {
        CompletableFuture<RpcOutcome> resolved = new CompletableFuture<>();
        CompletableFuture<RpcOutcome> rejected = new CompletableFuture<>();
        CourierProtocolEvent event = new CourierProtocolEvent(Instant.now(),
                CourierProtocolEvent.Kind.UNMATCHED_DELIVERY, "test", "9", "no match");

        executor(null, WireConvention.standard()).execute(RequesterIntents.of(
                new RequesterIntent.Acknowledge(4),
                new RequesterIntent.Resolve(resolved, RpcOutcome.Response.acknowledged()),
                new RequesterIntent.Reject(rejected, new IllegalArgumentException("nope")),
                new RequesterIntent.Report(event)));

        assertEquals(List.of(4L), channel.acked());
        assertEquals(RpcOutcome.Response.acknowledged(), resolved.join());
        assertTrue(rejected.isCompletedExceptionally());
        assertEquals(List.of(event), sink.getProtocolEvents(CourierProtocolEvent.Kind.UNMATCHED_DELIVERY));
    }

    private BrokerRequesterExecutor executor(QueueParameters replyQueue, WireConvention wire) {
        return new BrokerRequesterExecutor("executor-test", channel, wire, replyQueue,
                feedback::add, new ManualWallClock(), sink);
    }

    private static PublishRequest request() {
        return PublishRequest.of("requests", "requests",
                new Envelope(new byte[] {1, 2, 3}, new MessageProperties("json", "java.lang.String")));
    }
}
