package com.questrail.courier.transport.amqp;

import com.questrail.courier.api.BrokerException;
import com.questrail.courier.api.Envelope;
import com.questrail.courier.api.PublishRequest;
import com.questrail.courier.codec.WireConvention;
import com.questrail.courier.config.QueueParameters;
import com.questrail.courier.internal.events.RequesterBrokerEvent;
import com.questrail.courier.internal.events.RequesterEvent;
import com.questrail.courier.internal.events.RequesterTransportEvent;
import com.questrail.courier.internal.exec.RequesterIntentExecutor;
import com.questrail.courier.internal.state.RequesterIntent;
import com.questrail.courier.internal.state.RequesterIntents;
import com.questrail.courier.internal.time.WallClock;
import com.questrail.courier.observability.CourierErrorEvent;
import com.questrail.courier.observability.CourierObservabilitySink;
import com.questrail.courier.observability.NullObservabilitySink;
import com.questrail.courier.transport.BrokerChannel;
import com.questrail.courier.transport.OutboundProperties;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * BrokerRequesterExecutor
 * =============================================================================
 * Realizes {@link RequesterIntents} against a {@link BrokerChannel}.
 *
 * <h2>Outbound wiring flow</h2>
 *
 * <pre>
 *   RequesterEvent
 *      ↓
 *   RequesterStateReducer
 *      ↓ emits
 *   RequesterIntents
 *      ↓ consumed by
 *   BrokerRequesterExecutor   (this class)
 *      ↓ WireConvention
 *   BrokerChannel.publish / ack / declareQueue / consume
 * </pre>
 *
 * <h2>Feedback</h2>
 * Outcomes the reducer must know about are reported as events through
 * {@code feedback} (normally the owner loop's submit), never applied directly:
 * <ul>
 *   <li>{@link RequesterTransportEvent.ReplyQueueBound} once the reply queue consumes</li>
 *   <li>{@link RequesterBrokerEvent.PublishFailed} when a correlated publish fails</li>
 * </ul>
 *
 * <p>Executed on the requester's owner thread only.</p>
 */
public final class BrokerRequesterExecutor implements RequesterIntentExecutor
{
    private final String component;
    private final BrokerChannel channel;
    private final WireConvention wire;
    private final QueueParameters replyQueue;
    private final Consumer<RequesterEvent> feedback;
    private final WallClock clock;
    private final CourierObservabilitySink observabilitySink;

    /**
     * @param replyQueue static reply queue settings, or {@code null} for a
     *                   broker-named, exclusive private queue
     */
    public BrokerRequesterExecutor(String component,
                                   BrokerChannel channel,
                                   WireConvention wire,
                                   QueueParameters replyQueue,
                                   Consumer<RequesterEvent> feedback,
                                   WallClock clock,
                                   CourierObservabilitySink observabilitySink) {
        this.component = Objects.requireNonNull(component, "component");
        this.channel = Objects.requireNonNull(channel, "channel");
        this.wire = Objects.requireNonNull(wire, "wire");
        this.replyQueue = replyQueue; // may be null
        this.feedback = Objects.requireNonNull(feedback, "feedback");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
    }

    @Override
    public void execute(RequesterIntents intents) {
        Objects.requireNonNull(intents, "intents");

        for (RequesterIntent intent : intents.list()) {
            try {
                executeOne(intent);
            } catch (RuntimeException e) {
                observabilitySink.onError(new CourierErrorEvent(
                        clock.now(),
                        "[" + component + "] Failed to execute " + intent.getClass().getSimpleName(),
                        e));
            }
        }
    }

    private void executeOne(RequesterIntent intent) {
        if (intent instanceof RequesterIntent.OpenReplyQueue open) {
            openReplyQueue(open.attempt());
        } else if (intent instanceof RequesterIntent.Publish publish) {
            publish(publish);
        } else if (intent instanceof RequesterIntent.Acknowledge ack) {
            channel.ack(ack.deliveryTag());
        } else if (intent instanceof RequesterIntent.Resolve resolve) {
            resolve.handle().complete(resolve.outcome());
        } else if (intent instanceof RequesterIntent.Reject reject) {
            reject.handle().completeExceptionally(reject.error());
        } else if (intent instanceof RequesterIntent.Report report) {
            observabilitySink.onProtocolEvent(report.event());
        }
    }

    private void openReplyQueue(long attempt) {
        // Fresh name on every (re)connection when the static queue is randomized.
        QueueParameters queue = replyQueue != null ? replyQueue.resolve() : QueueParameters.privateReplyQueue();
        String address = channel.declareQueue(queue);
        channel.consume(address);
        feedback.accept(new RequesterTransportEvent.ReplyQueueBound(clock.now(), attempt, address));
    }

    private void publish(RequesterIntent.Publish publish) {
        for (PublishRequest message : publish.messages()) {
            Envelope envelope = message.envelope();
            OutboundProperties properties = new OutboundProperties(
                    wire.contentEncoding(envelope.properties()),
                    wire.contentType(envelope.properties()),
                    publish.correlationId(),
                    publish.replyTo(),
                    message.deliveryMode());
            try {
                channel.publish(message.exchange(), message.routingKey(),
                        message.mandatory(), message.immediate(), properties, envelope.body());
            } catch (RuntimeException e) {
                BrokerException failure = e instanceof BrokerException
                        ? (BrokerException) e
                        : new BrokerException("Publish to " + message.exchange() + " failed", e);
                publish.handle().completeExceptionally(failure);
                if (publish.correlationId() != null) {
                    feedback.accept(new RequesterBrokerEvent.PublishFailed(
                            clock.now(), publish.correlationId(), failure));
                }
                // Remaining messages of the request are not published.
                return;
            }
        }
    }
}
