package com.questrail.courier.transport.amqp;

import com.questrail.courier.api.Delivery;
import com.questrail.courier.api.ReturnedMessage;
import com.questrail.courier.codec.WireConvention;
import com.questrail.courier.internal.events.RequesterBrokerEvent;
import com.questrail.courier.internal.events.RequesterEvent;
import com.questrail.courier.internal.events.RequesterTransportEvent;
import com.questrail.courier.internal.time.WallClock;
import com.questrail.courier.observability.CourierObservabilitySink;
import com.questrail.courier.observability.CourierTransportEvent;
import com.questrail.courier.observability.NullObservabilitySink;
import com.questrail.courier.transport.BrokerChannelListener;
import com.questrail.courier.transport.InboundMessage;
import com.questrail.courier.transport.InboundReturn;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * RequesterTransportAdapter
 * =============================================================================
 * Translates {@link BrokerChannelListener} callbacks into {@link RequesterEvent}s
 * for the requester's owner loop.
 *
 * <h2>Inbound path</h2>
 *
 * <pre>
 *   BrokerChannel
 *        → InboundMessage / InboundReturn
 *            → WireConvention (content-encoding / content-type → MessageProperties)
 *                → RequesterBrokerEvent
 *                    → RequesterOperationalDriver
 * </pre>
 *
 * Bodies are not decoded here. Correlation works on the correlation id alone;
 * decoding is left to whoever receives the {@code RpcOutcome}.
 *
 * <p>This class MUST NOT correlate, acknowledge or retry anything. It runs on
 * transport threads and only enqueues.</p>
 */
public final class RequesterTransportAdapter implements BrokerChannelListener
{
    private final String component;
    private final Consumer<RequesterEvent> events;
    private final WireConvention wire;
    private final WallClock clock;
    private final CourierObservabilitySink observabilitySink;

    public RequesterTransportAdapter(String component,
                                     Consumer<RequesterEvent> events,
                                     WireConvention wire,
                                     WallClock clock,
                                     CourierObservabilitySink observabilitySink) {
        this.component = Objects.requireNonNull(component, "component");
        this.events = Objects.requireNonNull(events, "events");
        this.wire = Objects.requireNonNull(wire, "wire");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
    }

    @Override
    public void onConnected() {
        observabilitySink.onTransportEvent(new CourierTransportEvent(clock.now(), component, true, null));
        events.accept(new RequesterTransportEvent.TransportUp(clock.now()));
    }

    @Override
    public void onDisconnected(Throwable cause) {
        observabilitySink.onTransportEvent(new CourierTransportEvent(clock.now(), component, false, cause));
        events.accept(new RequesterTransportEvent.TransportDown(clock.now()));
    }

    @Override
    public void onDelivery(InboundMessage message) {
        Objects.requireNonNull(message, "message");

        Delivery delivery = new Delivery(
                message.deliveryTag(),
                wire.fromWire(message.contentEncoding(), message.contentType()),
                message.body(),
                message.replyTo(),
                message.correlationId());

        events.accept(new RequesterBrokerEvent.DeliveryReceived(clock.now(), delivery));
    }

    @Override
    public void onReturned(InboundReturn returned) {
        Objects.requireNonNull(returned, "returned");

        ReturnedMessage message = new ReturnedMessage(
                returned.replyCode(),
                returned.replyText(),
                returned.exchange(),
                returned.routingKey(),
                wire.fromWire(returned.contentEncoding(), returned.contentType()),
                returned.correlationId(),
                returned.body());

        events.accept(new RequesterBrokerEvent.MessageReturned(clock.now(), message));
    }
}
