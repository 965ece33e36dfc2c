package com.questrail.courier.transport.amqp;

import com.questrail.courier.codec.WireConvention;
import com.questrail.courier.internal.events.RequesterBrokerEvent;
import com.questrail.courier.internal.events.RequesterEvent;
import com.questrail.courier.internal.events.RequesterTransportEvent;
import com.questrail.courier.internal.time.ManualWallClock;
import com.questrail.courier.observability.CourierTransportEvent;
import com.questrail.courier.observability.RecordingObservabilitySink;
import com.questrail.courier.transport.InboundMessage;
import com.questrail.courier.transport.InboundReturn;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RequesterTransportAdapterTest {

    private final List<RequesterEvent> events = new ArrayList<>();
    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();

    @Test
    void lifecycleCallbacksBecomeTransportEvents() {
        RequesterTransportAdapter adapter = adapter(WireConvention.standard());

        adapter.onConnected();
        adapter.onDisconnected(new RuntimeException("connection reset"));

        assertInstanceOf(RequesterTransportEvent.TransportUp.class, events.get(0));
        assertInstanceOf(RequesterTransportEvent.TransportDown.class, events.get(1));
        assertEquals(2, sink.getAllEvents().stream().filter(e -> e instanceof CourierTransportEvent).count());
    }

    @Test
    void deliveryMetadataIsReadThroughTheWireConvention() {
        adapter(WireConvention.legacy()).onDelivery(
                new InboundMessage(3, "com.example.Reply", "json", "12", null, new byte[] {9}));

        RequesterBrokerEvent.DeliveryReceived received =
                assertInstanceOf(RequesterBrokerEvent.DeliveryReceived.class, events.get(0));
        assertEquals(3, received.delivery().deliveryTag());
        assertEquals("json", received.delivery().properties().serializerId());
        assertEquals("com.example.Reply", received.delivery().properties().typeName());
        assertEquals("12", received.delivery().correlationId());
    }

    @Test
    void returnKeepsCorrelationId() {
        adapter(WireConvention.standard()).onReturned(
                new InboundReturn(312, "NO_ROUTE", "requests", "nobody", "json", "java.lang.String", "5", new byte[0]));

        RequesterBrokerEvent.MessageReturned returned =
                assertInstanceOf(RequesterBrokerEvent.MessageReturned.class, events.get(0));
        assertEquals("5", returned.returned().correlationId());
        assertEquals(312, returned.returned().replyCode());
        assertEquals("json", returned.returned().properties().serializerId());
    }

    private RequesterTransportAdapter adapter(WireConvention wire) {
        return new RequesterTransportAdapter("adapter-test", events::add, wire, new ManualWallClock(), sink);
    }
}
