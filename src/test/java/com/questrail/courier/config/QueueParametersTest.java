package com.questrail.courier.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class QueueParametersTest {

    @Test
    void randomizedNameGetsFreshSuffixOnEveryResolve() {
        QueueParameters queue = QueueParameters.randomized("calculator");

        QueueParameters first = queue.resolve();
        QueueParameters second = queue.resolve();

        assertTrue(first.name().startsWith("calculator-"));
        assertNotEquals(first.name(), second.name());
        assertFalse(first.randomize());
        assertEquals(queue.durable(), first.durable());
        assertEquals(queue.autodelete(), first.autodelete());
    }

    @Test
    void fixedNameResolvesToItself() {
        QueueParameters queue = QueueParameters.named("calculator");

        assertSame(queue, queue.resolve());
    }

    @Test
    void privateReplyQueueIsBrokerNamedAndExclusive() {
        QueueParameters queue = QueueParameters.privateReplyQueue();

        assertEquals("", queue.resolve().name());
        assertTrue(queue.exclusive());
        assertFalse(queue.durable());
    }

    @Test
    void endpointDefaults() {
        EndpointConfig endpoint = EndpointConfig.defaults("calculator");

        assertEquals("calculator", endpoint.routingKey());
        assertEquals(ExchangeParameters.fanout("calculator"), endpoint.exchange());
        assertTrue(endpoint.queue().randomize());
        assertEquals(ChannelParameters.defaults(), endpoint.channel());
    }

    @Test
    void negativePrefetchIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new ChannelParameters(-1, false));
    }
}
