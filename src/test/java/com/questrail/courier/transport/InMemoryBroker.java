package com.questrail.courier.transport;

import com.questrail.courier.api.BrokerException;
import com.questrail.courier.config.ChannelParameters;
import com.questrail.courier.config.ExchangeParameters;
import com.questrail.courier.config.QueueParameters;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * InMemoryBroker
 * -----------------------------------------------------------------------------
 * Test-only broker with just enough AMQP 0-9-1 routing for end-to-end tests.
 *
 * <ul>
 *   <li>the default exchange routes to the queue named by the routing key</li>
 *   <li>{@code fanout} exchanges route to every bound queue</li>
 *   <li>any other exchange type routes on exact routing key match</li>
 *   <li>unroutable mandatory messages are returned to the publishing channel</li>
 *   <li>exclusive and autodelete queues disappear with their channel</li>
 * </ul>
 *
 * <p>Deliveries, returns and outage notifications are dispatched on one broker
 * thread, so listeners always run asynchronously with respect to the
 * publisher, as they do against a real broker.</p>
 */
public final class InMemoryBroker implements AutoCloseable {

    public static final int NO_ROUTE = 312;

    private final Object lock = new Object();
    private final Map<String, String> exchanges = new HashMap<>();
    private final Map<String, Queue> queues = new HashMap<>();
    private final List<Binding> bindings = new ArrayList<>();
    private final List<Channel> channels = new ArrayList<>();
    private final AtomicLong generatedNames = new AtomicLong();
    private final ExecutorService dispatcher = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "in-memory-broker");
        t.setDaemon(true);
        return t;
    });

    private record Binding(String exchange, String queue, String routingKey) {}

    private record Message(String exchange,
                           String routingKey,
                           OutboundProperties properties,
                           byte[] body) {}

    private static final class Queue {
        final String name;
        final boolean exclusive;
        final boolean autodelete;
        final Channel declaredBy;
        final Deque<Message> backlog = new ArrayDeque<>();
        Channel consumer;

        Queue(String name, boolean exclusive, boolean autodelete, Channel declaredBy) {
            this.name = name;
            this.exclusive = exclusive;
            this.autodelete = autodelete;
            this.declaredBy = declaredBy;
        }
    }

    public InMemoryBroker() {
        exchanges.put(ExchangeParameters.DEFAULT_EXCHANGE, "direct");
        exchanges.put("amq.direct", "direct");
        exchanges.put("amq.fanout", "fanout");
    }

    public BrokerChannel newChannel() {
        Channel channel = new Channel();
        synchronized (lock) {
            channels.add(channel);
        }
        return channel;
    }

    /**
     * Every open channel loses its connection, as on a network outage.
     */
    public void disconnectAll(Throwable cause) {
        List<Channel> affected = new ArrayList<>();
        synchronized (lock) {
            for (Channel channel : channels) {
                if (channel.open && channel.connected) {
                    channel.connected = false;
                    release(channel);
                    affected.add(channel);
                }
            }
        }
        for (Channel channel : affected) {
            dispatch(() -> channel.listener.onDisconnected(cause));
        }
    }

    /**
     * Every channel lost by {@link #disconnectAll(Throwable)} recovers.
     */
    public void reconnectAll() {
        List<Channel> affected = new ArrayList<>();
        synchronized (lock) {
            for (Channel channel : channels) {
                if (channel.open && !channel.connected) {
                    channel.connected = true;
                    affected.add(channel);
                }
            }
        }
        for (Channel channel : affected) {
            dispatch(() -> channel.listener.onConnected());
        }
    }

    public boolean queueExists(String name) {
        synchronized (lock) {
            return queues.containsKey(name);
        }
    }

    public Set<String> queueNames() {
        synchronized (lock) {
            return new LinkedHashSet<>(queues.keySet());
        }
    }

    /**
     * Blocks until everything dispatched so far has been handed to listeners.
     */
    public void awaitDispatched() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);
        dispatcher.execute(latch::countDown);
        if (!latch.await(5, TimeUnit.SECONDS)) {
            throw new IllegalStateException("broker dispatcher is stuck");
        }
    }

    @Override
    public void close() {
        dispatcher.shutdownNow();
    }

    // -------------------------------------------------------------------------
    // Routing (callers hold the lock)
    // -------------------------------------------------------------------------

    private void route(Channel from, Message message, boolean mandatory) {
        String type = exchanges.get(message.exchange());
        if (type == null) {
            throw new BrokerException("NOT_FOUND - no exchange '" + message.exchange() + "'", null);
        }

        List<Queue> targets = new ArrayList<>();
        if (ExchangeParameters.DEFAULT_EXCHANGE.equals(message.exchange())) {
            Queue q = queues.get(message.routingKey());
            if (q != null) {
                targets.add(q);
            }
        } else {
            for (Binding binding : bindings) {
                if (!binding.exchange().equals(message.exchange())) {
                    continue;
                }
                if ("fanout".equals(type) || binding.routingKey().equals(message.routingKey())) {
                    Queue q = queues.get(binding.queue());
                    if (q != null && !targets.contains(q)) {
                        targets.add(q);
                    }
                }
            }
        }

        if (targets.isEmpty()) {
            if (mandatory) {
                InboundReturn returned = new InboundReturn(NO_ROUTE, "NO_ROUTE",
                        message.exchange(), message.routingKey(),
                        message.properties().contentEncoding(),
                        message.properties().contentType(),
                        message.properties().correlationId(),
                        message.body());
                dispatch(() -> from.listener.onReturned(returned));
            }
            return;
        }

        for (Queue q : targets) {
            q.backlog.add(message);
            drain(q);
        }
    }

    private void drain(Queue q) {
        Channel consumer = q.consumer;
        if (consumer == null || !consumer.connected) {
            return;
        }
        while (!q.backlog.isEmpty()) {
            Message m = q.backlog.poll();
            InboundMessage delivery = new InboundMessage(
                    consumer.nextTag++,
                    m.properties().contentEncoding(),
                    m.properties().contentType(),
                    m.properties().correlationId(),
                    m.properties().replyTo(),
                    m.body());
            dispatch(() -> consumer.listener.onDelivery(delivery));
        }
    }

    private void release(Channel channel) {
        Iterator<Queue> it = queues.values().iterator();
        while (it.hasNext()) {
            Queue q = it.next();
            boolean owned = q.exclusive && q.declaredBy == channel;
            boolean consumedHere = q.consumer == channel;
            if (consumedHere) {
                q.consumer = null;
            }
            if (owned || (consumedHere && q.autodelete)) {
                it.remove();
                bindings.removeIf(b -> b.queue().equals(q.name));
            }
        }
        channel.nextTag = 1;
    }

    private void dispatch(Runnable task) {
        dispatcher.execute(task);
    }

    // -------------------------------------------------------------------------
    // Channel
    // -------------------------------------------------------------------------

    private final class Channel implements BrokerChannel {
        private volatile BrokerChannelListener listener;
        private boolean open;
        private boolean connected;
        private long nextTag = 1;

        @Override
        public void setListener(BrokerChannelListener listener) {
            this.listener = Objects.requireNonNull(listener, "listener");
        }

        @Override
        public void start() {
            synchronized (lock) {
                open = true;
                connected = true;
            }
            listener.onConnected();
        }

        @Override
        public void stop() {
            boolean wasConnected;
            synchronized (lock) {
                wasConnected = open && connected;
                open = false;
                connected = false;
                release(this);
            }
            if (wasConnected) {
                listener.onDisconnected(null);
            }
        }

        @Override
        public void publish(String exchange,
                            String routingKey,
                            boolean mandatory,
                            boolean immediate,
                            OutboundProperties properties,
                            byte[] body) {
            synchronized (lock) {
                requireConnected();
                route(this, new Message(exchange, routingKey, properties, body.clone()), mandatory);
            }
        }

        @Override
        public String declareQueue(QueueParameters queue) {
            synchronized (lock) {
                requireConnected();
                if (queue.passive()) {
                    if (!queues.containsKey(queue.name())) {
                        throw new BrokerException("NOT_FOUND - no queue '" + queue.name() + "'", null);
                    }
                    return queue.name();
                }
                String name = queue.name().isEmpty()
                        ? "amq.gen-" + generatedNames.incrementAndGet()
                        : queue.name();
                queues.putIfAbsent(name, new Queue(name, queue.exclusive(), queue.autodelete(), this));
                return name;
            }
        }

        @Override
        public void declareExchange(ExchangeParameters exchange) {
            if (exchange.isDefaultExchange()) {
                return;
            }
            synchronized (lock) {
                requireConnected();
                if (exchange.passive()) {
                    if (!exchanges.containsKey(exchange.name())) {
                        throw new BrokerException("NOT_FOUND - no exchange '" + exchange.name() + "'", null);
                    }
                    return;
                }
                exchanges.putIfAbsent(exchange.name(), exchange.type());
            }
        }

        @Override
        public void bind(String exchange, String queue, String routingKey) {
            synchronized (lock) {
                requireConnected();
                if (!exchanges.containsKey(exchange) || !queues.containsKey(queue)) {
                    throw new BrokerException("NOT_FOUND - cannot bind '" + queue + "' to '" + exchange + "'", null);
                }
                bindings.add(new Binding(exchange, queue, routingKey));
            }
        }

        @Override
        public void consume(String queue) {
            synchronized (lock) {
                requireConnected();
                Queue q = queues.get(queue);
                if (q == null) {
                    throw new BrokerException("NOT_FOUND - no queue '" + queue + "'", null);
                }
                q.consumer = this;
                drain(q);
            }
        }

        @Override
        public void ack(long deliveryTag) {
            synchronized (lock) {
                requireConnected();
            }
        }

        @Override
        public void qos(ChannelParameters channel) {
            synchronized (lock) {
                requireConnected();
            }
        }

        private void requireConnected() {
            if (!open || !connected) {
                throw new BrokerException("channel is closed", null);
            }
        }
    }
}
