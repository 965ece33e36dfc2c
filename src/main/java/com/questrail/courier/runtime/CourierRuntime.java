package com.questrail.courier.runtime;

import com.questrail.courier.api.MessageProcessor;
import com.questrail.courier.client.RemoteProxy;
import com.questrail.courier.client.Requester;
import com.questrail.courier.codec.EnvelopeCodec;
import com.questrail.courier.codec.SerializerRegistry;
import com.questrail.courier.codec.WireConvention;
import com.questrail.courier.codec.impl.DefaultSerializerRegistry;
import com.questrail.courier.config.CourierConfig;
import com.questrail.courier.config.EndpointConfig;
import com.questrail.courier.config.QueueParameters;
import com.questrail.courier.internal.time.SystemWallClock;
import com.questrail.courier.internal.time.WallClock;
import com.questrail.courier.observability.CourierObservabilitySink;
import com.questrail.courier.observability.NullObservabilitySink;
import com.questrail.courier.server.HandlerProcessor;
import com.questrail.courier.server.RpcServerAdapter;
import com.questrail.courier.transport.BrokerChannel;
import com.questrail.courier.transport.amqp.rabbit.RabbitBrokerChannel;
import com.questrail.courier.transport.amqp.rabbit.RabbitConnectionOwner;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * CourierRuntime
 * =============================================================================
 * Composition root and lifecycle owner for requesters and server adapters
 * sharing one broker connection.
 *
 * <p>Every requester and server adapter gets its own {@link BrokerChannel} and
 * is started as soon as it is created. {@link #stop()} stops them in reverse
 * creation order, then closes the connection.</p>
 *
 * <pre>
 *   CourierRuntime runtime = CourierRuntime.builder()
 *       .withConfig(YamlCourierConfigLoader.load(path))
 *       .withObservabilitySink(new Slf4jCourierObservabilitySink())
 *       .build();
 *
 *   runtime.rpcServer("doubler", request -> CompletableFuture.completedFuture(2 * (Integer) request));
 *   RemoteProxy doubler = runtime.rpcClient("doubler");
 * </pre>
 */
public final class CourierRuntime {
    private final CourierConfig config;
    private final EnvelopeCodec codec;
    private final WireConvention wire;
    private final Supplier<BrokerChannel> channelFactory;
    private final RabbitConnectionOwner connectionOwner;
    private final ExecutorService processingExecutor;
    private final WallClock clock;
    private final CourierObservabilitySink observabilitySink;

    private final List<Runnable> stopActions = Collections.synchronizedList(new ArrayList<>());

    private CourierRuntime(CourierConfig config,
                           EnvelopeCodec codec,
                           Supplier<BrokerChannel> channelFactory,
                           RabbitConnectionOwner connectionOwner,
                           ExecutorService processingExecutor,
                           WallClock clock,
                           CourierObservabilitySink observabilitySink) {
        this.config = config;
        this.codec = codec;
        this.wire = WireConvention.of(config.codec().legacyEncodingSwap());
        this.channelFactory = channelFactory;
        this.connectionOwner = connectionOwner;
        this.processingExecutor = processingExecutor;
        this.clock = clock;
        this.observabilitySink = observabilitySink;
    }

    public CourierConfig config() {
        return config;
    }

    public EnvelopeCodec codec() {
        return codec;
    }

    public WireConvention wire() {
        return wire;
    }

    /**
     * A started requester replying to a broker-named private queue.
     */
    public Requester requester(String name) {
        return requester(name, null);
    }

    /**
     * A started requester.
     *
     * @param replyQueue static reply queue, or {@code null} for a private one
     */
    public Requester requester(String name, QueueParameters replyQueue) {
        Requester requester = Requester.create(name, channelFactory.get(), wire, replyQueue, observabilitySink, clock);
        requester.start();
        stopActions.add(requester::stop);
        return requester;
    }

    /**
     * Typed client for the named endpoint, backed by its own requester.
     */
    public RemoteProxy rpcClient(String name) {
        EndpointConfig endpoint = config.endpoint(name);
        return RemoteProxy.forEndpoint(requester(name), codec, endpoint);
    }

    /**
     * Serve the named endpoint with {@code processor}.
     */
    public RpcServerAdapter rpcServer(String name, MessageProcessor processor) {
        RpcServerAdapter server = new RpcServerAdapter(
                channelFactory.get(),
                config.endpoint(name),
                processor,
                wire,
                processingExecutor,
                clock,
                observabilitySink);
        server.start();
        stopActions.add(server::stop);
        return server;
    }

    /**
     * Serve the named endpoint with a message handler; see {@link HandlerProcessor}.
     */
    public RpcServerAdapter rpcServer(String name, Function<Object, ? extends CompletionStage<?>> handler) {
        return rpcServer(name, new HandlerProcessor(handler, codec));
    }

    public void stop() {
        List<Runnable> actions;
        synchronized (stopActions) {
            actions = new ArrayList<>(stopActions);
            stopActions.clear();
        }
        Collections.reverse(actions);
        for (Runnable action : actions) {
            action.run();
        }

        processingExecutor.shutdown();
        try {
            if (!processingExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                processingExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            processingExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }

        if (connectionOwner != null) {
            connectionOwner.close();
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private CourierConfig config = CourierConfig.builder().build();
        private CourierObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private SerializerRegistry serializerRegistry;
        private Supplier<BrokerChannel> channelFactory;
        private WallClock clock = SystemWallClock.INSTANCE;
        private String connectionName = "courier";

        public Builder withConfig(CourierConfig config) {
            this.config = config;
            return this;
        }

        public Builder withObservabilitySink(CourierObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        /**
         * Replaces the standard {@code json} / {@code gzip-json} registry.
         */
        public Builder withSerializerRegistry(SerializerRegistry registry) {
            this.serializerRegistry = registry;
            return this;
        }

        /**
         * Channels are opened on a RabbitMQ connection built from the broker
         * config unless a factory is supplied.
         */
        public Builder withChannelFactory(Supplier<BrokerChannel> factory) {
            this.channelFactory = factory;
            return this;
        }

        public Builder withClock(WallClock clock) {
            this.clock = clock;
            return this;
        }

        public Builder withConnectionName(String name) {
            this.connectionName = name;
            return this;
        }

        public CourierRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(clock, "clock");
            CourierObservabilitySink sink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);

            // 1. Codec
            SerializerRegistry registry = serializerRegistry != null
                    ? serializerRegistry
                    : DefaultSerializerRegistry.standardBuilder(config.codec().allowedPackagePrefixes())
                            .withDefault(config.codec().defaultSerializer())
                            .build();
            EnvelopeCodec codec = new EnvelopeCodec(registry);

            // 2. Transport
            RabbitConnectionOwner owner = null;
            Supplier<BrokerChannel> channels = channelFactory;
            if (channels == null) {
                RabbitConnectionOwner rabbit = new RabbitConnectionOwner(config.broker(), connectionName);
                owner = rabbit;
                channels = () -> new RabbitBrokerChannel(rabbit);
            }

            // 3. Processing pool for server adapters
            AtomicInteger threads = new AtomicInteger();
            ExecutorService processing = Executors.newCachedThreadPool(r -> {
                Thread t = new Thread(r, "courier-processing-" + threads.incrementAndGet());
                t.setDaemon(true);
                return t;
            });

            return new CourierRuntime(config, codec, channels, owner, processing, clock, sink);
        }
    }
}
