package com.questrail.courier.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Aggregated configuration for a {@code CourierRuntime}.
 */
public record CourierConfig(
    BrokerConfig broker,
    CodecConfig codec,
    Map<String, EndpointConfig> endpoints
) {
    public CourierConfig {
        Objects.requireNonNull(broker, "broker");
        Objects.requireNonNull(codec, "codec");
        endpoints = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(endpoints, "endpoints")));
    }

    /**
     * The configured endpoint, or {@link EndpointConfig#defaults(String)} when the
     * name has no entry.
     */
    public EndpointConfig endpoint(String name) {
        Objects.requireNonNull(name, "name");
        EndpointConfig configured = endpoints.get(name);
        return configured != null ? configured : EndpointConfig.defaults(name);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private BrokerConfig broker = BrokerConfig.localhost();
        private CodecConfig codec = CodecConfig.defaults();
        private final Map<String, EndpointConfig> endpoints = new LinkedHashMap<>();

        public Builder withBroker(BrokerConfig broker) {
            this.broker = broker;
            return this;
        }

        public Builder withCodec(CodecConfig codec) {
            this.codec = codec;
            return this;
        }

        public Builder addEndpoint(EndpointConfig endpoint) {
            Objects.requireNonNull(endpoint, "endpoint");
            endpoints.put(endpoint.name(), endpoint);
            return this;
        }

        public CourierConfig build() {
            return new CourierConfig(broker, codec, endpoints);
        }
    }
}
