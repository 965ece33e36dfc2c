package com.questrail.courier.config;

import java.util.Objects;

/**
 * Topology of one logical endpoint: where requests are published and which
 * queue a server consumes them from.
 *
 * <p>Unset values follow these defaults: exchange named after the endpoint,
 * durable fanout; queue named after the endpoint, randomized, durable,
 * autodelete; prefetch 1, per consumer.</p>
 */
public record EndpointConfig(
    String name,
    ExchangeParameters exchange,
    QueueParameters queue,
    ChannelParameters channel
) {
    public EndpointConfig {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(exchange, "exchange");
        Objects.requireNonNull(queue, "queue");
        Objects.requireNonNull(channel, "channel");
    }

    public static EndpointConfig defaults(String name) {
        return new EndpointConfig(
                name,
                ExchangeParameters.fanout(name),
                QueueParameters.randomized(name),
                ChannelParameters.defaults());
    }

    /**
     * Requests are published with the endpoint name as routing key.
     */
    public String routingKey() {
        return name;
    }

    public EndpointConfig withExchange(ExchangeParameters exchange) {
        return new EndpointConfig(name, exchange, queue, channel);
    }

    public EndpointConfig withQueue(QueueParameters queue) {
        return new EndpointConfig(name, exchange, queue, channel);
    }

    public EndpointConfig withChannel(ChannelParameters channel) {
        return new EndpointConfig(name, exchange, queue, channel);
    }
}
