package com.questrail.courier.config;

import java.util.Objects;

/**
 * Exchange declaration settings.
 *
 * <p>The default exchange ({@code ""}) always exists and is never declared.</p>
 */
public record ExchangeParameters(
    String name,
    String type,
    boolean durable,
    boolean autodelete,
    boolean passive
) {
    public static final String DEFAULT_EXCHANGE = "";

    public ExchangeParameters {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
    }

    /**
     * Durable, non-autodelete fanout exchange, declared actively.
     */
    public static ExchangeParameters fanout(String name) {
        return new ExchangeParameters(name, "fanout", true, false, false);
    }

    /**
     * Reference to a pre-existing exchange such as {@code amq.direct}.
     */
    public static ExchangeParameters existing(String name) {
        return new ExchangeParameters(name, "", false, false, true);
    }

    public boolean isDefaultExchange() {
        return DEFAULT_EXCHANGE.equals(name);
    }
}
