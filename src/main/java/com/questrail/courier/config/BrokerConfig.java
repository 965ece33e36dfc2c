package com.questrail.courier.config;

import java.util.Objects;

/**
 * Broker connection settings.
 */
public record BrokerConfig(
    String host,
    int port,
    String username,
    String password,
    String virtualHost
) {
    public static final int DEFAULT_PORT = 5672;

    public BrokerConfig {
        Objects.requireNonNull(host, "host");
        Objects.requireNonNull(username, "username");
        Objects.requireNonNull(password, "password");
        Objects.requireNonNull(virtualHost, "virtualHost");
        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException("port must be 1-65535, was " + port);
        }
    }

    public static BrokerConfig localhost() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String host = "localhost";
        private int port = DEFAULT_PORT;
        private String username = "guest";
        private String password = "guest";
        private String virtualHost = "/";

        public Builder withHost(String host) {
            this.host = host;
            return this;
        }

        public Builder withPort(int port) {
            this.port = port;
            return this;
        }

        public Builder withUsername(String username) {
            this.username = username;
            return this;
        }

        public Builder withPassword(String password) {
            this.password = password;
            return this;
        }

        public Builder withVirtualHost(String virtualHost) {
            this.virtualHost = virtualHost;
            return this;
        }

        public BrokerConfig build() {
            return new BrokerConfig(host, port, username, password, virtualHost);
        }
    }
}
