/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.bus6.messaging.config;

import com.bus6.common.config.Bus6Properties;

/**
 * Broker endpoint and credentials. Immutable.
 */
public final class RabbitMQConfiguration {

    private final String host;
    private final int port;
    private final String username;
    private final String password;
    private final String virtualHost;

    private RabbitMQConfiguration(Builder b) {
        this.host = b.host;
        this.port = b.port;
        this.username = b.username;
        this.password = b.password;
        this.virtualHost = b.virtualHost;
    }

    public static Builder builder() { return new Builder(); }

    public static RabbitMQConfiguration defaults() { return builder().build(); }

    /**
     * Reads {@code bus6.rabbitmq.host|port|username|password|virtual-host}.
     */
    public static RabbitMQConfiguration fromProperties(Bus6Properties props) {
        return builder()
                .host(props.getString("bus6.rabbitmq.host", "localhost"))
                .port(props.getInt("bus6.rabbitmq.port", 5672))
                .username(props.getString("bus6.rabbitmq.username", "guest"))
                .password(props.getString("bus6.rabbitmq.password", "guest"))
                .virtualHost(props.getString("bus6.rabbitmq.virtual-host", "/"))
                .build();
    }

    public String getHost() { return host; }
    public int getPort() { return port; }
    public String getUsername() { return username; }
    public String getPassword() { return password; }
    public String getVirtualHost() { return virtualHost; }

    @Override
    public String toString() {
        return "RabbitMQConfiguration{" + username + "@" + host + ":" + port + virtualHost + "}";
    }

    public static final class Builder {
        private String host = "localhost";
        private int port = 5672;
        private String username = "guest";
        private String password = "guest";
        private String virtualHost = "/";

        private Builder() {}

        public Builder host(String host) { this.host = host; return this; }
        public Builder port(int port) { this.port = port; return this; }
        public Builder username(String username) { this.username = username; return this; }
        public Builder password(String password) { this.password = password; return this; }
        public Builder virtualHost(String virtualHost) { this.virtualHost = virtualHost; return this; }

        public RabbitMQConfiguration build() {
            if (host == null || host.isBlank()) throw new IllegalArgumentException("host must not be blank");
            if (port <= 0 || port > 65535) throw new IllegalArgumentException("port out of range: " + port);
            if (virtualHost == null || virtualHost.isEmpty()) virtualHost = "/";
            return new RabbitMQConfiguration(this);
        }
    }
}
