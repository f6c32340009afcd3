/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.bus6.messaging.config;

import com.bus6.common.config.Bus6Properties;

import java.time.Duration;

/**
 * Connection management policy. Read-only once the connection manager is built.
 *
 * <p>Defaults: 10 minute lifetime, health check every 60s (disabled),
 * separate publish/consume connections, 60s heartbeat, 5s network recovery,
 * 30s connection timeout.</p>
 */
public final class ConnectionSettings {

    private final Duration connectionLifetime;
    private final Duration healthCheckInterval;
    private final boolean healthCheckEnabled;
    private final boolean separateConnections;
    private final Duration heartbeatInterval;
    private final Duration networkRecoveryInterval;
    private final Duration connectionTimeout;

    private ConnectionSettings(Builder b) {
        this.connectionLifetime = b.connectionLifetime;
        this.healthCheckInterval = b.healthCheckInterval;
        this.healthCheckEnabled = b.healthCheckEnabled;
        this.separateConnections = b.separateConnections;
        this.heartbeatInterval = b.heartbeatInterval;
        this.networkRecoveryInterval = b.networkRecoveryInterval;
        this.connectionTimeout = b.connectionTimeout;
    }

    public static Builder builder() { return new Builder(); }

    public static ConnectionSettings defaults() { return builder().build(); }

    public static ConnectionSettings fromProperties(Bus6Properties props) {
        ConnectionSettings d = defaults();
        return builder()
                .connectionLifetime(props.getDuration("bus6.connection.lifetime", d.connectionLifetime))
                .healthCheckInterval(props.getDuration("bus6.connection.health-check-interval", d.healthCheckInterval))
                .healthCheckEnabled(props.getBoolean("bus6.connection.health-check-enabled", d.healthCheckEnabled))
                .separateConnections(props.getBoolean("bus6.connection.separate-connections", d.separateConnections))
                .heartbeatInterval(props.getDuration("bus6.connection.heartbeat", d.heartbeatInterval))
                .networkRecoveryInterval(props.getDuration("bus6.connection.network-recovery-interval",
                        d.networkRecoveryInterval))
                .connectionTimeout(props.getDuration("bus6.connection.connection-timeout", d.connectionTimeout))
                .build();
    }

    public Duration getConnectionLifetime() { return connectionLifetime; }
    public Duration getHealthCheckInterval() { return healthCheckInterval; }
    public boolean isHealthCheckEnabled() { return healthCheckEnabled; }
    public boolean isSeparateConnections() { return separateConnections; }
    public Duration getHeartbeatInterval() { return heartbeatInterval; }
    public Duration getNetworkRecoveryInterval() { return networkRecoveryInterval; }
    public Duration getConnectionTimeout() { return connectionTimeout; }

    public static final class Builder {
        private Duration connectionLifetime = Duration.ofMinutes(10);
        private Duration healthCheckInterval = Duration.ofSeconds(60);
        private boolean healthCheckEnabled = false;
        private boolean separateConnections = true;
        private Duration heartbeatInterval = Duration.ofSeconds(60);
        private Duration networkRecoveryInterval = Duration.ofSeconds(5);
        private Duration connectionTimeout = Duration.ofSeconds(30);

        private Builder() {}

        public Builder connectionLifetime(Duration d) { this.connectionLifetime = d; return this; }
        public Builder healthCheckInterval(Duration d) { this.healthCheckInterval = d; return this; }
        public Builder healthCheckEnabled(boolean enabled) { this.healthCheckEnabled = enabled; return this; }
        public Builder separateConnections(boolean separate) { this.separateConnections = separate; return this; }
        public Builder heartbeatInterval(Duration d) { this.heartbeatInterval = d; return this; }
        public Builder networkRecoveryInterval(Duration d) { this.networkRecoveryInterval = d; return this; }
        public Builder connectionTimeout(Duration d) { this.connectionTimeout = d; return this; }

        public ConnectionSettings build() {
            requirePositive(connectionLifetime, "connectionLifetime");
            requirePositive(healthCheckInterval, "healthCheckInterval");
            requirePositive(networkRecoveryInterval, "networkRecoveryInterval");
            requirePositive(connectionTimeout, "connectionTimeout");
            // zero heartbeat disables heartbeats on the broker side
            if (heartbeatInterval == null || heartbeatInterval.isNegative()) {
                throw new IllegalArgumentException("heartbeatInterval must be zero or positive");
            }
            return new ConnectionSettings(this);
        }

        private static void requirePositive(Duration d, String name) {
            if (d == null || d.isZero() || d.isNegative()) {
                throw new IllegalArgumentException(name + " must be positive");
            }
        }
    }
}
