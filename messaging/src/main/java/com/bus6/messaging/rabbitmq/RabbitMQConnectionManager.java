/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.bus6.messaging.rabbitmq;

import com.bus6.common.exception.BrokerConnectionException;
import com.bus6.messaging.config.ConnectionSettings;
import com.bus6.messaging.config.RabbitMQConfiguration;
import com.bus6.messaging.core.ConnectionManager;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.ConnectException;
import java.net.InetAddress;
import java.net.NoRouteToHostException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Connection manager without pooling: one long-lived connection for publishing
 * and one for consuming, or a single shared one.
 *
 * <p>A connection is handed out while it is open and younger than the
 * configured lifetime. Anything else is disposed and replaced lazily on the
 * next acquisition. When the health check is enabled, a daemon scheduler
 * clears closed connections so the following acquisition reconnects; it never
 * opens connections itself.</p>
 *
 * <p>Concurrent acquisitions may race to replace the same connection. The
 * loser disposes its own connection and returns the winner's.</p>
 */
public class RabbitMQConnectionManager implements ConnectionManager {

    private static final Logger log = LoggerFactory.getLogger(RabbitMQConnectionManager.class);

    private final RabbitMQConfiguration config;
    private final ConnectionSettings settings;
    private final ConnectionFactory factory;
    private final Clock clock;
    private final String clientHost;
    private final ConnectionSlot publishSlot;
    private final ConnectionSlot consumeSlot;
    private final AtomicBoolean closed = new AtomicBoolean();
    private final ScheduledExecutorService healthCheckExecutor;

    public RabbitMQConnectionManager(RabbitMQConfiguration config, ConnectionSettings settings) {
        this(config, settings, new ConnectionFactory(), Clock.systemUTC());
    }

    RabbitMQConnectionManager(RabbitMQConfiguration config, ConnectionSettings settings,
                              ConnectionFactory factory, Clock clock) {
        if (config == null) throw new IllegalArgumentException("config must not be null");
        if (settings == null) throw new IllegalArgumentException("settings must not be null");
        this.config = config;
        this.settings = settings;
        this.factory = configure(factory, config, settings);
        this.clock = clock;
        this.clientHost = resolveClientHost();

        if (settings.isSeparateConnections()) {
            this.publishSlot = new ConnectionSlot(ConnectionPurpose.PUBLISH);
            this.consumeSlot = new ConnectionSlot(ConnectionPurpose.CONSUME);
        } else {
            this.publishSlot = new ConnectionSlot(ConnectionPurpose.SHARED);
            this.consumeSlot = publishSlot;
        }

        this.healthCheckExecutor = settings.isHealthCheckEnabled() ? startHealthCheck() : null;
    }

    @Override
    public Connection acquirePublishConnection() {
        return acquire(publishSlot);
    }

    @Override
    public Connection acquireConsumeConnection() {
        return acquire(consumeSlot);
    }

    @Override
    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Clear every slot whose connection has closed. Called periodically when
     * the health check is enabled.
     */
    public void checkConnectionHealth() {
        if (closed.get()) return;
        try {
            for (ConnectionSlot slot : slots()) {
                ConnectionSlot.Lease lease = slot.current();
                if (lease != null && !lease.connection().isOpen()) {
                    log.warn("Detected closed {} connection, clearing it", slot.purpose().tag());
                    if (slot.clear(lease)) {
                        dispose(lease, slot, "dead");
                    }
                }
            }
        } catch (RuntimeException e) {
            log.error("Connection health check failed", e);
        }
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;
        if (healthCheckExecutor != null) healthCheckExecutor.shutdownNow();
        for (ConnectionSlot slot : slots()) {
            ConnectionSlot.Lease lease = slot.clearAll();
            if (lease != null) dispose(lease, slot, "shutdown");
        }
        log.info("RabbitMQ connection manager closed");
    }

    private Connection acquire(ConnectionSlot slot) {
        while (true) {
            ensureOpen();
            ConnectionSlot.Lease current = slot.current();
            if (isValid(current)) {
                return current.connection();
            }
            if (current != null) {
                if (slot.clear(current)) {
                    dispose(current, slot, "stale");
                }
                continue;
            }

            Connection created = createConnection(slot.purpose());
            ConnectionSlot.Lease fresh = new ConnectionSlot.Lease(created, clock.instant());
            if (!slot.install(fresh)) {
                log.debug("Another caller replaced the {} connection first, discarding ours", slot.purpose().tag());
                dispose(fresh, slot, "redundant");
                continue;
            }
            if (closed.get()) {
                // close() ran while we were connecting
                if (slot.clear(fresh)) dispose(fresh, slot, "shutdown");
                throw BrokerConnectionException.disposed("RabbitMQConnectionManager");
            }
            return created;
        }
    }

    private boolean isValid(ConnectionSlot.Lease lease) {
        if (lease == null || !lease.connection().isOpen()) {
            return false;
        }
        Duration age = Duration.between(lease.createdAt(), clock.instant());
        if (age.compareTo(settings.getConnectionLifetime()) >= 0) {
            log.debug("Connection exceeded its lifetime: {} >= {}", age, settings.getConnectionLifetime());
            return false;
        }
        return true;
    }

    private Connection createConnection(ConnectionPurpose purpose) {
        String clientName = "Bus6-" + purpose.tag() + "-" + clientHost;
        try {
            Connection connection = factory.newConnection(clientName);
            log.info("Created {} connection to RabbitMQ {}:{}{}",
                    purpose.tag(), config.getHost(), config.getPort(), config.getVirtualHost());
            return connection;
        } catch (ConnectException | NoRouteToHostException | UnknownHostException
                 | SocketTimeoutException | TimeoutException e) {
            log.error("RabbitMQ unreachable for {} connection. Host: {}, Port: {}",
                    purpose.tag(), config.getHost(), config.getPort(), e);
            throw new BrokerConnectionException(BrokerConnectionException.Reason.UNREACHABLE,
                    "Could not reach RabbitMQ at " + config.getHost() + ":" + config.getPort()
                            + " for " + purpose.tag(), e);
        } catch (Exception e) {
            log.error("Failed to create {} connection to RabbitMQ", purpose.tag(), e);
            throw new BrokerConnectionException(BrokerConnectionException.Reason.OTHER,
                    "Could not create " + purpose.tag() + " connection to RabbitMQ", e);
        }
    }

    private void dispose(ConnectionSlot.Lease lease, ConnectionSlot slot, String reason) {
        Connection connection = lease.connection();
        try {
            if (connection.isOpen()) {
                connection.close();
            } else {
                connection.abort();
            }
            log.info("Closed {} {} connection", reason, slot.purpose().tag());
        } catch (Exception e) {
            log.warn("Error closing {} {} connection", reason, slot.purpose().tag(), e);
        }
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw BrokerConnectionException.disposed("RabbitMQConnectionManager");
        }
    }

    private List<ConnectionSlot> slots() {
        return publishSlot == consumeSlot ? List.of(publishSlot) : List.of(publishSlot, consumeSlot);
    }

    private ScheduledExecutorService startHealthCheck() {
        long intervalMs = settings.getHealthCheckInterval().toMillis();
        ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "bus6-connection-health");
            t.setDaemon(true);
            return t;
        });
        executor.scheduleAtFixedRate(this::checkConnectionHealth, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("Connection health check enabled every {}ms", intervalMs);
        return executor;
    }

    private static ConnectionFactory configure(ConnectionFactory factory, RabbitMQConfiguration config,
                                               ConnectionSettings settings) {
        factory.setHost(config.getHost());
        factory.setPort(config.getPort());
        factory.setVirtualHost(config.getVirtualHost());
        factory.setUsername(config.getUsername());
        factory.setPassword(config.getPassword());
        factory.setConnectionTimeout((int) settings.getConnectionTimeout().toMillis());
        factory.setRequestedHeartbeat((int) settings.getHeartbeatInterval().toSeconds());
        // Connection recovery: automatic reconnection on network failure
        factory.setAutomaticRecoveryEnabled(true);
        factory.setNetworkRecoveryInterval(settings.getNetworkRecoveryInterval().toMillis());
        return factory;
    }

    private static String resolveClientHost() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            String env = System.getenv("HOSTNAME");
            return env != null && !env.isBlank() ? env : "unknown-host";
        }
    }
}
