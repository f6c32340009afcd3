/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.bus6.messaging.rabbitmq;

import com.bus6.common.exception.MessagePublishException;
import com.bus6.common.util.JsonMessageSerializer;
import com.bus6.common.util.MessageSerializer;
import com.bus6.messaging.core.ConnectionManager;
import com.bus6.messaging.core.MessagePublisher;
import com.bus6.messaging.routing.MessageRoute;
import com.bus6.messaging.routing.MessageRouteRegistry;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.BuiltinExchangeType;
import com.rabbitmq.client.Channel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.Date;
import java.util.UUID;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * RabbitMQ publisher using AMQP 0-9-1.
 *
 * <p>Each publish opens a transient channel on the managed publish connection,
 * declares the target topic exchange (durable) and sends a persistent JSON
 * message. Channels are never shared between concurrent publishes.</p>
 */
public class RabbitMQPublisher implements MessagePublisher {

    private static final Logger log = LoggerFactory.getLogger(RabbitMQPublisher.class);
    private static final int PERSISTENT_DELIVERY_MODE = 2;

    private final ConnectionManager connectionManager;
    private final MessageRouteRegistry routes;
    private final MessageSerializer serializer;
    private final Clock clock;

    private final AtomicLong publishedCount = new AtomicLong();
    private final AtomicLong errorCount = new AtomicLong();
    private final AtomicLong bytesPublished = new AtomicLong();

    public RabbitMQPublisher(ConnectionManager connectionManager, MessageRouteRegistry routes) {
        this(connectionManager, routes, new JsonMessageSerializer(), Clock.systemUTC());
    }

    public RabbitMQPublisher(ConnectionManager connectionManager, MessageRouteRegistry routes,
                             MessageSerializer serializer) {
        this(connectionManager, routes, serializer, Clock.systemUTC());
    }

    RabbitMQPublisher(ConnectionManager connectionManager, MessageRouteRegistry routes,
                      MessageSerializer serializer, Clock clock) {
        if (connectionManager == null) throw new IllegalArgumentException("connectionManager must not be null");
        if (routes == null) throw new IllegalArgumentException("routes must not be null");
        if (serializer == null) throw new IllegalArgumentException("serializer must not be null");
        this.connectionManager = connectionManager;
        this.routes = routes;
        this.serializer = serializer;
        this.clock = clock;
    }

    @Override
    public <T> void publish(T message) {
        if (message == null) throw new IllegalArgumentException("message must not be null");
        MessageRoute route = routes.routeFor(message.getClass());
        send(message, route.exchange(), route.routingKey(), route.typeName());
    }

    @Override
    public <T> void publish(T message, String exchange, String routingKey) {
        if (message == null) throw new IllegalArgumentException("message must not be null");
        if (exchange == null || exchange.isBlank()) throw new IllegalArgumentException("exchange must not be blank");
        String typeName = routes.find(message.getClass())
                .map(MessageRoute::typeName)
                .orElse(message.getClass().getSimpleName());
        send(message, exchange, routingKey != null ? routingKey : "", typeName);
    }

    @Override
    public PublisherStats getStats() {
        return new PublisherStats(publishedCount.get(), errorCount.get(), bytesPublished.get());
    }

    private void send(Object message, String exchange, String routingKey, String typeName) {
        Channel channel = null;
        try {
            channel = connectionManager.acquirePublishConnection().createChannel();
            channel.exchangeDeclare(exchange, BuiltinExchangeType.TOPIC, true, false, null);

            byte[] body = serializer.serialize(message);
            AMQP.BasicProperties properties = new AMQP.BasicProperties.Builder()
                    .deliveryMode(PERSISTENT_DELIVERY_MODE)
                    .contentType(serializer.contentType())
                    .contentEncoding(serializer.contentEncoding())
                    .timestamp(epochSecondTimestamp())
                    .messageId(UUID.randomUUID().toString())
                    .type(typeName)
                    .build();

            channel.basicPublish(exchange, routingKey, false, properties, body);
            publishedCount.incrementAndGet();
            bytesPublished.addAndGet(body.length);
            log.debug("Published {} to exchange '{}' with routing key '{}'", typeName, exchange, routingKey);
        } catch (Exception e) {
            errorCount.incrementAndGet();
            log.error("Failed to publish {} to exchange '{}'", typeName, exchange, e);
            throw new MessagePublishException(typeName, exchange, e);
        } finally {
            closeChannel(channel, exchange);
        }
    }

    // a close failure never changes the publish outcome
    private void closeChannel(Channel channel, String exchange) {
        if (channel == null) return;
        try {
            channel.close();
        } catch (IOException | TimeoutException | RuntimeException e) {
            log.warn("Error closing publish channel for exchange '{}'", exchange, e);
        }
    }

    // AMQP timestamps carry whole seconds
    private Date epochSecondTimestamp() {
        return Date.from(Instant.ofEpochSecond(clock.instant().getEpochSecond()));
    }
}
