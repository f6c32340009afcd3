/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.bus6.messaging.rabbitmq;

import com.bus6.common.exception.Bus6Exception;
import com.bus6.messaging.core.ConnectionManager;
import com.rabbitmq.client.BuiltinExchangeType;
import com.rabbitmq.client.Channel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Idempotent declarations needed to route a topic exchange into a queue.
 * Exchanges are durable topic exchanges; queues are durable, non-exclusive
 * and not auto-deleted.
 */
public class RabbitMQTopology {

    private static final Logger log = LoggerFactory.getLogger(RabbitMQTopology.class);

    private final ConnectionManager connectionManager;

    public RabbitMQTopology(ConnectionManager connectionManager) {
        if (connectionManager == null) throw new IllegalArgumentException("connectionManager must not be null");
        this.connectionManager = connectionManager;
    }

    public void declareExchange(String exchange) {
        requireName(exchange, "exchange");
        withChannel("declare exchange '" + exchange + "'", channel ->
                channel.exchangeDeclare(exchange, BuiltinExchangeType.TOPIC, true, false, null));
    }

    public void declareQueue(String queue) {
        requireName(queue, "queue");
        withChannel("declare queue '" + queue + "'", channel ->
                channel.queueDeclare(queue, true, false, false, null));
    }

    /** Declare the exchange and the queue, then bind them with {@code routingKey}. */
    public void bindQueue(String exchange, String queue, String routingKey) {
        requireName(exchange, "exchange");
        requireName(queue, "queue");
        String key = routingKey != null ? routingKey : "";
        withChannel("bind queue '" + queue + "' to '" + exchange + "'", channel -> {
            channel.exchangeDeclare(exchange, BuiltinExchangeType.TOPIC, true, false, null);
            channel.queueDeclare(queue, true, false, false, null);
            channel.queueBind(queue, exchange, key);
        });
        log.info("Bound queue '{}' to exchange '{}' with routing key '{}'", queue, exchange, key);
    }

    private void withChannel(String description, ChannelAction action) {
        try (Channel channel = connectionManager.acquirePublishConnection().createChannel()) {
            action.apply(channel);
        } catch (Exception e) {
            log.error("Failed to {}", description, e);
            throw new Bus6Exception("BUS6_TOPOLOGY", "Failed to " + description, e);
        }
    }

    private static void requireName(String name, String what) {
        if (name == null || name.isBlank()) throw new IllegalArgumentException(what + " must not be blank");
    }

    @FunctionalInterface
    private interface ChannelAction {
        void apply(Channel channel) throws Exception;
    }
}
