/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.bus6.messaging.config;

import com.bus6.common.config.Bus6Properties;
import com.bus6.common.util.JsonMessageSerializer;
import com.bus6.common.util.MessageSerializer;
import com.bus6.messaging.core.ConnectionManager;
import com.bus6.messaging.core.MessageConsumer;
import com.bus6.messaging.core.MessagePublisher;
import com.bus6.messaging.rabbitmq.RabbitMQConnectionManager;
import com.bus6.messaging.rabbitmq.RabbitMQConsumer;
import com.bus6.messaging.rabbitmq.RabbitMQPublisher;
import com.bus6.messaging.rabbitmq.RabbitMQTopology;
import com.bus6.messaging.routing.MessageRouteRegistry;

/**
 * Builds the RabbitMQ components from {@code bus6.*} properties.
 *
 * <p>One connection manager is meant to be shared by every publisher,
 * consumer and topology helper of an application; the factory never closes it.</p>
 */
public final class MessagingFactory {

    private MessagingFactory() {}

    public static ConnectionManager createConnectionManager(Bus6Properties props) {
        return new RabbitMQConnectionManager(
                RabbitMQConfiguration.fromProperties(props),
                ConnectionSettings.fromProperties(props));
    }

    public static MessagePublisher createPublisher(ConnectionManager connectionManager,
                                                   MessageRouteRegistry routes) {
        return new RabbitMQPublisher(connectionManager, routes, new JsonMessageSerializer());
    }

    public static MessagePublisher createPublisher(ConnectionManager connectionManager,
                                                   MessageRouteRegistry routes,
                                                   MessageSerializer serializer) {
        return new RabbitMQPublisher(connectionManager, routes, serializer);
    }

    public static MessageConsumer createConsumer(ConnectionManager connectionManager) {
        return new RabbitMQConsumer(connectionManager, new JsonMessageSerializer());
    }

    public static MessageConsumer createConsumer(ConnectionManager connectionManager,
                                                 MessageSerializer serializer) {
        return new RabbitMQConsumer(connectionManager, serializer);
    }

    public static RabbitMQTopology createTopology(ConnectionManager connectionManager) {
        return new RabbitMQTopology(connectionManager);
    }
}
