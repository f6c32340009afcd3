/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.bus6.messaging.core;

import com.bus6.common.exception.MessagePublishException;

import java.util.concurrent.CompletableFuture;

/**
 * Publishes application messages to topic exchanges.
 */
public interface MessagePublisher {

    /**
     * Publish to the exchange and routing key registered for the message's type.
     *
     * @throws IllegalArgumentException if the message is null or its type has no registered route
     */
    <T> void publish(T message) throws MessagePublishException;

    /**
     * Publish to an explicit exchange. A null routing key is sent as the empty key.
     *
     * @throws IllegalArgumentException if the message is null or the exchange is blank
     */
    <T> void publish(T message, String exchange, String routingKey) throws MessagePublishException;

    default <T> CompletableFuture<Void> publishAsync(T message) {
        return CompletableFuture.runAsync(() -> publish(message));
    }

    default <T> CompletableFuture<Void> publishAsync(T message, String exchange, String routingKey) {
        return CompletableFuture.runAsync(() -> publish(message, exchange, routingKey));
    }

    PublisherStats getStats();

    record PublisherStats(long messagesPublished, long messagesErrored, long bytesPublished) {}
}
