/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.bus6.messaging.rabbitmq;

import com.bus6.common.util.MessageSerializer;
import com.bus6.messaging.config.ConsumerSettings;
import com.bus6.messaging.core.MessageHandler;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Envelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Decodes one delivery, runs the handler and settles the delivery.
 *
 * <p>Deliveries may be dispatched concurrently; the only shared state touched
 * here is the channel, the thread-safe counters and the redelivery tracker.
 * Nothing thrown by decoding or by the handler leaves {@link #dispatch}.</p>
 */
final class DeliveryDispatcher<T> {

    private static final Logger log = LoggerFactory.getLogger(DeliveryDispatcher.class);

    private final ConsumerSettings settings;
    private final Class<T> messageType;
    private final MessageHandler<? super T> handler;
    private final MessageSerializer serializer;
    private final RedeliveryTracker redeliveries;
    private final DeliveryCounters counters;

    DeliveryDispatcher(ConsumerSettings settings, Class<T> messageType, MessageHandler<? super T> handler,
                       MessageSerializer serializer, RedeliveryTracker redeliveries, DeliveryCounters counters) {
        this.settings = settings;
        this.messageType = messageType;
        this.handler = handler;
        this.serializer = serializer;
        this.redeliveries = redeliveries;
        this.counters = counters;
    }

    DeliveryOutcome dispatch(Channel channel, Envelope envelope, AMQP.BasicProperties properties, byte[] body) {
        counters.received.incrementAndGet();
        long deliveryTag = envelope.getDeliveryTag();
        try {
            T message = serializer.deserialize(body, messageType);
            if (message != null) {
                handler.handle(message);
            } else {
                log.debug("Delivery {} from '{}' decoded to null, handler skipped",
                        deliveryTag, settings.getQueueName());
            }
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Exception | Error e) {
            // a throwing handler must not take the channel down with it
            log.error("Error processing message from queue '{}' (deliveryTag={})",
                    settings.getQueueName(), deliveryTag, e);
            return settleFailure(channel, deliveryTag, properties);
        }
        return settleSuccess(channel, deliveryTag, properties);
    }

    private DeliveryOutcome settleSuccess(Channel channel, long deliveryTag, AMQP.BasicProperties properties) {
        if (settings.isRetryLimited()) redeliveries.forget(properties);
        if (settings.isAutoAck()) {
            return DeliveryOutcome.AUTO_ACKNOWLEDGED;
        }
        if (!channel.isOpen()) {
            return settlementFailed("ack", deliveryTag, null);
        }
        try {
            channel.basicAck(deliveryTag, false);
            counters.acknowledged.incrementAndGet();
            return DeliveryOutcome.ACKNOWLEDGED;
        } catch (IOException | RuntimeException e) {
            return settlementFailed("ack", deliveryTag, e);
        }
    }

    private DeliveryOutcome settleFailure(Channel channel, long deliveryTag, AMQP.BasicProperties properties) {
        if (settings.isAutoAck()) {
            log.warn("Delivery {} from '{}' failed on an auto-ack subscription and will not be redelivered",
                    deliveryTag, settings.getQueueName());
            return DeliveryOutcome.AUTO_ACKNOWLEDGED;
        }
        boolean requeue = true;
        if (settings.isRetryLimited()) {
            int attempt = redeliveries.recordFailure(properties);
            if (attempt >= settings.getMaxDeliveryAttempts()) {
                requeue = false;
                redeliveries.forget(properties);
                log.warn("Delivery {} from '{}' failed {} of {} attempts, rejecting without requeue",
                        deliveryTag, settings.getQueueName(), attempt, settings.getMaxDeliveryAttempts());
            }
        }
        if (!channel.isOpen()) {
            return settlementFailed("nack", deliveryTag, null);
        }
        try {
            channel.basicNack(deliveryTag, false, requeue);
            if (requeue) {
                counters.requeued.incrementAndGet();
                return DeliveryOutcome.REQUEUED;
            }
            counters.rejected.incrementAndGet();
            return DeliveryOutcome.REJECTED;
        } catch (IOException | RuntimeException e) {
            return settlementFailed("nack", deliveryTag, e);
        }
    }

    private DeliveryOutcome settlementFailed(String operation, long deliveryTag, Exception cause) {
        counters.settlementFailures.incrementAndGet();
        if (cause == null) {
            log.warn("Channel closed before {} of delivery {} from '{}'",
                    operation, deliveryTag, settings.getQueueName());
        } else {
            log.warn("Failed to {} delivery {} from '{}'", operation, deliveryTag, settings.getQueueName(), cause);
        }
        return DeliveryOutcome.SETTLEMENT_FAILED;
    }
}
