/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.bus6.messaging.rabbitmq;

import com.rabbitmq.client.AMQP;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Counts failed attempts per message for retry-limited subscriptions.
 *
 * <p>Quorum queues report previous attempts in the {@code x-delivery-count}
 * header, which takes precedence. Otherwise failures are counted in memory by
 * message id; a message without an id always counts as its first attempt.</p>
 */
final class RedeliveryTracker {

    static final String DELIVERY_COUNT_HEADER = "x-delivery-count";

    private final Map<String, Integer> failures = new ConcurrentHashMap<>();

    /** 1-based attempt number of a delivery whose processing just failed. */
    int recordFailure(AMQP.BasicProperties properties) {
        Integer previous = deliveryCountHeader(properties);
        if (previous != null) {
            return previous + 1;
        }
        String messageId = properties != null ? properties.getMessageId() : null;
        if (messageId == null) {
            return 1;
        }
        return failures.merge(messageId, 1, Integer::sum);
    }

    void forget(AMQP.BasicProperties properties) {
        if (properties != null && properties.getMessageId() != null) {
            failures.remove(properties.getMessageId());
        }
    }

    void clear() {
        failures.clear();
    }

    int trackedMessages() {
        return failures.size();
    }

    private static Integer deliveryCountHeader(AMQP.BasicProperties properties) {
        if (properties == null || properties.getHeaders() == null) return null;
        Object value = properties.getHeaders().get(DELIVERY_COUNT_HEADER);
        return value instanceof Number n ? n.intValue() : null;
    }
}
