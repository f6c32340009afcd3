/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.bus6.messaging.config;

import com.bus6.common.config.Bus6Properties;

/**
 * Per-subscription settings.
 *
 * <p>{@code maxDeliveryAttempts} of 0 keeps failed messages requeued forever,
 * leaving dead-lettering to the broker topology. A positive value rejects a
 * failing message without requeue once it has been tried that many times.</p>
 */
public final class ConsumerSettings {

    public static final int DEFAULT_PREFETCH_COUNT = 10;

    private final String queueName;
    private final int prefetchCount;
    private final boolean autoAck;
    private final int maxDeliveryAttempts;

    private ConsumerSettings(Builder b) {
        this.queueName = b.queueName;
        this.prefetchCount = b.prefetchCount;
        this.autoAck = b.autoAck;
        this.maxDeliveryAttempts = b.maxDeliveryAttempts;
    }

    public static Builder builder(String queueName) { return new Builder(queueName); }

    /**
     * Reads {@code bus6.consumer.queue|prefetch-count|auto-ack|max-delivery-attempts}.
     */
    public static ConsumerSettings fromProperties(Bus6Properties props) {
        return builder(props.getString("bus6.consumer.queue"))
                .prefetchCount(props.getInt("bus6.consumer.prefetch-count", DEFAULT_PREFETCH_COUNT))
                .autoAck(props.getBoolean("bus6.consumer.auto-ack", false))
                .maxDeliveryAttempts(props.getInt("bus6.consumer.max-delivery-attempts", 0))
                .build();
    }

    public String getQueueName() { return queueName; }
    public int getPrefetchCount() { return prefetchCount; }
    public boolean isAutoAck() { return autoAck; }
    public int getMaxDeliveryAttempts() { return maxDeliveryAttempts; }
    public boolean isRetryLimited() { return maxDeliveryAttempts > 0; }

    @Override
    public String toString() {
        return "ConsumerSettings{queue=" + queueName + ", prefetch=" + prefetchCount
                + ", autoAck=" + autoAck + ", maxDeliveryAttempts=" + maxDeliveryAttempts + "}";
    }

    public static final class Builder {
        private final String queueName;
        private int prefetchCount = DEFAULT_PREFETCH_COUNT;
        private boolean autoAck = false;
        private int maxDeliveryAttempts = 0;

        private Builder(String queueName) { this.queueName = queueName; }

        public Builder prefetchCount(int prefetchCount) { this.prefetchCount = prefetchCount; return this; }
        public Builder autoAck(boolean autoAck) { this.autoAck = autoAck; return this; }
        public Builder maxDeliveryAttempts(int attempts) { this.maxDeliveryAttempts = attempts; return this; }

        public ConsumerSettings build() {
            if (queueName == null || queueName.isBlank()) {
                throw new IllegalArgumentException("queueName must not be blank");
            }
            // basic.qos prefetch-count is an unsigned short
            if (prefetchCount < 0 || prefetchCount > 65535) {
                throw new IllegalArgumentException("prefetchCount out of range: " + prefetchCount);
            }
            if (maxDeliveryAttempts < 0) {
                throw new IllegalArgumentException("maxDeliveryAttempts must not be negative");
            }
            return new ConsumerSettings(this);
        }
    }
}
