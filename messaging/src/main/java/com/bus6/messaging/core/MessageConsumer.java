/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.bus6.messaging.core;

import com.bus6.messaging.config.ConsumerSettings;

/**
 * A single queue subscription with explicit acknowledgement.
 *
 * <p>Start and stop are serialized against each other. Stopping prevents new
 * deliveries; handlers already running complete and still settle their
 * deliveries.</p>
 */
public interface MessageConsumer extends AutoCloseable {

    /**
     * Subscribe {@code handler} to {@code settings.getQueueName()}.
     * A call while already consuming is a no-op.
     *
     * @throws IllegalArgumentException if any argument is null
     * @throws java.util.concurrent.CancellationException if the calling thread is interrupted
     * @throws com.bus6.common.exception.ConsumeStartException if the subscription cannot be set up
     */
    <T> void startConsuming(ConsumerSettings settings, Class<T> messageType, MessageHandler<? super T> handler);

    /** Cancel the subscription. No-op when not consuming. */
    void stopConsuming();

    boolean isConsuming();

    /** Broker-issued consumer tag, or {@code null} when not consuming. */
    String getConsumerTag();

    ConsumerStats getStats();

    @Override
    void close();

    record ConsumerStats(long messagesReceived, long messagesAcknowledged, long messagesRequeued,
                         long messagesRejected, long settlementFailures, boolean consuming) {}
}
