/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.bus6.messaging.rabbitmq;

import com.bus6.common.exception.BrokerConnectionException;
import com.bus6.common.exception.ConsumeStartException;
import com.bus6.common.util.JsonMessageSerializer;
import com.bus6.common.util.MessageSerializer;
import com.bus6.messaging.config.ConsumerSettings;
import com.bus6.messaging.core.ConnectionManager;
import com.bus6.messaging.core.MessageConsumer;
import com.bus6.messaging.core.MessageHandler;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.DefaultConsumer;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.ShutdownSignalException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * RabbitMQ consumer for a single queue using AMQP 0-9-1 with manual or
 * automatic acknowledgement and prefetch-based flow control.
 *
 * <p>The subscription state (channel and consumer tag) lives in one immutable
 * object that is only replaced under {@code stateLock}. It counts as running
 * while its consumer tag has not been ended by the broker and its channel is
 * open; a start finding a dead subscription replaces it. A stopped consumer
 * keeps its channel open so handlers still running can settle their
 * deliveries; that channel is closed by the next start or by
 * {@link #close()}.</p>
 */
public class RabbitMQConsumer implements MessageConsumer {

    private static final Logger log = LoggerFactory.getLogger(RabbitMQConsumer.class);

    private final ConnectionManager connectionManager;
    private final MessageSerializer serializer;
    private final ReentrantLock stateLock = new ReentrantLock();
    private final DeliveryCounters counters = new DeliveryCounters();
    private final AtomicBoolean closed = new AtomicBoolean();
    // tags ended by broker cancel or channel shutdown, recorded even when stateLock is busy
    private final Set<String> endedTags = ConcurrentHashMap.newKeySet();

    private volatile Subscription subscription;
    private Channel retiredChannel;

    private record Subscription(ConsumerSettings settings, Channel channel, String consumerTag,
                                RedeliveryTracker redeliveries) {}

    public RabbitMQConsumer(ConnectionManager connectionManager) {
        this(connectionManager, new JsonMessageSerializer());
    }

    public RabbitMQConsumer(ConnectionManager connectionManager, MessageSerializer serializer) {
        if (connectionManager == null) throw new IllegalArgumentException("connectionManager must not be null");
        if (serializer == null) throw new IllegalArgumentException("serializer must not be null");
        this.connectionManager = connectionManager;
        this.serializer = serializer;
    }

    @Override
    public <T> void startConsuming(ConsumerSettings settings, Class<T> messageType,
                                   MessageHandler<? super T> handler) {
        if (settings == null) throw new IllegalArgumentException("settings must not be null");
        if (messageType == null) throw new IllegalArgumentException("messageType must not be null");
        if (handler == null) throw new IllegalArgumentException("handler must not be null");

        String queueName = settings.getQueueName();
        try {
            stateLock.lockInterruptibly();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            CancellationException cancelled =
                    new CancellationException("Start of consumer for queue '" + queueName + "' was cancelled");
            cancelled.initCause(e);
            throw cancelled;
        }
        try {
            if (closed.get()) {
                throw BrokerConnectionException.disposed("RabbitMQConsumer");
            }
            Subscription current = subscription;
            if (current != null) {
                if (isLive(current)) {
                    log.warn("Consumer already running for queue '{}'", current.settings().getQueueName());
                    return;
                }
                log.warn("Subscription '{}' on queue '{}' is no longer active, resubscribing",
                        current.consumerTag(), current.settings().getQueueName());
                retire(current);
            }

            log.info("Starting consumer for queue '{}'", queueName);
            closeChannel(retiredChannel);
            retiredChannel = null;

            Channel channel = null;
            try {
                Connection connection = connectionManager.acquireConsumeConnection();
                channel = connection.createChannel();
                if (channel == null) {
                    throw new IOException("No channel number available on the consume connection");
                }
                channel.basicQos(settings.getPrefetchCount());

                endedTags.clear();
                RedeliveryTracker redeliveries = new RedeliveryTracker();
                DeliveryDispatcher<T> dispatcher = new DeliveryDispatcher<>(
                        settings, messageType, handler, serializer, redeliveries, counters);
                String consumerTag = channel.basicConsume(queueName, settings.isAutoAck(),
                        new DispatchingConsumer(channel, dispatcher));
                if (endedTags.remove(consumerTag)) {
                    throw new IOException("Consumer '" + consumerTag + "' was cancelled before start completed");
                }

                subscription = new Subscription(settings, channel, consumerTag, redeliveries);
                log.info("Consumer started for queue '{}' with tag '{}' (prefetch={}, autoAck={})",
                        queueName, consumerTag, settings.getPrefetchCount(), settings.isAutoAck());
            } catch (Exception e) {
                log.error("Failed to start consumer for queue '{}'", queueName, e);
                closeChannel(channel);
                throw new ConsumeStartException(queueName, e);
            }
        } finally {
            stateLock.unlock();
        }
    }

    @Override
    public void stopConsuming() {
        stateLock.lock();
        try {
            Subscription current = subscription;
            if (current == null) {
                return;
            }
            log.info("Stopping consumer with tag '{}'...", current.consumerTag());
            try {
                if (current.channel().isOpen()) {
                    current.channel().basicCancel(current.consumerTag());
                }
            } catch (IOException | RuntimeException e) {
                log.warn("Error cancelling consumer '{}'", current.consumerTag(), e);
            } finally {
                retire(current);
            }
            log.info("Consumer stopped for queue '{}'", current.settings().getQueueName());
        } finally {
            stateLock.unlock();
        }
    }

    @Override
    public boolean isConsuming() {
        return isLive(subscription);
    }

    @Override
    public String getConsumerTag() {
        Subscription current = subscription;
        return isLive(current) ? current.consumerTag() : null;
    }

    @Override
    public ConsumerStats getStats() {
        return counters.snapshot(isConsuming());
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;
        stopConsuming();
        stateLock.lock();
        try {
            closeChannel(retiredChannel);
            retiredChannel = null;
        } finally {
            stateLock.unlock();
        }
        log.info("RabbitMQ consumer closed");
    }

    private boolean isLive(Subscription current) {
        return current != null
                && !endedTags.contains(current.consumerTag())
                && current.channel().isOpen();
    }

    // caller holds stateLock
    private void retire(Subscription current) {
        subscription = null;
        retiredChannel = current.channel();
        endedTags.remove(current.consumerTag());
        current.redeliveries().clear();
    }

    /**
     * The broker or the channel ended the subscription on its own. The tag is
     * recorded first so a start or stop holding the lock still sees it; the
     * state itself is only cleared when the lock is free.
     */
    private void subscriptionEnded(String consumerTag) {
        endedTags.add(consumerTag);
        if (stateLock.isHeldByCurrentThread() || !stateLock.tryLock()) return;
        try {
            Subscription current = subscription;
            if (current != null && current.consumerTag().equals(consumerTag)) {
                retire(current);
                log.info("Subscription '{}' on queue '{}' ended; consumer is no longer running",
                        consumerTag, current.settings().getQueueName());
            } else {
                endedTags.remove(consumerTag);
            }
        } finally {
            stateLock.unlock();
        }
    }

    private void closeChannel(Channel channel) {
        if (channel == null) return;
        try {
            if (channel.isOpen()) {
                channel.close();
            } else {
                // also drops a recovering channel from connection recovery
                channel.abort();
            }
        } catch (IOException | TimeoutException | RuntimeException e) {
            log.warn("Error closing consumer channel", e);
        }
    }

    private final class DispatchingConsumer extends DefaultConsumer {

        private final DeliveryDispatcher<?> dispatcher;

        DispatchingConsumer(Channel channel, DeliveryDispatcher<?> dispatcher) {
            super(channel);
            this.dispatcher = dispatcher;
        }

        @Override
        public void handleDelivery(String consumerTag, Envelope envelope,
                                   AMQP.BasicProperties properties, byte[] body) {
            dispatcher.dispatch(getChannel(), envelope, properties, body);
        }

        @Override
        public void handleCancel(String consumerTag) {
            log.warn("Consumer '{}' was cancelled by the broker", consumerTag);
            subscriptionEnded(consumerTag);
        }

        @Override
        public void handleShutdownSignal(String consumerTag, ShutdownSignalException sig) {
            // connection-level failures are recovered together with their consumers
            if (sig.isHardError() && !sig.isInitiatedByApplication()) {
                log.warn("Connection of consumer '{}' lost, awaiting automatic recovery: {}",
                        consumerTag, sig.getMessage());
                return;
            }
            log.warn("Channel of consumer '{}' shut down: {}", consumerTag, sig.getMessage());
            subscriptionEnded(consumerTag);
        }
    }
}
