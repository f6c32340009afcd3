package com.bus6.messaging.config;

import com.bus6.common.config.Bus6Properties;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class MessagingSettingsTest {

    @Test
    void testConnectionDefaults() {
        ConnectionSettings settings = ConnectionSettings.defaults();

        assertEquals(Duration.ofMinutes(10), settings.getConnectionLifetime());
        assertEquals(Duration.ofSeconds(60), settings.getHealthCheckInterval());
        assertFalse(settings.isHealthCheckEnabled());
        assertTrue(settings.isSeparateConnections());
        assertEquals(Duration.ofSeconds(60), settings.getHeartbeatInterval());
        assertEquals(Duration.ofSeconds(5), settings.getNetworkRecoveryInterval());
        assertEquals(Duration.ofSeconds(30), settings.getConnectionTimeout());
    }

    @Test
    void testConnectionSettingsFromProperties() {
        Bus6Properties props = Bus6Properties.of(Map.of(
                "bus6.connection.lifetime", "5m",
                "bus6.connection.health-check-enabled", "true",
                "bus6.connection.separate-connections", "false",
                "bus6.connection.heartbeat", "0"));

        ConnectionSettings settings = ConnectionSettings.fromProperties(props);

        assertEquals(Duration.ofMinutes(5), settings.getConnectionLifetime());
        assertTrue(settings.isHealthCheckEnabled());
        assertFalse(settings.isSeparateConnections());
        assertEquals(Duration.ZERO, settings.getHeartbeatInterval());
        assertEquals(Duration.ofSeconds(30), settings.getConnectionTimeout());
    }

    @Test
    void testConnectionSettingsRejectNonPositiveLifetime() {
        assertThrows(IllegalArgumentException.class,
                () -> ConnectionSettings.builder().connectionLifetime(Duration.ZERO).build());
        assertThrows(IllegalArgumentException.class,
                () -> ConnectionSettings.builder().heartbeatInterval(Duration.ofSeconds(-1)).build());
    }

    @Test
    void testConsumerSettingsDefaultsAndValidation() {
        ConsumerSettings settings = ConsumerSettings.builder("orders").build();

        assertEquals(10, settings.getPrefetchCount());
        assertFalse(settings.isAutoAck());
        assertFalse(settings.isRetryLimited());

        assertThrows(IllegalArgumentException.class, () -> ConsumerSettings.builder(" ").build());
        assertThrows(IllegalArgumentException.class, () -> ConsumerSettings.builder(null).build());
        assertThrows(IllegalArgumentException.class,
                () -> ConsumerSettings.builder("orders").prefetchCount(70000).build());
        assertThrows(IllegalArgumentException.class,
                () -> ConsumerSettings.builder("orders").maxDeliveryAttempts(-1).build());
    }

    @Test
    void testConsumerSettingsFromProperties() {
        Bus6Properties props = Bus6Properties.of(Map.of(
                "bus6.consumer.queue", "orders",
                "bus6.consumer.prefetch-count", "1",
                "bus6.consumer.auto-ack", "true",
                "bus6.consumer.max-delivery-attempts", "4"));

        ConsumerSettings settings = ConsumerSettings.fromProperties(props);

        assertEquals("orders", settings.getQueueName());
        assertEquals(1, settings.getPrefetchCount());
        assertTrue(settings.isAutoAck());
        assertTrue(settings.isRetryLimited());
        assertEquals(4, settings.getMaxDeliveryAttempts());
    }

    @Test
    void testBrokerConfigurationFromProperties() {
        Bus6Properties props = Bus6Properties.of(Map.of(
                "bus6.rabbitmq.host", "rabbit.internal",
                "bus6.rabbitmq.port", "5673",
                "bus6.rabbitmq.password", "s3cr3t",
                "bus6.rabbitmq.virtual-host", "/orders"));

        RabbitMQConfiguration config = RabbitMQConfiguration.fromProperties(props);

        assertEquals("rabbit.internal", config.getHost());
        assertEquals(5673, config.getPort());
        assertEquals("guest", config.getUsername());
        assertEquals("/orders", config.getVirtualHost());
        assertEquals("s3cr3t", config.getPassword());
        assertFalse(config.toString().contains("s3cr3t"));
    }
}
