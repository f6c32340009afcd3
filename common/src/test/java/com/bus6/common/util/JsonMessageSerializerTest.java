package com.bus6.common.util;

import com.bus6.common.exception.MessageSerializationException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

public class JsonMessageSerializerTest {

    public static class OrderPlaced {
        private String orderId;
        private int lineCount;
        private Instant placedAt;

        public OrderPlaced() {}

        public OrderPlaced(String orderId, int lineCount, Instant placedAt) {
            this.orderId = orderId;
            this.lineCount = lineCount;
            this.placedAt = placedAt;
        }

        public String getOrderId() { return orderId; }
        public void setOrderId(String orderId) { this.orderId = orderId; }
        public int getLineCount() { return lineCount; }
        public void setLineCount(int lineCount) { this.lineCount = lineCount; }
        public Instant getPlacedAt() { return placedAt; }
        public void setPlacedAt(Instant placedAt) { this.placedAt = placedAt; }
    }

    private final JsonMessageSerializer serializer = new JsonMessageSerializer();

    @Test
    void testWritesLowerCamelCaseKeysCompactly() {
        byte[] bytes = serializer.serialize(new OrderPlaced("o-1", 3, Instant.parse("2025-01-02T03:04:05Z")));
        String json = new String(bytes, StandardCharsets.UTF_8);

        assertTrue(json.contains("\"orderId\":\"o-1\""), json);
        assertTrue(json.contains("\"lineCount\":3"), json);
        assertTrue(json.contains("\"placedAt\":\"2025-01-02T03:04:05Z\""), json);
        assertFalse(json.contains("\n"));
    }

    @Test
    void testReadsPayloadFromAnotherProducerIgnoringUnknownFields() {
        byte[] payload = "{\"orderId\":\"o-9\",\"lineCount\":1,\"origin\":\"billing\"}"
                .getBytes(StandardCharsets.UTF_8);

        OrderPlaced order = serializer.deserialize(payload, OrderPlaced.class);

        assertEquals("o-9", order.getOrderId());
        assertEquals(1, order.getLineCount());
    }

    @Test
    void testJsonNullDecodesToNull() {
        assertNull(serializer.deserialize("null".getBytes(StandardCharsets.UTF_8), OrderPlaced.class));
    }

    @Test
    void testMalformedPayloadFails() {
        byte[] payload = "{not json".getBytes(StandardCharsets.UTF_8);
        MessageSerializationException ex = assertThrows(MessageSerializationException.class,
                () -> serializer.deserialize(payload, OrderPlaced.class));
        assertEquals("BUS6_SERIALIZATION", ex.getErrorCode());
    }

    @Test
    void testEmptyPayloadFails() {
        assertThrows(MessageSerializationException.class,
                () -> serializer.deserialize(new byte[0], OrderPlaced.class));
    }

    @Test
    void testContentMetadata() {
        assertEquals("application/json", serializer.contentType());
        assertEquals("utf-8", serializer.contentEncoding());
    }
}
