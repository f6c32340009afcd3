/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.bus6.common.util;

import com.bus6.common.exception.MessageSerializationException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;

/**
 * Jackson-backed JSON serializer. Keys are written in lower camel case so that
 * producers and consumers in other components read the same field names.
 *
 * <p>The {@link ObjectMapper} is owned by the instance and configured once in
 * the constructor; nothing is shared through static state.</p>
 */
public final class JsonMessageSerializer implements MessageSerializer {

    public static final String CONTENT_TYPE = "application/json";
    public static final String CONTENT_ENCODING = "utf-8";

    private final ObjectMapper mapper;

    public JsonMessageSerializer() {
        this(defaultMapper());
    }

    public JsonMessageSerializer(ObjectMapper mapper) {
        if (mapper == null) throw new IllegalArgumentException("mapper must not be null");
        this.mapper = mapper;
    }

    public static ObjectMapper defaultMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setPropertyNamingStrategy(PropertyNamingStrategies.LOWER_CAMEL_CASE)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.INDENT_OUTPUT)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Override
    public String contentType() { return CONTENT_TYPE; }

    @Override
    public String contentEncoding() { return CONTENT_ENCODING; }

    @Override
    public byte[] serialize(Object message) {
        try {
            return mapper.writeValueAsBytes(message);
        } catch (IOException e) {
            throw new MessageSerializationException(
                    "JSON serialization failed for " + (message == null ? "null" : message.getClass().getName()), e);
        }
    }

    @Override
    public <T> T deserialize(byte[] payload, Class<T> type) {
        if (payload == null || payload.length == 0) {
            throw new MessageSerializationException("Empty payload cannot be read as " + type.getName(), null);
        }
        try {
            return mapper.readValue(payload, type);
        } catch (IOException e) {
            throw new MessageSerializationException("JSON deserialization failed for " + type.getName(), e);
        }
    }
}
