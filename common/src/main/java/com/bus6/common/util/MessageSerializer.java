/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.bus6.common.util;

import com.bus6.common.exception.MessageSerializationException;

/**
 * Converts application messages to and from broker payload bytes.
 * Implementations must be thread-safe; a single instance is shared by
 * publishers and all delivery callbacks of a consumer.
 */
public interface MessageSerializer {

    /** MIME type stamped on published messages. */
    String contentType();

    /** Charset name stamped as the content encoding. */
    String contentEncoding();

    byte[] serialize(Object message) throws MessageSerializationException;

    <T> T deserialize(byte[] payload, Class<T> type) throws MessageSerializationException;
}
