/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.bus6.messaging.core;

/**
 * Callback invoked once per delivered message.
 *
 * <p>Returning normally acknowledges the delivery; throwing rejects it.
 * Implementations must be thread-safe.</p>
 *
 * @param <T> the message type the payload is decoded into
 */
@FunctionalInterface
public interface MessageHandler<T> {
    void handle(T message) throws Exception;
}
