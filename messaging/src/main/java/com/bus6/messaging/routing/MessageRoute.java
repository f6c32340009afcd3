/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.bus6.messaging.routing;

import java.util.Locale;

/**
 * Where a message type is published and the type tag it carries.
 */
public record MessageRoute(String exchange, String routingKey, String typeName) {

    public static final String EXCHANGE_PREFIX = "bus6.";

    public MessageRoute {
        if (exchange == null || exchange.isBlank()) throw new IllegalArgumentException("exchange must not be blank");
        if (typeName == null || typeName.isBlank()) throw new IllegalArgumentException("typeName must not be blank");
        if (routingKey == null) routingKey = "";
    }

    /**
     * {@code bus6.<type>} exchange and {@code <type>} routing key, type name lower-cased.
     */
    public static MessageRoute conventional(String typeName) {
        if (typeName == null || typeName.isBlank()) throw new IllegalArgumentException("typeName must not be blank");
        String key = typeName.toLowerCase(Locale.ROOT);
        return new MessageRoute(EXCHANGE_PREFIX + key, key, typeName);
    }
}
