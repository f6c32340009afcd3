/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.bus6.common.exception;

public class MessagePublishException extends Bus6Exception {
    private final String typeName;
    private final String exchange;

    public MessagePublishException(String typeName, String exchange, Throwable cause) {
        super("BUS6_PUBLISH",
              "Failed to publish message " + typeName + " to exchange '" + exchange + "'", cause);
        this.typeName = typeName;
        this.exchange = exchange;
    }

    public String getTypeName() { return typeName; }
    public String getExchange() { return exchange; }
}
