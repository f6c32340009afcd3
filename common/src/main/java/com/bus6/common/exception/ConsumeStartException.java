/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.bus6.common.exception;

public class ConsumeStartException extends Bus6Exception {
    private final String queueName;

    public ConsumeStartException(String queueName, Throwable cause) {
        super("BUS6_CONSUME_START", "Failed to start consumer for queue '" + queueName + "'", cause);
        this.queueName = queueName;
    }

    public String getQueueName() { return queueName; }
}
