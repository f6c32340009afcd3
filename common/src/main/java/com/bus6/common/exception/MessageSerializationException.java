/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.bus6.common.exception;

public class MessageSerializationException extends Bus6Exception {
    public MessageSerializationException(String message, Throwable cause) {
        super("BUS6_SERIALIZATION", message, cause);
    }
}
