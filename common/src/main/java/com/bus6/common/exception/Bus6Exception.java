/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.bus6.common.exception;

/**
 * Base exception for all Bus6 messaging errors.
 */
public class Bus6Exception extends RuntimeException {
    private final String errorCode;

    public Bus6Exception(String message) {
        super(message);
        this.errorCode = "BUS6_GENERIC";
    }

    public Bus6Exception(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public Bus6Exception(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() { return errorCode; }
}
