/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.bus6.common.exception;

/**
 * Raised when a broker connection cannot be handed out.
 * The {@link Reason} tells callers whether retrying later makes sense.
 */
public class BrokerConnectionException extends Bus6Exception {

    public enum Reason {
        /** The broker could not be reached at connect time. */
        UNREACHABLE,
        /** The owning component has already been shut down. */
        DISPOSED,
        /** Any other failure while establishing the connection. */
        OTHER
    }

    private final Reason reason;

    public BrokerConnectionException(Reason reason, String message) {
        super("BUS6_CONNECTION_" + reason.name(), message);
        this.reason = reason;
    }

    public BrokerConnectionException(Reason reason, String message, Throwable cause) {
        super("BUS6_CONNECTION_" + reason.name(), message, cause);
        this.reason = reason;
    }

    public static BrokerConnectionException disposed(String component) {
        return new BrokerConnectionException(Reason.DISPOSED, component + " has been closed");
    }

    public Reason getReason() { return reason; }
}
