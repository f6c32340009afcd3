/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.bus6.messaging.rabbitmq;

/**
 * What a managed connection is used for. {@code SHARED} replaces the other
 * two when publish and consume traffic share one connection.
 */
public enum ConnectionPurpose {
    PUBLISH("publish"),
    CONSUME("consume"),
    SHARED("shared");

    private final String tag;

    ConnectionPurpose(String tag) { this.tag = tag; }

    public String tag() { return tag; }
}
