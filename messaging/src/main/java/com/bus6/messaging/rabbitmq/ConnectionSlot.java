/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.bus6.messaging.rabbitmq;

import com.rabbitmq.client.Connection;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holder for the single connection of one {@link ConnectionPurpose}.
 *
 * <p>The lease is swapped with compare-and-set only. Whoever removes a lease
 * from the slot owns it and is the one to dispose it, so each connection is
 * closed exactly once.</p>
 */
final class ConnectionSlot {

    record Lease(Connection connection, Instant createdAt) {}

    private final ConnectionPurpose purpose;
    private final AtomicReference<Lease> lease = new AtomicReference<>();

    ConnectionSlot(ConnectionPurpose purpose) {
        this.purpose = purpose;
    }

    ConnectionPurpose purpose() { return purpose; }

    Lease current() { return lease.get(); }

    /** Install into an empty slot. False if another lease got there first. */
    boolean install(Lease fresh) {
        return lease.compareAndSet(null, fresh);
    }

    /** Remove {@code expected} if it is still the current lease. */
    boolean clear(Lease expected) {
        return lease.compareAndSet(expected, null);
    }

    Lease clearAll() {
        return lease.getAndSet(null);
    }
}
