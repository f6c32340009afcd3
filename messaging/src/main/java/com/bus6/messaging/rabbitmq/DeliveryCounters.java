/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.bus6.messaging.rabbitmq;

import com.bus6.messaging.core.MessageConsumer.ConsumerStats;

import java.util.concurrent.atomic.AtomicLong;

final class DeliveryCounters {

    final AtomicLong received = new AtomicLong();
    final AtomicLong acknowledged = new AtomicLong();
    final AtomicLong requeued = new AtomicLong();
    final AtomicLong rejected = new AtomicLong();
    final AtomicLong settlementFailures = new AtomicLong();

    ConsumerStats snapshot(boolean consuming) {
        return new ConsumerStats(received.get(), acknowledged.get(), requeued.get(),
                rejected.get(), settlementFailures.get(), consuming);
    }
}
