/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.bus6.messaging.rabbitmq;

/**
 * How a single delivery was settled with the broker.
 */
public enum DeliveryOutcome {
    /** Handler succeeded, basic.ack sent. */
    ACKNOWLEDGED,
    /** Handler failed, basic.nack sent with requeue. */
    REQUEUED,
    /** Handler failed on its last allowed attempt, basic.nack sent without requeue. */
    REJECTED,
    /** Auto-ack subscription; the broker settled the delivery on send. */
    AUTO_ACKNOWLEDGED,
    /** The ack or nack could not be sent. The broker redelivers once the channel closes. */
    SETTLEMENT_FAILED
}
