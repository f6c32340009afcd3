/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.bus6.messaging.core;

import com.bus6.common.exception.BrokerConnectionException;
import com.rabbitmq.client.Connection;

/**
 * Hands out long-lived broker connections, one per purpose.
 *
 * <p>Returned connections are owned by the manager. Callers open channels on
 * them but must never close the connection itself.</p>
 */
public interface ConnectionManager extends AutoCloseable {

    /** An open connection for publishing. */
    Connection acquirePublishConnection() throws BrokerConnectionException;

    /** An open connection for consuming; the publish connection when purposes are shared. */
    Connection acquireConsumeConnection() throws BrokerConnectionException;

    boolean isClosed();

    /** Dispose every held connection. Idempotent. */
    @Override
    void close();
}
