package com.apisentinel.core.sink;

import com.apisentinel.core.alert.AlertNotification;

/**
 * Destination for alert notifications.
 *
 * <p>
 * Called from the dispatcher's worker threads, possibly concurrently.
 * </p>
 */
public interface AlertSink {

    /**
     * @param notification change to deliver
     * @throws SinkDeliveryException if the attempt failed
     */
    void deliver(AlertNotification notification) throws SinkDeliveryException;

    /**
     * @return sink name as used in the routing table
     */
    String getName();
}
