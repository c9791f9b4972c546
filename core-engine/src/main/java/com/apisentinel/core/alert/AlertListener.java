package com.apisentinel.core.alert;

/**
 * Receives every persisted alert change.
 *
 * <p>
 * Called on the thread that made the change; implementations should hand off
 * slow work. Exceptions are logged by the publisher and never affect stored
 * state.
 * </p>
 */
@FunctionalInterface
public interface AlertListener {

    void onAlert(AlertNotification notification);
}
