package com.apisentinel.core.alert;

/**
 * Raised when an alert id is unknown to the store.
 *
 * @since 1.0.0
 */
public class AlertNotFoundException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String alertId;

    public AlertNotFoundException(String alertId) {
        super("Alert not found: " + alertId);
        this.alertId = alertId;
    }

    public String getAlertId() {
        return alertId;
    }
}
