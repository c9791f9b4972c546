package com.apisentinel.core.alert;

import com.apisentinel.core.model.AlertStatus;

/**
 * Raised when a status change is not a legal edge of the alert lifecycle.
 *
 * @since 1.0.0
 */
public class IllegalStateTransitionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final AlertStatus from;
    private final AlertStatus to;

    public IllegalStateTransitionException(String alertId, AlertStatus from, AlertStatus to) {
        super("Illegal transition of alert " + alertId + ": " + from + " -> " + to);
        this.from = from;
        this.to = to;
    }

    public AlertStatus getFrom() {
        return from;
    }

    public AlertStatus getTo() {
        return to;
    }
}
