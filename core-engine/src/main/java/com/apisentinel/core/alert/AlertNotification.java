package com.apisentinel.core.alert;

import com.apisentinel.core.model.Alert;
import com.apisentinel.core.model.Severity;

import java.util.Objects;

/**
 * A persisted alert change, published by the {@link AlertLifecycleManager}.
 *
 * @since 1.0.0
 */
public final class AlertNotification {

    /** Kind of change. */
    public enum Type {
        CREATED,
        UPDATED,
        ACKNOWLEDGED,
        RESOLVED
    }

    private final Type type;
    private final Alert alert;
    private final Severity previousSeverity;

    public AlertNotification(Type type, Alert alert, Severity previousSeverity) {
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.alert = Objects.requireNonNull(alert, "alert must not be null");
        this.previousSeverity = previousSeverity;
    }

    public Type getType() {
        return type;
    }

    /**
     * @return a copy of the alert as stored after the change
     */
    public Alert getAlert() {
        return alert.copy();
    }

    /**
     * @return severity before the change, {@code null} for created alerts
     */
    public Severity getPreviousSeverity() {
        return previousSeverity;
    }

    /**
     * @return {@code true} if an update raised the severity
     */
    public boolean isEscalation() {
        return previousSeverity != null && alert.getSeverity().compareTo(previousSeverity) > 0;
    }

    @Override
    public String toString() {
        return "AlertNotification{" + type + ", " + alert + '}';
    }
}
