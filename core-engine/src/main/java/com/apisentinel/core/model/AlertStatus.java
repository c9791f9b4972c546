package com.apisentinel.core.model;

import java.util.Locale;

/**
 * Lifecycle status of an {@link Alert}.
 *
 * <pre>
 *   OPEN ──► ACKNOWLEDGED ──► RESOLVED
 *     └─────────────────────────▲
 * </pre>
 *
 * <p>
 * {@code RESOLVED} is terminal; a recurrence creates a new alert.
 * </p>
 *
 * @since 1.0.0
 */
public enum AlertStatus {

    OPEN,
    ACKNOWLEDGED,
    RESOLVED;

    /**
     * @param next requested status
     * @return {@code true} if moving from this status to {@code next} is a legal
     *         edge
     */
    public boolean canTransitionTo(AlertStatus next) {
        return switch (this) {
            case OPEN -> next == ACKNOWLEDGED || next == RESOLVED;
            case ACKNOWLEDGED -> next == RESOLVED;
            case RESOLVED -> false;
        };
    }

    /**
     * @return {@code true} for statuses that still count against the
     *         one-active-alert-per-dedup-key invariant
     */
    public boolean isActive() {
        return this != RESOLVED;
    }

    public static AlertStatus parse(String value) {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new IllegalArgumentException("Unknown alert status: '" + value
                    + "'. Supported: open, acknowledged, resolved", e);
        }
    }
}
