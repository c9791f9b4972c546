package com.apisentinel.core.model;

import java.util.Locale;

/**
 * Alert severity, ordered from least to most urgent.
 *
 * @since 1.0.0
 */
public enum Severity {

    INFO,
    WARN,
    CRITICAL;

    /**
     * @param other severity to compare with
     * @return the more urgent of the two
     */
    public Severity max(Severity other) {
        return other != null && other.compareTo(this) > 0 ? other : this;
    }

    /**
     * Parse a severity name case-insensitively.
     *
     * @param value severity name
     * @return the matching severity
     * @throws IllegalArgumentException if the value is unknown
     */
    public static Severity parse(String value) {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new IllegalArgumentException("Unknown severity: '" + value
                    + "'. Supported: info, warn, critical", e);
        }
    }
}
