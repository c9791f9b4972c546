package com.apisentinel.core.model;

import java.util.Locale;

/**
 * Direction of a metric's deviation from its baseline.
 *
 * @since 1.0.0
 */
public enum Direction {

    INCREASE,
    DECREASE;

    /**
     * @param current  current observation
     * @param baseline baseline mean
     * @return {@link #INCREASE} when {@code current >= baseline}
     */
    public static Direction of(double current, double baseline) {
        return current >= baseline ? INCREASE : DECREASE;
    }

    /**
     * Parse a direction name case-insensitively ({@code "increase"},
     * {@code "DECREASE"}).
     *
     * @param value direction name
     * @return the matching direction
     * @throws IllegalArgumentException if the value is unknown
     */
    public static Direction parse(String value) {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new IllegalArgumentException("Unknown direction: '" + value
                    + "'. Supported: increase, decrease", e);
        }
    }
}
