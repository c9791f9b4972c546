package com.apisentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Metrics tracked for every window of every endpoint.
 *
 * <p>
 * Each metric declares the directions in which a deviation counts as
 * degradation. Latency and error rate are only reported when they rise; an
 * error-rate decrease is never flagged. Request volume and response size
 * variance are reported both ways since a traffic drop or payloads collapsing
 * to a constant size are symptoms in their own right.
 * </p>
 *
 * @since 1.0.0
 */
public enum Metric {

    AVG_LATENCY("avg_latency", "avg latency", EnumSet.of(Direction.INCREASE)),
    P95_LATENCY("p95_latency", "p95 latency", EnumSet.of(Direction.INCREASE)),
    ERROR_RATE("error_rate", "error rate", EnumSet.of(Direction.INCREASE)),
    REQUEST_VOLUME("request_volume", "request volume",
            EnumSet.of(Direction.INCREASE, Direction.DECREASE)),
    RESPONSE_SIZE_VARIANCE("response_size_variance", "response size variance",
            EnumSet.of(Direction.INCREASE, Direction.DECREASE));

    private final String key;
    private final String displayName;
    private final Set<Direction> reportable;

    Metric(String key, String displayName, Set<Direction> reportable) {
        this.key = key;
        this.displayName = displayName;
        this.reportable = reportable;
    }

    /**
     * @return snake-case key used in configuration and JSON
     */
    @JsonValue
    public String key() {
        return key;
    }

    /**
     * @return human-readable name used in explanations
     */
    public String displayName() {
        return displayName;
    }

    /**
     * @param direction deviation direction
     * @return {@code true} if a deviation in this direction indicates degradation
     */
    public boolean isReportable(Direction direction) {
        return reportable.contains(direction);
    }

    /**
     * @return {@code true} for the latency family (average and p95)
     */
    public boolean isLatency() {
        return this == AVG_LATENCY || this == P95_LATENCY;
    }

    /**
     * Resolve a metric from its key ({@code avg_latency}) or enum name
     * ({@code AVG_LATENCY}).
     *
     * @param value key or name
     * @return the matching metric
     * @throws IllegalArgumentException if the value is unknown
     */
    @JsonCreator
    public static Metric fromKey(String value) {
        if (value != null) {
            String normalised = value.trim().toLowerCase(Locale.ROOT);
            for (Metric metric : values()) {
                if (metric.key.equals(normalised)) {
                    return metric;
                }
            }
        }
        throw new IllegalArgumentException("Unknown metric: '" + value + "'");
    }
}
