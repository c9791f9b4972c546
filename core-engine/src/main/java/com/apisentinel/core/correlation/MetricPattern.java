package com.apisentinel.core.correlation;

import com.apisentinel.core.model.AnomalySignal;
import com.apisentinel.core.model.Direction;
import com.apisentinel.core.model.Metric;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Matches signals by metric and, optionally, direction.
 *
 * <p>
 * Notation: {@code metric[:direction]}, e.g. {@code error_rate},
 * {@code request_volume:decrease}. The alias {@code latency} matches both
 * {@code avg_latency} and {@code p95_latency}.
 * </p>
 *
 * @since 1.0.0
 */
public final class MetricPattern {

    public static final String LATENCY_ALIAS = "latency";

    private final Set<Metric> metrics;
    private final Direction direction;
    private final String text;

    private MetricPattern(Set<Metric> metrics, Direction direction, String text) {
        this.metrics = metrics;
        this.direction = direction;
        this.text = text;
    }

    /**
     * @param text pattern text
     * @return the parsed pattern
     * @throws IllegalArgumentException if the metric or direction is unknown
     */
    public static MetricPattern parse(String text) {
        Objects.requireNonNull(text, "Metric pattern must not be null");
        String trimmed = text.trim().toLowerCase(Locale.ROOT);
        String metricPart = trimmed;
        Direction direction = null;
        int colon = trimmed.indexOf(':');
        if (colon >= 0) {
            metricPart = trimmed.substring(0, colon).trim();
            direction = Direction.parse(trimmed.substring(colon + 1));
        }
        Set<Metric> metrics = LATENCY_ALIAS.equals(metricPart)
                ? EnumSet.of(Metric.AVG_LATENCY, Metric.P95_LATENCY)
                : EnumSet.of(Metric.fromKey(metricPart));
        return new MetricPattern(metrics, direction, trimmed);
    }

    public boolean matches(AnomalySignal signal) {
        return matches(signal.getMetric(), signal.getDirection());
    }

    public boolean matches(Metric metric, Direction signalDirection) {
        return metrics.contains(metric) && (direction == null || direction == signalDirection);
    }

    /**
     * @param metric a metric regardless of direction
     * @return {@code true} if this pattern names the metric
     */
    public boolean covers(Metric metric) {
        return metrics.contains(metric);
    }

    /**
     * @return {@code true} if the pattern only names latency metrics
     */
    boolean isLatencyOnly() {
        return metrics.stream().allMatch(Metric::isLatency);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof MetricPattern that))
            return false;
        return metrics.equals(that.metrics) && direction == that.direction;
    }

    @Override
    public int hashCode() {
        return Objects.hash(metrics, direction);
    }

    @Override
    public String toString() {
        return text;
    }
}
