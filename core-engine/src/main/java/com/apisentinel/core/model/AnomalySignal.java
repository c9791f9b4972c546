package com.apisentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * One metric of one window deviating from its baseline.
 *
 * <p>
 * Emitted by the window evaluator and consumed by the correlator. Signals are
 * only persisted as part of the {@link Alert} they corroborate.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnomalySignal implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String endpoint;
    private final Metric metric;
    private final Duration windowSize;
    private final Instant windowEnd;
    private final double baselineValue;
    private final double currentValue;
    private final double zScore;
    private final Direction direction;

    @JsonCreator
    public AnomalySignal(@JsonProperty("endpoint") String endpoint,
            @JsonProperty("metric") Metric metric,
            @JsonProperty("windowSize") Duration windowSize,
            @JsonProperty("windowEnd") Instant windowEnd,
            @JsonProperty("baselineValue") double baselineValue,
            @JsonProperty("currentValue") double currentValue,
            @JsonProperty("zScore") double zScore,
            @JsonProperty("direction") Direction direction) {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint must not be null");
        this.metric = Objects.requireNonNull(metric, "metric must not be null");
        this.windowSize = Objects.requireNonNull(windowSize, "windowSize must not be null");
        this.windowEnd = Objects.requireNonNull(windowEnd, "windowEnd must not be null");
        this.baselineValue = baselineValue;
        this.currentValue = currentValue;
        this.zScore = zScore;
        this.direction = direction != null ? direction : Direction.of(currentValue, baselineValue);
    }

    public String getEndpoint() {
        return endpoint;
    }

    public Metric getMetric() {
        return metric;
    }

    public Duration getWindowSize() {
        return windowSize;
    }

    public Instant getWindowEnd() {
        return windowEnd;
    }

    public double getBaselineValue() {
        return baselineValue;
    }

    public double getCurrentValue() {
        return currentValue;
    }

    @JsonProperty("zScore")
    public double getZScore() {
        return zScore;
    }

    public Direction getDirection() {
        return direction;
    }

    /**
     * Signed percentage change from baseline to current value.
     *
     * @return delta in percent, or {@link Double#NaN} when the baseline is zero
     */
    @JsonIgnore
    public double getPercentDelta() {
        if (baselineValue == 0.0) {
            return Double.NaN;
        }
        return (currentValue - baselineValue) / Math.abs(baselineValue) * 100.0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AnomalySignal that))
            return false;
        return Double.compare(baselineValue, that.baselineValue) == 0
                && Double.compare(currentValue, that.currentValue) == 0
                && Double.compare(zScore, that.zScore) == 0
                && endpoint.equals(that.endpoint)
                && metric == that.metric
                && windowSize.equals(that.windowSize)
                && windowEnd.equals(that.windowEnd)
                && direction == that.direction;
    }

    @Override
    public int hashCode() {
        return Objects.hash(endpoint, metric, windowSize, windowEnd);
    }

    @Override
    public String toString() {
        return "AnomalySignal{" +
                "endpoint='" + endpoint + '\'' +
                ", metric=" + metric.key() +
                ", windowEnd=" + windowEnd +
                ", baseline=" + baselineValue +
                ", current=" + currentValue +
                ", z=" + zScore +
                ", direction=" + direction +
                '}';
    }
}
