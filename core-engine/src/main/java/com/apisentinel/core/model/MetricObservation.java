package com.apisentinel.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * A metric value of one window compared against its baseline, whether or not
 * it was flagged. Non-flagged observations feed the "what stayed stable" part
 * of an explanation.
 *
 * @since 1.0.0
 */
public final class MetricObservation implements Serializable {

    private static final long serialVersionUID = 1L;

    private final Metric metric;
    private final double baselineValue;
    private final double currentValue;
    private final double zScore;

    public MetricObservation(Metric metric, double baselineValue, double currentValue, double zScore) {
        this.metric = Objects.requireNonNull(metric, "metric must not be null");
        this.baselineValue = baselineValue;
        this.currentValue = currentValue;
        this.zScore = zScore;
    }

    public Metric getMetric() {
        return metric;
    }

    public double getBaselineValue() {
        return baselineValue;
    }

    public double getCurrentValue() {
        return currentValue;
    }

    public double getZScore() {
        return zScore;
    }

    @Override
    public String toString() {
        return metric.key() + "=" + currentValue + " (baseline " + baselineValue + ", z=" + zScore + ")";
    }
}
