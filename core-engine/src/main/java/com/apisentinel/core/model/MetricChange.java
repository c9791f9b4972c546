package com.apisentinel.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Objects;

/**
 * One line of the "what changed" evidence of an {@link Explanation}.
 *
 * @since 1.0.0
 */
public class MetricChange implements Serializable {

    private static final long serialVersionUID = 1L;

    private Metric metric;
    private double baselineValue;
    private double currentValue;

    /** Signed percentage delta; {@code null} when the baseline is zero. */
    private Double percentDelta;

    private double zScore;
    private Direction direction;

    /** No-arg constructor required by Jackson. */
    public MetricChange() {
    }

    public MetricChange(Metric metric, double baselineValue, double currentValue, Double percentDelta,
            double zScore, Direction direction) {
        this.metric = metric;
        this.baselineValue = baselineValue;
        this.currentValue = currentValue;
        this.percentDelta = percentDelta;
        this.zScore = zScore;
        this.direction = direction;
    }

    public Metric getMetric() {
        return metric;
    }

    public void setMetric(Metric metric) {
        this.metric = metric;
    }

    public double getBaselineValue() {
        return baselineValue;
    }

    public void setBaselineValue(double baselineValue) {
        this.baselineValue = baselineValue;
    }

    public double getCurrentValue() {
        return currentValue;
    }

    public void setCurrentValue(double currentValue) {
        this.currentValue = currentValue;
    }

    public Double getPercentDelta() {
        return percentDelta;
    }

    public void setPercentDelta(Double percentDelta) {
        this.percentDelta = percentDelta;
    }

    @JsonProperty("zScore")
    public double getZScore() {
        return zScore;
    }

    @JsonProperty("zScore")
    public void setZScore(double zScore) {
        this.zScore = zScore;
    }

    public Direction getDirection() {
        return direction;
    }

    public void setDirection(Direction direction) {
        this.direction = direction;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof MetricChange that))
            return false;
        return Double.compare(baselineValue, that.baselineValue) == 0
                && Double.compare(currentValue, that.currentValue) == 0
                && Double.compare(zScore, that.zScore) == 0
                && metric == that.metric
                && Objects.equals(percentDelta, that.percentDelta)
                && direction == that.direction;
    }

    @Override
    public int hashCode() {
        return Objects.hash(metric, baselineValue, currentValue, percentDelta, zScore, direction);
    }

    @Override
    public String toString() {
        return "MetricChange{" + metric + ": " + baselineValue + " -> " + currentValue
                + " (" + percentDelta + "%, z=" + zScore + ")}";
    }
}
