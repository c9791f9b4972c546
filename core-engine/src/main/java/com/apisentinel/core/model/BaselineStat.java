package com.apisentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Exponentially-weighted statistics of one {@link BaselineKey}.
 *
 * <p>
 * Instances are immutable snapshots. The baseline store holds the current
 * snapshot per key and the window evaluator swaps it for a new one in a single
 * atomic update; no other component produces new snapshots.
 * </p>
 *
 * <ul>
 * <li>{@code sampleCount}: observations folded into the mean so far</li>
 * <li>{@code consecutiveAnomalies}: windows in a row flagged anomalous,
 * reset by the first healthy window</li>
 * <li>{@code recentValues}: bounded history of healthy observations, oldest
 * first</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class BaselineStat implements Serializable {

    private static final long serialVersionUID = 1L;

    private final BaselineKey key;
    private final double ewmaMean;
    private final double ewmaVariance;
    private final long sampleCount;
    private final int consecutiveAnomalies;
    private final List<Double> recentValues;
    private final Instant lastUpdated;

    public BaselineStat(BaselineKey key, double ewmaMean, double ewmaVariance, long sampleCount,
            int consecutiveAnomalies, List<Double> recentValues, Instant lastUpdated) {
        this.key = Objects.requireNonNull(key, "key must not be null");
        this.ewmaMean = ewmaMean;
        this.ewmaVariance = ewmaVariance;
        this.sampleCount = sampleCount;
        this.consecutiveAnomalies = consecutiveAnomalies;
        this.recentValues = recentValues != null
                ? Collections.unmodifiableList(new ArrayList<>(recentValues))
                : List.of();
        this.lastUpdated = lastUpdated;
    }

    /**
     * @param key baseline identity
     * @return an empty baseline that has seen no observations
     */
    public static BaselineStat empty(BaselineKey key) {
        return new BaselineStat(key, 0.0, 0.0, 0, 0, List.of(), null);
    }

    public BaselineKey getKey() {
        return key;
    }

    public double getEwmaMean() {
        return ewmaMean;
    }

    public double getEwmaVariance() {
        return ewmaVariance;
    }

    public double getStdDev() {
        return Math.sqrt(Math.max(0.0, ewmaVariance));
    }

    public long getSampleCount() {
        return sampleCount;
    }

    public int getConsecutiveAnomalies() {
        return consecutiveAnomalies;
    }

    public List<Double> getRecentValues() {
        return recentValues;
    }

    public Instant getLastUpdated() {
        return lastUpdated;
    }

    public boolean isEmpty() {
        return sampleCount == 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof BaselineStat that))
            return false;
        return Double.compare(ewmaMean, that.ewmaMean) == 0
                && Double.compare(ewmaVariance, that.ewmaVariance) == 0
                && sampleCount == that.sampleCount
                && consecutiveAnomalies == that.consecutiveAnomalies
                && key.equals(that.key)
                && recentValues.equals(that.recentValues)
                && Objects.equals(lastUpdated, that.lastUpdated);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, ewmaMean, ewmaVariance, sampleCount);
    }

    @Override
    public String toString() {
        return "BaselineStat{" +
                "key=" + key +
                ", mean=" + ewmaMean +
                ", variance=" + ewmaVariance +
                ", samples=" + sampleCount +
                ", consecutiveAnomalies=" + consecutiveAnomalies +
                '}';
    }
}
