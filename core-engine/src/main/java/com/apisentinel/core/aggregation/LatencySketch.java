package com.apisentinel.core.aggregation;

import java.util.Map;
import java.util.TreeMap;

/**
 * Quantile sketch with logarithmically sized buckets.
 *
 * <p>
 * A value {@code v > 0} lands in bucket {@code ceil(log_γ(v))} with
 * {@code γ = (1 + α) / (1 − α)}; a bucket is reported as
 * {@code 2γ^i / (γ + 1)}, which is within relative error {@code α} of every
 * value it holds. Bucket counts commute, so the estimate does not depend on
 * the order in which values were added or sketches merged.
 * </p>
 *
 * <p>
 * Not thread-safe; the owning accumulator is guarded by its slot lock.
 * </p>
 *
 * @since 1.0.0
 */
public final class LatencySketch {

    public static final double DEFAULT_RELATIVE_ACCURACY = 0.01;

    /** Values at or below this are counted as zero. */
    private static final double MIN_INDEXABLE = 1e-9;

    private final double relativeAccuracy;
    private final double gamma;
    private final double logGamma;
    private final TreeMap<Integer, Long> buckets = new TreeMap<>();
    private long zeroCount;
    private long count;

    public LatencySketch() {
        this(DEFAULT_RELATIVE_ACCURACY);
    }

    /**
     * @param relativeAccuracy relative error bound, in (0, 1)
     */
    public LatencySketch(double relativeAccuracy) {
        if (relativeAccuracy <= 0.0 || relativeAccuracy >= 1.0) {
            throw new IllegalArgumentException("relativeAccuracy must be in (0, 1), got " + relativeAccuracy);
        }
        this.relativeAccuracy = relativeAccuracy;
        this.gamma = (1.0 + relativeAccuracy) / (1.0 - relativeAccuracy);
        this.logGamma = Math.log(gamma);
    }

    public void add(double value) {
        if (value <= MIN_INDEXABLE) {
            zeroCount++;
        } else {
            int index = (int) Math.ceil(Math.log(value) / logGamma);
            buckets.merge(index, 1L, Long::sum);
        }
        count++;
    }

    /**
     * Fold another sketch with the same accuracy into this one.
     *
     * @param other sketch to merge
     */
    public void merge(LatencySketch other) {
        if (Double.compare(other.relativeAccuracy, relativeAccuracy) != 0) {
            throw new IllegalArgumentException("Cannot merge sketches with different accuracy: "
                    + relativeAccuracy + " vs " + other.relativeAccuracy);
        }
        other.buckets.forEach((index, n) -> buckets.merge(index, n, Long::sum));
        zeroCount += other.zeroCount;
        count += other.count;
    }

    /**
     * @param q quantile in [0, 1]
     * @return the estimated quantile, or 0 for an empty sketch
     */
    public double quantile(double q) {
        if (q < 0.0 || q > 1.0) {
            throw new IllegalArgumentException("Quantile must be in [0, 1], got " + q);
        }
        if (count == 0) {
            return 0.0;
        }
        double rank = q * (count - 1);
        long seen = zeroCount;
        if (seen > rank) {
            return 0.0;
        }
        for (Map.Entry<Integer, Long> bucket : buckets.entrySet()) {
            seen += bucket.getValue();
            if (seen > rank) {
                return valueOf(bucket.getKey());
            }
        }
        return valueOf(buckets.lastKey());
    }

    public long getCount() {
        return count;
    }

    public double getRelativeAccuracy() {
        return relativeAccuracy;
    }

    private double valueOf(int index) {
        return 2.0 * Math.pow(gamma, index) / (gamma + 1.0);
    }
}
