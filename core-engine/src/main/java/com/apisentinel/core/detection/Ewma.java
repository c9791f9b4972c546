package com.apisentinel.core.detection;

import com.apisentinel.core.config.MetricSettings;
import com.apisentinel.core.model.BaselineStat;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Exponentially weighted mean and variance.
 *
 * <pre>
 * mean' = mean + α·(x − mean)
 * var'  = (1 − α)·(var + α·(x − mean)²)
 * </pre>
 *
 * <p>
 * The first observation initialises {@code mean = x, var = 0}. All methods are
 * pure: they return a new {@link BaselineStat}.
 * </p>
 *
 * @since 1.0.0
 */
public final class Ewma {

    /** Denominators below this yield no z-score. */
    public static final double MIN_DENOMINATOR = 1e-9;

    private Ewma() {
        // utility class, not instantiable
    }

    /**
     * Fold a healthy observation into the baseline.
     *
     * @param stat        current baseline
     * @param x           observed value
     * @param alpha       smoothing factor in (0, 1]
     * @param at          observation time (window end)
     * @param recentLimit maximum number of recent values kept
     * @return updated baseline with {@code consecutiveAnomalies} reset
     */
    public static BaselineStat observe(BaselineStat stat, double x, double alpha, Instant at, int recentLimit) {
        return new BaselineStat(stat.getKey(), nextMean(stat, x, alpha), nextVariance(stat, x, alpha),
                stat.getSampleCount() + 1, 0, appendBounded(stat.getRecentValues(), x, recentLimit), at);
    }

    /**
     * Record an anomalous observation without touching mean or variance.
     *
     * @param stat current baseline
     * @param at   observation time
     * @return baseline with {@code consecutiveAnomalies} incremented
     */
    public static BaselineStat markAnomalous(BaselineStat stat, Instant at) {
        return new BaselineStat(stat.getKey(), stat.getEwmaMean(), stat.getEwmaVariance(),
                stat.getSampleCount(), stat.getConsecutiveAnomalies() + 1, stat.getRecentValues(), at);
    }

    /**
     * Slowly adapt to a persistent shift: update with a reduced α while still
     * counting the observation as anomalous.
     *
     * @param stat          current baseline
     * @param x             observed value
     * @param dampenedAlpha reduced smoothing factor
     * @param at            observation time
     * @return adapted baseline
     */
    public static BaselineStat dampened(BaselineStat stat, double x, double dampenedAlpha, Instant at) {
        return new BaselineStat(stat.getKey(), nextMean(stat, x, dampenedAlpha),
                nextVariance(stat, x, dampenedAlpha), stat.getSampleCount() + 1,
                stat.getConsecutiveAnomalies() + 1, stat.getRecentValues(), at);
    }

    /**
     * @return {@code max(sqrt(var), minStdDev, minRelativeStdDev·|mean|)}
     */
    public static double effectiveStdDev(BaselineStat stat, MetricSettings settings) {
        return Math.max(stat.getStdDev(), Math.max(settings.getMinStdDev(),
                settings.getMinRelativeStdDev() * Math.abs(stat.getEwmaMean())));
    }

    /**
     * @param x        observed value
     * @param stat     baseline before the observation
     * @param settings metric tuning
     * @return z-score of {@code x}, or {@link Double#NaN} for an empty baseline
     *         or a degenerate denominator
     */
    public static double zScore(double x, BaselineStat stat, MetricSettings settings) {
        if (stat.isEmpty()) {
            return Double.NaN;
        }
        double denominator = effectiveStdDev(stat, settings);
        if (denominator < MIN_DENOMINATOR) {
            return Double.NaN;
        }
        return (x - stat.getEwmaMean()) / denominator;
    }

    private static double nextMean(BaselineStat stat, double x, double alpha) {
        if (stat.isEmpty()) {
            return x;
        }
        return stat.getEwmaMean() + alpha * (x - stat.getEwmaMean());
    }

    private static double nextVariance(BaselineStat stat, double x, double alpha) {
        if (stat.isEmpty()) {
            return 0.0;
        }
        double diff = x - stat.getEwmaMean();
        return (1.0 - alpha) * (stat.getEwmaVariance() + alpha * diff * diff);
    }

    private static List<Double> appendBounded(List<Double> values, double x, int limit) {
        List<Double> next = new ArrayList<>(values.size() + 1);
        next.addAll(values);
        next.add(x);
        while (next.size() > limit) {
            next.remove(0);
        }
        return next;
    }
}
