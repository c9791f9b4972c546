package com.apisentinel.core.config;

import java.io.Serializable;

/**
 * Baseline and threshold tuning of a single metric.
 *
 * <p>
 * The effective standard deviation used for z-scores is
 * {@code max(sqrt(variance), minStdDev, minRelativeStdDev × |mean|)}. The two
 * floors stop perfectly flat baselines from turning every small wobble into an
 * anomaly.
 * </p>
 *
 * @since 1.0.0
 */
public class MetricSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    /** EWMA smoothing factor in (0, 1]. */
    private double alpha = 0.2;

    /** Minimum |z| for a deviation to be flagged. */
    private double zThreshold = 3.0;

    /** Absolute floor for the standard deviation, in the metric's unit. */
    private double minStdDev;

    /** Floor for the standard deviation relative to the baseline mean. */
    private double minRelativeStdDev = 0.05;

    public MetricSettings() {
    }

    public MetricSettings(double alpha, double zThreshold, double minStdDev, double minRelativeStdDev) {
        this.alpha = alpha;
        this.zThreshold = zThreshold;
        this.minStdDev = minStdDev;
        this.minRelativeStdDev = minRelativeStdDev;
    }

    public double getAlpha() {
        return alpha;
    }

    public void setAlpha(double alpha) {
        this.alpha = alpha;
    }

    public double getZThreshold() {
        return zThreshold;
    }

    public void setZThreshold(double zThreshold) {
        this.zThreshold = zThreshold;
    }

    public double getMinStdDev() {
        return minStdDev;
    }

    public void setMinStdDev(double minStdDev) {
        this.minStdDev = minStdDev;
    }

    public double getMinRelativeStdDev() {
        return minRelativeStdDev;
    }

    public void setMinRelativeStdDev(double minRelativeStdDev) {
        this.minRelativeStdDev = minRelativeStdDev;
    }

    @Override
    public String toString() {
        return "MetricSettings{" +
                "alpha=" + alpha +
                ", zThreshold=" + zThreshold +
                ", minStdDev=" + minStdDev +
                ", minRelativeStdDev=" + minRelativeStdDev +
                '}';
    }
}
