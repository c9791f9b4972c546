package com.apisentinel.core.detection;

import com.apisentinel.core.model.Metric;

/**
 * Verdict of an {@link AnomalyDetector} on one metric value.
 *
 * <ul>
 * <li>{@code zScore}: EWMA z-score, {@code NaN} when undefined; always
 * reported so severity is comparable across strategies</li>
 * <li>{@code score}: strategy-specific score ({@code |z|} for EWMA, the
 * isolation score in [0, 1] for the isolation strategy)</li>
 * <li>{@code anomalous}: whether the strategy flags the value</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class MetricScore {

    private final Metric metric;
    private final double value;
    private final double zScore;
    private final double score;
    private final boolean anomalous;

    public MetricScore(Metric metric, double value, double zScore, double score, boolean anomalous) {
        this.metric = metric;
        this.value = value;
        this.zScore = zScore;
        this.score = score;
        this.anomalous = anomalous;
    }

    public Metric getMetric() {
        return metric;
    }

    public double getValue() {
        return value;
    }

    public double getZScore() {
        return zScore;
    }

    public double getScore() {
        return score;
    }

    public boolean isAnomalous() {
        return anomalous;
    }

    @Override
    public String toString() {
        return "MetricScore{" + metric + "=" + value + ", z=" + zScore + ", score=" + score
                + (anomalous ? ", ANOMALOUS" : "") + '}';
    }
}
