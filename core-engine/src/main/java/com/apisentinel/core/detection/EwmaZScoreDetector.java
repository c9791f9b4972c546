package com.apisentinel.core.detection;

import com.apisentinel.core.config.MetricSettings;
import com.apisentinel.core.model.BaselineStat;
import com.apisentinel.core.model.Metric;

import java.util.Objects;

/**
 * Flags a value when its EWMA z-score reaches the metric's threshold:
 * {@code |z| >= zThreshold}.
 *
 * @since 1.0.0
 */
public class EwmaZScoreDetector implements AnomalyDetector {

    public static final String NAME = "ewma";

    @Override
    public MetricScore score(Metric metric, double value, BaselineStat baseline, MetricSettings settings) {
        Objects.requireNonNull(baseline, "baseline must not be null");
        Objects.requireNonNull(settings, "settings must not be null");
        double z = Ewma.zScore(value, baseline, settings);
        if (Double.isNaN(z)) {
            return new MetricScore(metric, value, z, 0.0, false);
        }
        double absZ = Math.abs(z);
        return new MetricScore(metric, value, z, absZ, absZ >= settings.getZThreshold());
    }

    @Override
    public String getName() {
        return NAME;
    }
}
