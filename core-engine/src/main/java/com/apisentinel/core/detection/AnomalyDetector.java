package com.apisentinel.core.detection;

import com.apisentinel.core.config.MetricSettings;
import com.apisentinel.core.model.BaselineStat;
import com.apisentinel.core.model.Metric;

/**
 * Contract for anomaly detection strategies.
 *
 * <p>
 * Implementations are <strong>stateless</strong>: all history lives in the
 * {@link BaselineStat} passed in, which the {@link WindowEvaluator} reads from
 * and writes back to the baseline store. One detector instance therefore
 * serves every endpoint and metric, and may be called concurrently.
 * </p>
 *
 * <p>
 * Direction filtering and the cold-start guard are applied by the evaluator;
 * a detector only judges whether the value is unusual.
 * </p>
 */
public interface AnomalyDetector {

    /**
     * Score a value against its baseline.
     *
     * @param metric   the metric observed
     * @param value    the window's value for the metric
     * @param baseline baseline before this observation
     * @param settings tuning of the metric
     * @return the verdict; never {@code null}
     */
    MetricScore score(Metric metric, double value, BaselineStat baseline, MetricSettings settings);

    /**
     * @return strategy name as used in configuration
     */
    String getName();
}
