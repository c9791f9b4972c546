package com.apisentinel.core.detection;

import com.apisentinel.core.baseline.BaselineStore;
import com.apisentinel.core.config.MetricSettings;
import com.apisentinel.core.config.SentinelConfig;
import com.apisentinel.core.model.AnomalySignal;
import com.apisentinel.core.model.BaselineKey;
import com.apisentinel.core.model.BaselineStat;
import com.apisentinel.core.model.DetectionResult;
import com.apisentinel.core.model.Direction;
import com.apisentinel.core.model.Metric;
import com.apisentinel.core.model.MetricObservation;
import com.apisentinel.core.model.WindowAggregate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Scores every metric of a closed window against its baseline and updates the
 * baseline.
 *
 * <h3>Per metric</h3>
 * <ol>
 * <li>Read-and-replace the {@code (endpoint, windowSize, metric)} baseline
 * atomically through {@link BaselineStore#update}.</li>
 * <li>Ask the {@link AnomalyDetector} for a verdict.</li>
 * <li>Flag only when the baseline has at least {@code minSamples}
 * observations and the deviation direction is reportable for the metric.</li>
 * <li>Healthy and cold-start observations update mean and variance. Flagged
 * observations leave them untouched, unless the metric has been anomalous for
 * {@code coldRecoveryCycles} windows in a row, in which case a dampened update
 * lets the baseline follow a persistent shift.</li>
 * </ol>
 *
 * <p>
 * Metrics undefined for the window (latency of an empty window) are skipped.
 * Store failures propagate as
 * {@link com.apisentinel.core.baseline.StoreUnavailableException}.
 * </p>
 *
 * @since 1.0.0
 */
public class WindowEvaluator {

    private static final Logger LOG = LoggerFactory.getLogger(WindowEvaluator.class);

    private final BaselineStore store;
    private final AnomalyDetector detector;
    private final Map<Metric, MetricSettings> settings;
    private final int minSamples;
    private final int coldRecoveryCycles;
    private final double dampenedAlphaFactor;
    private final int recentValuesSize;

    public WindowEvaluator(BaselineStore store, AnomalyDetector detector, SentinelConfig config) {
        this(store, detector, config.metricSettings(), config.getMinSamples(), config.getColdRecoveryCycles(),
                config.getDampenedAlphaFactor(), config.getDetector().getRecentValuesSize());
    }

    public WindowEvaluator(BaselineStore store, AnomalyDetector detector, Map<Metric, MetricSettings> settings,
            int minSamples, int coldRecoveryCycles, double dampenedAlphaFactor, int recentValuesSize) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.detector = Objects.requireNonNull(detector, "detector must not be null");
        this.settings = Map.copyOf(Objects.requireNonNull(settings, "settings must not be null"));
        this.minSamples = minSamples;
        this.coldRecoveryCycles = coldRecoveryCycles;
        this.dampenedAlphaFactor = dampenedAlphaFactor;
        this.recentValuesSize = recentValuesSize;
    }

    /**
     * @param window closed window; must not be {@code null}
     * @return the window's signals and its stable (warm, unflagged) metrics
     */
    public DetectionResult evaluate(WindowAggregate window) {
        Objects.requireNonNull(window, "window must not be null");
        List<AnomalySignal> signals = new ArrayList<>();
        List<MetricObservation> stable = new ArrayList<>();

        for (Metric metric : Metric.values()) {
            OptionalDouble value = window.valueOf(metric);
            if (value.isEmpty()) {
                continue;
            }
            Outcome outcome = evaluateMetric(window, metric, value.getAsDouble());
            if (outcome.signal != null) {
                signals.add(outcome.signal);
            } else if (outcome.observation != null) {
                stable.add(outcome.observation);
            }
        }

        if (!signals.isEmpty()) {
            LOG.debug("{} [{}] window ending {}: {} signal(s) {}", window.getEndpoint(), window.getWindowLabel(),
                    window.getWindowEnd(), signals.size(), signals);
        }
        return new DetectionResult(window, signals, stable);
    }

    private Outcome evaluateMetric(WindowAggregate window, Metric metric, double x) {
        MetricSettings tuning = settings.get(metric);
        BaselineKey key = BaselineKey.of(window, metric);
        // the store may retry the function; keep only the last attempt
        Outcome[] holder = new Outcome[1];
        store.update(key, current -> {
            MetricScore score = detector.score(metric, x, current, tuning);
            boolean warm = current.getSampleCount() >= minSamples;
            Direction direction = Direction.of(x, current.getEwmaMean());
            boolean flagged = warm && score.isAnomalous() && metric.isReportable(direction);

            BaselineStat next;
            Outcome outcome = new Outcome();
            if (flagged) {
                outcome.signal = new AnomalySignal(window.getEndpoint(), metric, window.getWindowSize(),
                        window.getWindowEnd(), current.getEwmaMean(), x, score.getZScore(), direction);
                if (current.getConsecutiveAnomalies() + 1 >= coldRecoveryCycles) {
                    next = Ewma.dampened(current, x, tuning.getAlpha() * dampenedAlphaFactor, window.getWindowEnd());
                } else {
                    next = Ewma.markAnomalous(current, window.getWindowEnd());
                }
            } else {
                if (warm) {
                    double z = Double.isNaN(score.getZScore()) ? 0.0 : score.getZScore();
                    outcome.observation = new MetricObservation(metric, current.getEwmaMean(), x, z);
                }
                next = Ewma.observe(current, x, tuning.getAlpha(), window.getWindowEnd(), recentValuesSize);
            }
            holder[0] = outcome;
            return next;
        });
        return holder[0];
    }

    private static final class Outcome {
        private AnomalySignal signal;
        private MetricObservation observation;
    }
}
