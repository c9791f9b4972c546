package com.apisentinel.core.pipeline;

import com.apisentinel.core.alert.AlertLifecycleManager;
import com.apisentinel.core.baseline.BaselineStore;
import com.apisentinel.core.baseline.StoreUnavailableException;
import com.apisentinel.core.config.SentinelConfig;
import com.apisentinel.core.correlation.CompatibilityTable;
import com.apisentinel.core.correlation.Correlator;
import com.apisentinel.core.detection.DetectorFactory;
import com.apisentinel.core.detection.WindowEvaluator;
import com.apisentinel.core.explain.Explainer;
import com.apisentinel.core.model.Alert;
import com.apisentinel.core.model.DetectionResult;
import com.apisentinel.core.model.WindowAggregate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Runs one closed window through detection and correlation.
 *
 * <h3>Failure handling</h3>
 * <p>
 * A {@link StoreUnavailableException} from the baseline or alert store fails
 * the window open: no alert is produced, the failing component is raised on
 * the {@link DegradedModeIndicator} and the next successful window clears it.
 * Any other failure is logged and counted as {@code analysis_failures}.
 * </p>
 *
 * <p>
 * Windows of one endpoint must be analysed in window-end order; callers
 * serialize them per endpoint.
 * </p>
 *
 * @since 1.0.0
 */
public class EndpointAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(EndpointAnalyzer.class);

    static final String BASELINE_STORE = "baseline-store";
    static final String ALERT_STORE = "alert-store";

    private final WindowEvaluator evaluator;
    private final Correlator correlator;
    private final PipelineCounters counters;
    private final DegradedModeIndicator degraded;

    public EndpointAnalyzer(WindowEvaluator evaluator, Correlator correlator, PipelineCounters counters,
            DegradedModeIndicator degraded) {
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator must not be null");
        this.correlator = Objects.requireNonNull(correlator, "correlator must not be null");
        this.counters = Objects.requireNonNull(counters, "counters must not be null");
        this.degraded = Objects.requireNonNull(degraded, "degraded must not be null");
        counters.register(PipelineCounters.NEAR_MISSES, correlator::getNearMisses);
    }

    /**
     * Wire detector, evaluator, explainer and correlator from configuration.
     *
     * @param config    validated configuration
     * @param baselines baseline store
     * @param lifecycle alert lifecycle manager
     * @param counters  pipeline counters
     * @param degraded  degraded-mode indicator
     * @return a ready analyzer
     */
    public static EndpointAnalyzer create(SentinelConfig config, BaselineStore baselines,
            AlertLifecycleManager lifecycle, PipelineCounters counters, DegradedModeIndicator degraded) {
        WindowEvaluator evaluator = new WindowEvaluator(baselines, DetectorFactory.create(config.getDetector()),
                config);
        Explainer explainer = Explainer.fromConfig(config.getRecommendations(), config.getSeverityBands());
        Correlator correlator = new Correlator(CompatibilityTable.parse(config.getCompatiblePairs()), explainer,
                lifecycle, config.getMinSignalCount(), config.joinTolerance(),
                config.getResolveAfterHealthyWindows(), config.dedupBucket());
        return new EndpointAnalyzer(evaluator, correlator, counters, degraded);
    }

    /**
     * @param window closed window
     * @return the alert created, extended or resolved by this window, if any
     */
    public Optional<Alert> analyze(WindowAggregate window) {
        Objects.requireNonNull(window, "window must not be null");
        counters.increment(PipelineCounters.WINDOWS_CLOSED);

        DetectionResult result;
        try {
            result = evaluator.evaluate(window);
            degraded.clear(BASELINE_STORE);
        } catch (StoreUnavailableException e) {
            degraded.raise(BASELINE_STORE, e.getMessage());
            LOG.warn("Skipping {} [{}] window ending {}: baseline store unavailable", window.getEndpoint(),
                    window.getWindowLabel(), window.getWindowEnd());
            return Optional.empty();
        } catch (RuntimeException e) {
            counters.increment(PipelineCounters.ANALYSIS_FAILURES);
            LOG.error("Evaluation of {} [{}] window ending {} failed", window.getEndpoint(),
                    window.getWindowLabel(), window.getWindowEnd(), e);
            return Optional.empty();
        }
        counters.add(PipelineCounters.SIGNALS_EMITTED, result.getSignals().size());

        try {
            Optional<Alert> alert = correlator.onWindow(result);
            degraded.clear(ALERT_STORE);
            return alert;
        } catch (StoreUnavailableException e) {
            degraded.raise(ALERT_STORE, e.getMessage());
            LOG.warn("No alert decision for {} window ending {}: alert store unavailable", window.getEndpoint(),
                    window.getWindowEnd());
            return Optional.empty();
        } catch (RuntimeException e) {
            counters.increment(PipelineCounters.ANALYSIS_FAILURES);
            LOG.error("Correlation of {} window ending {} failed", window.getEndpoint(), window.getWindowEnd(), e);
            return Optional.empty();
        }
    }

    public Correlator getCorrelator() {
        return correlator;
    }
}
