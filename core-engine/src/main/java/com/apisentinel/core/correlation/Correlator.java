package com.apisentinel.core.correlation;

import com.apisentinel.core.alert.AlertLifecycleManager;
import com.apisentinel.core.alert.IllegalStateTransitionException;
import com.apisentinel.core.explain.Explainer;
import com.apisentinel.core.model.Alert;
import com.apisentinel.core.model.AlertStatus;
import com.apisentinel.core.model.AnomalySignal;
import com.apisentinel.core.model.DetectionResult;
import com.apisentinel.core.model.Explanation;
import com.apisentinel.core.model.Metric;
import com.apisentinel.core.model.MetricObservation;
import com.apisentinel.core.model.WindowAggregate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

/**
 * Turns per-window detection results into alerts.
 *
 * <h3>Confirmation</h3>
 * <p>
 * Signals of an endpoint are buffered. A buffered signal expires once a window
 * ending more than {@code joinTolerance} after it arrives; signals that expire
 * unconfirmed are logged as near-misses. An alert is confirmed when the buffer
 * holds at least {@code minSignalCount} distinct metrics and at least one pair
 * from the {@link CompatibilityTable}. Only metrics that take part in a
 * corroborating pair join the alert.
 * </p>
 *
 * <h3>Open alerts</h3>
 * <p>
 * While the endpoint has an active alert, a window with a signal for one of
 * the alert's metrics (or a metric corroborating them) extends the alert. A
 * window of the alert's primary size, its smallest window size, without such
 * a signal is healthy. After {@code resolveAfterHealthyWindows} healthy
 * windows in a row the alert is resolved. The counter lives on the alert. An
 * alert resolved from outside returns the endpoint to
 * {@link EndpointPhase#HEALTHY}.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Results of one endpoint must arrive in window-end order; state transitions
 * of one endpoint are serialized on its state object, and endpoints are
 * independent.
 * </p>
 *
 * @since 1.0.0
 */
public class Correlator {

    private static final Logger LOG = LoggerFactory.getLogger(Correlator.class);

    private final CompatibilityTable table;
    private final Explainer explainer;
    private final AlertLifecycleManager lifecycle;
    private final int minSignalCount;
    private final Duration joinTolerance;
    private final int resolveAfterHealthyWindows;
    private final Duration dedupBucket;
    private final Map<String, EndpointState> states = new ConcurrentHashMap<>();
    private final LongAdder nearMisses = new LongAdder();

    public Correlator(CompatibilityTable table, Explainer explainer, AlertLifecycleManager lifecycle,
            int minSignalCount, Duration joinTolerance, int resolveAfterHealthyWindows, Duration dedupBucket) {
        this.table = Objects.requireNonNull(table, "table must not be null");
        this.explainer = Objects.requireNonNull(explainer, "explainer must not be null");
        this.lifecycle = Objects.requireNonNull(lifecycle, "lifecycle must not be null");
        this.joinTolerance = Objects.requireNonNull(joinTolerance, "joinTolerance must not be null");
        this.dedupBucket = Objects.requireNonNull(dedupBucket, "dedupBucket must not be null");
        if (minSignalCount < 2) {
            throw new IllegalArgumentException("minSignalCount must be >= 2, got: " + minSignalCount);
        }
        if (resolveAfterHealthyWindows < 1) {
            throw new IllegalArgumentException("resolveAfterHealthyWindows must be >= 1, got: "
                    + resolveAfterHealthyWindows);
        }
        this.minSignalCount = minSignalCount;
        this.resolveAfterHealthyWindows = resolveAfterHealthyWindows;
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Advance the endpoint's state machine by one window.
     *
     * @param result evaluation of a closed window
     * @return the alert created, extended or resolved by this window, if any
     */
    public Optional<Alert> onWindow(DetectionResult result) {
        Objects.requireNonNull(result, "result must not be null");
        EndpointState state = states.computeIfAbsent(result.getEndpoint(), EndpointState::new);
        synchronized (state) {
            return advance(state, result);
        }
    }

    /**
     * @param endpoint endpoint
     * @return the endpoint's current phase; {@code HEALTHY} if never seen
     */
    public EndpointPhase phaseOf(String endpoint) {
        EndpointState state = states.get(endpoint);
        if (state == null) {
            return EndpointPhase.HEALTHY;
        }
        synchronized (state) {
            return state.phase;
        }
    }

    public long getNearMisses() {
        return nearMisses.sum();
    }

    // ---------------------------------------------------------------
    // State machine
    // ---------------------------------------------------------------

    private Optional<Alert> advance(EndpointState state, DetectionResult result) {
        for (MetricObservation observation : result.getStable()) {
            state.stable.put(observation.getMetric(), observation);
        }
        for (AnomalySignal signal : result.getSignals()) {
            state.stable.remove(signal.getMetric());
        }

        if (state.phase.isAlerting()) {
            Optional<Alert> active = lifecycle.findActive(state.dedupKey);
            if (active.isPresent()) {
                return onAlerting(state, active.get(), result);
            }
            LOG.info("Alert {} for {} was resolved externally", state.alertId, state.endpoint);
            state.reset();
        }
        return onCandidate(state, result);
    }

    private Optional<Alert> onCandidate(EndpointState state, DetectionResult result) {
        Instant windowEnd = result.getWindow().getWindowEnd();
        expire(state, windowEnd);
        state.buffer.addAll(result.getSignals());
        if (state.buffer.isEmpty()) {
            state.phase = EndpointPhase.HEALTHY;
            return Optional.empty();
        }
        state.phase = EndpointPhase.CANDIDATE;

        Set<Metric> distinct = metricsOf(state.buffer);
        if (distinct.size() < minSignalCount) {
            LOG.debug("{} candidate with {} metric(s): {}", state.endpoint, distinct.size(), distinct);
            return Optional.empty();
        }
        Set<Metric> corroborated = table.corroborated(state.buffer);
        if (corroborated.isEmpty()) {
            LOG.debug("{} candidate metrics {} do not corroborate", state.endpoint, distinct);
            return Optional.empty();
        }

        List<AnomalySignal> joined = new ArrayList<>();
        Instant confirmedAt = null;
        for (AnomalySignal signal : state.buffer) {
            if (corroborated.contains(signal.getMetric())) {
                joined.add(signal);
                confirmedAt = confirmedAt == null || signal.getWindowEnd().isAfter(confirmedAt)
                        ? signal.getWindowEnd()
                        : confirmedAt;
            }
        }
        String dedupKey = DedupKeys.of(state.endpoint, corroborated, confirmedAt, dedupBucket);
        Alert stored = lifecycle.upsert(candidate(state, dedupKey, joined, joined));
        state.buffer.clear();
        state.alertId = stored.getId();
        state.dedupKey = stored.getDedupKey();
        state.phase = phaseFor(stored.getStatus());
        return Optional.of(stored);
    }

    private Optional<Alert> onAlerting(EndpointState state, Alert alert, DetectionResult result) {
        state.phase = phaseFor(alert.getStatus());
        Set<Metric> alertMetrics = alert.getMetrics();
        List<AnomalySignal> matching = new ArrayList<>();
        for (AnomalySignal signal : result.getSignals()) {
            if (alertMetrics.contains(signal.getMetric()) || table.corroborates(signal, alert.getSignals())) {
                matching.add(signal);
            }
        }

        if (!matching.isEmpty()) {
            List<AnomalySignal> all = new ArrayList<>(alert.getSignals());
            all.addAll(matching);
            Alert stored = lifecycle.upsert(candidate(state, state.dedupKey, matching, all));
            state.phase = phaseFor(stored.getStatus());
            return Optional.of(stored);
        }

        WindowAggregate window = result.getWindow();
        if (!window.getWindowSize().equals(primaryWindowSize(alert.getSignals()))) {
            return Optional.empty();
        }
        int healthy = alert.getConsecutiveHealthyWindows() + 1;
        if (healthy < resolveAfterHealthyWindows) {
            lifecycle.recordHealthyWindows(state.dedupKey, healthy);
            LOG.debug("{} healthy window {}/{} for alert {}", state.endpoint, healthy,
                    resolveAfterHealthyWindows, alert.getId());
            return Optional.empty();
        }
        try {
            Alert resolved = lifecycle.transition(alert.getId(), AlertStatus.RESOLVED);
            LOG.info("Alert {} for {} resolved after {} healthy window(s)", alert.getId(), state.endpoint, healthy);
            return Optional.of(resolved);
        } catch (IllegalStateTransitionException e) {
            LOG.info("Alert {} for {} already resolved", alert.getId(), state.endpoint);
            return Optional.empty();
        } finally {
            state.reset();
        }
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    /**
     * @param added signals this candidate contributes
     * @param all   every signal of the resulting alert, for severity and
     *              explanation
     */
    private Alert candidate(EndpointState state, String dedupKey, List<AnomalySignal> added,
            List<AnomalySignal> all) {
        Duration primary = primaryWindowSize(all);
        Explanation explanation = explainer.explain(state.endpoint, primary, all, state.stable.values());
        Instant start = null;
        Instant end = null;
        for (AnomalySignal signal : added) {
            Instant signalStart = signal.getWindowEnd().minus(signal.getWindowSize());
            start = start == null || signalStart.isBefore(start) ? signalStart : start;
            end = end == null || signal.getWindowEnd().isAfter(end) ? signal.getWindowEnd() : end;
        }
        return Alert.builder()
                .endpoint(state.endpoint)
                .dedupKey(dedupKey)
                .signals(added)
                .severity(explainer.severity(all))
                .explanation(explanation)
                .windowStart(start)
                .windowEnd(end)
                .consecutiveHealthyWindows(0)
                .build();
    }

    private void expire(EndpointState state, Instant windowEnd) {
        Iterator<AnomalySignal> it = state.buffer.iterator();
        while (it.hasNext()) {
            AnomalySignal signal = it.next();
            if (signal.getWindowEnd().plus(joinTolerance).isBefore(windowEnd)) {
                it.remove();
                nearMisses.increment();
                LOG.warn("Near-miss on {}: {} {} at {} (z={}) expired without corroboration",
                        state.endpoint, signal.getMetric().key(), signal.getDirection(),
                        signal.getWindowEnd(), signal.getZScore());
            }
        }
    }

    private static Set<Metric> metricsOf(Collection<AnomalySignal> signals) {
        Set<Metric> metrics = EnumSet.noneOf(Metric.class);
        signals.forEach(s -> metrics.add(s.getMetric()));
        return metrics;
    }

    private static Duration primaryWindowSize(Collection<AnomalySignal> signals) {
        Duration smallest = null;
        for (AnomalySignal signal : signals) {
            if (smallest == null || signal.getWindowSize().compareTo(smallest) < 0) {
                smallest = signal.getWindowSize();
            }
        }
        return smallest;
    }

    private static EndpointPhase phaseFor(AlertStatus status) {
        return status == AlertStatus.ACKNOWLEDGED ? EndpointPhase.ACKNOWLEDGED : EndpointPhase.OPEN;
    }

    private static final class EndpointState {
        private final String endpoint;
        private final List<AnomalySignal> buffer = new ArrayList<>();
        private final Map<Metric, MetricObservation> stable = new EnumMap<>(Metric.class);
        private EndpointPhase phase = EndpointPhase.HEALTHY;
        private String alertId;
        private String dedupKey;

        EndpointState(String endpoint) {
            this.endpoint = endpoint;
        }

        void reset() {
            phase = EndpointPhase.HEALTHY;
            alertId = null;
            dedupKey = null;
            buffer.clear();
        }
    }
}
