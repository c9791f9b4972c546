package com.apisentinel.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of evaluating one {@link WindowAggregate} against its baselines.
 *
 * <p>
 * {@code signals} holds the flagged metrics; {@code stable} holds every metric
 * that had a usable baseline and stayed within its threshold. Metrics still in
 * their cold-start period appear in neither list.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectionResult {

    private final WindowAggregate window;
    private final List<AnomalySignal> signals;
    private final List<MetricObservation> stable;

    public DetectionResult(WindowAggregate window, List<AnomalySignal> signals,
            List<MetricObservation> stable) {
        this.window = Objects.requireNonNull(window, "window must not be null");
        this.signals = Collections.unmodifiableList(new ArrayList<>(signals));
        this.stable = Collections.unmodifiableList(new ArrayList<>(stable));
    }

    /**
     * @param window the evaluated window
     * @return a result with neither signals nor observations, used when the
     *         baseline store could not be reached
     */
    public static DetectionResult empty(WindowAggregate window) {
        return new DetectionResult(window, List.of(), List.of());
    }

    public WindowAggregate getWindow() {
        return window;
    }

    public String getEndpoint() {
        return window.getEndpoint();
    }

    public List<AnomalySignal> getSignals() {
        return signals;
    }

    public List<MetricObservation> getStable() {
        return stable;
    }

    public boolean hasSignals() {
        return !signals.isEmpty();
    }

    @Override
    public String toString() {
        return "DetectionResult{" +
                "window=" + window.getEndpoint() + "@" + window.getWindowEnd() +
                ", signals=" + signals.size() +
                ", stable=" + stable.size() +
                '}';
    }
}
