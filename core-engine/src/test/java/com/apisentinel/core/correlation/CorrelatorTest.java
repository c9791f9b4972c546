package com.apisentinel.core.correlation;

import com.apisentinel.core.alert.AlertLifecycleManager;
import com.apisentinel.core.alert.AlertQuery;
import com.apisentinel.core.alert.InMemoryAlertStore;
import com.apisentinel.core.config.SentinelConfig;
import com.apisentinel.core.explain.Explainer;
import com.apisentinel.core.model.Alert;
import com.apisentinel.core.model.AlertStatus;
import com.apisentinel.core.model.AnomalySignal;
import com.apisentinel.core.model.DetectionResult;
import com.apisentinel.core.model.Direction;
import com.apisentinel.core.model.Metric;
import com.apisentinel.core.model.MetricObservation;
import com.apisentinel.core.model.Severity;
import com.apisentinel.core.model.WindowAggregate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static com.apisentinel.core.WindowFixtures.T0;
import static com.apisentinel.core.WindowFixtures.healthy;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link Correlator}.
 */
class CorrelatorTest {

    private static final String ENDPOINT = "/checkout";

    private AlertLifecycleManager lifecycle;
    private Correlator correlator;

    @BeforeEach
    void setUp() {
        SentinelConfig config = new SentinelConfig();
        lifecycle = new AlertLifecycleManager(new InMemoryAlertStore(),
                Clock.fixed(T0.plus(Duration.ofHours(2)), ZoneOffset.UTC), 200);
        correlator = new Correlator(CompatibilityTable.parse(config.getCompatiblePairs()),
                Explainer.fromConfig(config.getRecommendations(), config.getSeverityBands()),
                lifecycle, 2, Duration.ofMinutes(2), 3, Duration.ofHours(1));
    }

    @Test
    @DisplayName("Should not open an alert for a single metric")
    void shouldNotAlertOnSingleMetric() {
        Optional<Alert> alert = correlator.onWindow(result(10,
                signal(10, Metric.REQUEST_VOLUME, Direction.INCREASE, 9.0)));

        assertThat(alert).isEmpty();
        assertThat(correlator.phaseOf(ENDPOINT)).isEqualTo(EndpointPhase.CANDIDATE);
        assertThat(lifecycle.list(AlertQuery.all())).isEmpty();
    }

    @Test
    @DisplayName("Should not open an alert for latency metrics alone")
    void shouldNotAlertOnLatencyAlone() {
        Optional<Alert> alert = correlator.onWindow(result(10,
                signal(10, Metric.AVG_LATENCY, Direction.INCREASE, 9.0),
                signal(10, Metric.P95_LATENCY, Direction.INCREASE, 9.0)));

        assertThat(alert).isEmpty();
        assertThat(correlator.phaseOf(ENDPOINT)).isEqualTo(EndpointPhase.CANDIDATE);
    }

    @Test
    @DisplayName("Should open an alert when latency and error rate corroborate")
    void shouldOpenAlertOnCorroboration() {
        Optional<Alert> alert = correlator.onWindow(result(10,
                List.of(signal(10, Metric.AVG_LATENCY, Direction.INCREASE, 8.0),
                        signal(10, Metric.ERROR_RATE, Direction.INCREASE, 5.0)),
                List.of(new MetricObservation(Metric.REQUEST_VOLUME, 1000.0, 1005.0, 0.1))));

        assertThat(alert).isPresent();
        Alert opened = alert.get();
        assertThat(opened.getId()).isNotBlank();
        assertThat(opened.getStatus()).isEqualTo(AlertStatus.OPEN);
        assertThat(opened.getSeverity()).isEqualTo(Severity.CRITICAL);
        assertThat(opened.getMetrics()).containsExactlyInAnyOrder(Metric.AVG_LATENCY, Metric.ERROR_RATE);
        assertThat(opened.getWindowStart()).isEqualTo(healthy(ENDPOINT, 10).getWindowStart());
        assertThat(opened.getWindowEnd()).isEqualTo(healthy(ENDPOINT, 10).getWindowEnd());
        assertThat(opened.getExplanation().getStable()).containsExactly(Metric.REQUEST_VOLUME);
        assertThat(correlator.phaseOf(ENDPOINT)).isEqualTo(EndpointPhase.OPEN);
    }

    @Test
    @DisplayName("Should join signals from windows within the join tolerance")
    void shouldJoinAcrossWindows() {
        assertThat(correlator.onWindow(result(10, signal(10, Metric.ERROR_RATE, Direction.INCREASE, 5.0))))
                .isEmpty();

        Optional<Alert> alert = correlator.onWindow(result(11,
                signal(11, Metric.AVG_LATENCY, Direction.INCREASE, 7.0)));

        assertThat(alert).isPresent();
        assertThat(alert.get().getMetrics()).containsExactlyInAnyOrder(Metric.AVG_LATENCY, Metric.ERROR_RATE);
        assertThat(alert.get().getWindowStart()).isEqualTo(healthy(ENDPOINT, 10).getWindowStart());
    }

    @Test
    @DisplayName("Should count a near-miss when a lone signal expires")
    void shouldCountNearMiss() {
        correlator.onWindow(result(10, signal(10, Metric.REQUEST_VOLUME, Direction.INCREASE, 9.0)));
        correlator.onWindow(result(11));
        correlator.onWindow(result(12));
        assertThat(correlator.getNearMisses()).isZero();

        correlator.onWindow(result(13));

        assertThat(correlator.getNearMisses()).isEqualTo(1);
        assertThat(correlator.phaseOf(ENDPOINT)).isEqualTo(EndpointPhase.HEALTHY);
    }

    @Test
    @DisplayName("Should extend the open alert instead of opening another")
    void shouldExtendOpenAlert() {
        Alert opened = openAlert(10);

        Optional<Alert> extended = correlator.onWindow(result(11,
                signal(11, Metric.AVG_LATENCY, Direction.INCREASE, 12.0),
                signal(11, Metric.RESPONSE_SIZE_VARIANCE, Direction.INCREASE, 4.5)));

        assertThat(extended).isPresent();
        assertThat(extended.get().getId()).isEqualTo(opened.getId());
        assertThat(extended.get().getSignals()).hasSize(4);
        assertThat(extended.get().getMetrics()).contains(Metric.RESPONSE_SIZE_VARIANCE);
        assertThat(extended.get().getWindowEnd()).isEqualTo(healthy(ENDPOINT, 11).getWindowEnd());
        assertThat(lifecycle.list(AlertQuery.all())).hasSize(1);
    }

    @Test
    @DisplayName("Should not extend an alert with an uncorroborated metric")
    void shouldIgnoreUnrelatedSignalWhileOpen() {
        Alert opened = openAlert(10);

        Optional<Alert> result = correlator.onWindow(result(11,
                signal(11, Metric.REQUEST_VOLUME, Direction.INCREASE, 9.0)));

        assertThat(result).isEmpty();
        assertThat(lifecycle.get(opened.getId()).orElseThrow().getMetrics())
                .doesNotContain(Metric.REQUEST_VOLUME);
    }

    @Test
    @DisplayName("Should resolve after three healthy windows in a row")
    void shouldResolveAfterHealthyWindows() {
        Alert opened = openAlert(10);

        assertThat(correlator.onWindow(result(11))).isEmpty();
        assertThat(lifecycle.get(opened.getId()).orElseThrow().getConsecutiveHealthyWindows()).isEqualTo(1);
        assertThat(correlator.onWindow(result(12))).isEmpty();
        Optional<Alert> resolved = correlator.onWindow(result(13));

        assertThat(resolved).isPresent();
        assertThat(resolved.get().getStatus()).isEqualTo(AlertStatus.RESOLVED);
        assertThat(correlator.phaseOf(ENDPOINT)).isEqualTo(EndpointPhase.HEALTHY);
    }

    @Test
    @DisplayName("Should restart the healthy count when the degradation returns")
    void shouldResetHealthyCount() {
        Alert opened = openAlert(10);
        correlator.onWindow(result(11));
        correlator.onWindow(result(12));

        correlator.onWindow(result(13, signal(13, Metric.ERROR_RATE, Direction.INCREASE, 5.0)));
        correlator.onWindow(result(14));
        correlator.onWindow(result(15));

        Alert stored = lifecycle.get(opened.getId()).orElseThrow();
        assertThat(stored.getStatus()).isEqualTo(AlertStatus.OPEN);
        assertThat(stored.getConsecutiveHealthyWindows()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should keep an acknowledged alert alive and resolve it later")
    void shouldTrackAcknowledgedAlert() {
        Alert opened = openAlert(10);
        lifecycle.transition(opened.getId(), AlertStatus.ACKNOWLEDGED);

        correlator.onWindow(result(11, signal(11, Metric.AVG_LATENCY, Direction.INCREASE, 9.0)));
        assertThat(correlator.phaseOf(ENDPOINT)).isEqualTo(EndpointPhase.ACKNOWLEDGED);

        correlator.onWindow(result(12));
        correlator.onWindow(result(13));
        correlator.onWindow(result(14));

        assertThat(lifecycle.get(opened.getId()).orElseThrow().getStatus()).isEqualTo(AlertStatus.RESOLVED);
    }

    @Test
    @DisplayName("Should open a fresh alert after an external resolve")
    void shouldStartOverAfterExternalResolve() {
        Alert first = openAlert(10);
        lifecycle.transition(first.getId(), AlertStatus.RESOLVED);

        Alert second = openAlert(11);

        assertThat(second.getId()).isNotEqualTo(first.getId());
        assertThat(lifecycle.list(AlertQuery.all())).hasSize(2);
    }

    @Test
    @DisplayName("Should reject a minimum signal count below two")
    void shouldRejectMinSignalCountBelowTwo() {
        SentinelConfig config = new SentinelConfig();
        assertThatThrownBy(() -> new Correlator(CompatibilityTable.parse(config.getCompatiblePairs()),
                Explainer.fromConfig(config.getRecommendations(), config.getSeverityBands()),
                lifecycle, 1, Duration.ofMinutes(2), 3, Duration.ofHours(1)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("minSignalCount");
    }

    // ---- Helpers ----

    private Alert openAlert(int index) {
        return correlator.onWindow(result(index,
                signal(index, Metric.AVG_LATENCY, Direction.INCREASE, 8.0),
                signal(index, Metric.ERROR_RATE, Direction.INCREASE, 5.0))).orElseThrow();
    }

    private static DetectionResult result(int index, AnomalySignal... signals) {
        return result(index, List.of(signals), List.of());
    }

    private static DetectionResult result(int index, List<AnomalySignal> signals, List<MetricObservation> stable) {
        return new DetectionResult(healthy(ENDPOINT, index), signals, stable);
    }

    private static AnomalySignal signal(int index, Metric metric, Direction direction, double z) {
        WindowAggregate window = healthy(ENDPOINT, index);
        double baseline = window.valueOf(metric).orElse(1.0);
        double current = direction == Direction.INCREASE ? baseline * 3 : baseline / 3;
        return new AnomalySignal(ENDPOINT, metric, window.getWindowSize(), window.getWindowEnd(), baseline, current,
                direction == Direction.INCREASE ? z : -z, direction);
    }
}
