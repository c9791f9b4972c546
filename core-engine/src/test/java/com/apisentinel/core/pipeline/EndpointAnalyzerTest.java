package com.apisentinel.core.pipeline;

import com.apisentinel.core.alert.AlertLifecycleManager;
import com.apisentinel.core.alert.AlertQuery;
import com.apisentinel.core.alert.InMemoryAlertStore;
import com.apisentinel.core.baseline.BaselineStore;
import com.apisentinel.core.baseline.InMemoryBaselineStore;
import com.apisentinel.core.baseline.StoreUnavailableException;
import com.apisentinel.core.config.SentinelConfig;
import com.apisentinel.core.correlation.EndpointPhase;
import com.apisentinel.core.model.Alert;
import com.apisentinel.core.model.AlertStatus;
import com.apisentinel.core.model.BaselineKey;
import com.apisentinel.core.model.BaselineStat;
import com.apisentinel.core.model.Metric;
import com.apisentinel.core.model.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.function.UnaryOperator;

import static com.apisentinel.core.WindowFixtures.T0;
import static com.apisentinel.core.WindowFixtures.degraded;
import static com.apisentinel.core.WindowFixtures.healthy;
import static com.apisentinel.core.WindowFixtures.volumeSpike;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link EndpointAnalyzer}, driving the detection and
 * correlation stages with ready-made windows.
 */
class EndpointAnalyzerTest {

    private static final String ENDPOINT = "/checkout";
    private static final int WARM_UP = 20;

    private SwitchableBaselineStore baselines;
    private AlertLifecycleManager lifecycle;
    private PipelineCounters counters;
    private DegradedModeIndicator degraded;
    private EndpointAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        SentinelConfig config = new SentinelConfig();
        baselines = new SwitchableBaselineStore();
        lifecycle = new AlertLifecycleManager(new InMemoryAlertStore(),
                Clock.fixed(T0.plus(Duration.ofHours(1)), ZoneOffset.UTC), config.getMaxSignalsPerAlert());
        counters = new PipelineCounters();
        degraded = new DegradedModeIndicator();
        analyzer = EndpointAnalyzer.create(config, baselines, lifecycle, counters, degraded);
    }

    @Test
    @DisplayName("Should open one critical alert for a latency and error rate degradation")
    void shouldAlertOnCheckoutDegradation() {
        warmUp();

        Optional<Alert> opened = analyzer.analyze(degraded(ENDPOINT, WARM_UP, 1));

        assertThat(opened).isPresent();
        Alert alert = opened.get();
        assertThat(alert.getSeverity()).isEqualTo(Severity.CRITICAL);
        assertThat(alert.getMetrics())
                .containsExactlyInAnyOrder(Metric.AVG_LATENCY, Metric.P95_LATENCY, Metric.ERROR_RATE);
        assertThat(alert.getExplanation().getStable())
                .containsExactlyInAnyOrder(Metric.REQUEST_VOLUME, Metric.RESPONSE_SIZE_VARIANCE);
        assertThat(alert.getExplanation().getSummary())
                .contains("for /checkout over 1m")
                .contains("remained stable");
        assertThat(alert.getExplanation().getRecommendations())
                .contains("Check backend services and database health.");

        for (int step = 2; step <= 5; step++) {
            Optional<Alert> extended = analyzer.analyze(degraded(ENDPOINT, WARM_UP + step - 1, step));
            assertThat(extended).map(Alert::getId).hasValue(alert.getId());
        }

        assertThat(lifecycle.list(AlertQuery.all())).hasSize(1);
        assertThat(counters.get(PipelineCounters.WINDOWS_CLOSED)).isEqualTo(WARM_UP + 5);
        assertThat(counters.get(PipelineCounters.SIGNALS_EMITTED)).isEqualTo(15);
    }

    @Test
    @DisplayName("Should resolve once the endpoint is healthy for three windows")
    void shouldResolveAfterRecovery() {
        warmUp();
        Alert alert = analyzer.analyze(degraded(ENDPOINT, WARM_UP, 1)).orElseThrow();
        for (int step = 2; step <= 5; step++) {
            analyzer.analyze(degraded(ENDPOINT, WARM_UP + step - 1, step));
        }

        assertThat(analyzer.analyze(healthy(ENDPOINT, 25))).isEmpty();
        assertThat(analyzer.analyze(healthy(ENDPOINT, 26))).isEmpty();
        Optional<Alert> resolved = analyzer.analyze(healthy(ENDPOINT, 27));

        assertThat(resolved).isPresent();
        assertThat(resolved.get().getId()).isEqualTo(alert.getId());
        assertThat(resolved.get().getStatus()).isEqualTo(AlertStatus.RESOLVED);
        assertThat(analyzer.getCorrelator().phaseOf(ENDPOINT)).isEqualTo(EndpointPhase.HEALTHY);
    }

    @Test
    @DisplayName("Should not alert on a traffic spike alone")
    void shouldNotAlertOnVolumeSpike() {
        warmUp();

        assertThat(analyzer.analyze(volumeSpike(ENDPOINT, WARM_UP, 3))).isEmpty();
        for (int i = WARM_UP + 1; i <= WARM_UP + 3; i++) {
            assertThat(analyzer.analyze(healthy(ENDPOINT, i))).isEmpty();
        }

        assertThat(lifecycle.list(AlertQuery.all())).isEmpty();
        assertThat(counters.get(PipelineCounters.SIGNALS_EMITTED)).isEqualTo(1);
        assertThat(counters.get(PipelineCounters.NEAR_MISSES)).isEqualTo(1);
    }

    @Test
    @DisplayName("Should fail open while the baseline store is unavailable")
    void shouldFailOpenOnStoreOutage() {
        warmUp();
        baselines.down = true;

        Optional<Alert> during = analyzer.analyze(degraded(ENDPOINT, WARM_UP, 1));

        assertThat(during).isEmpty();
        assertThat(degraded.isDegraded()).isTrue();
        assertThat(degraded.reasons()).containsKey(EndpointAnalyzer.BASELINE_STORE);

        baselines.down = false;
        Optional<Alert> after = analyzer.analyze(degraded(ENDPOINT, WARM_UP + 1, 2));

        assertThat(after).isPresent();
        assertThat(degraded.isDegraded()).isFalse();
    }

    @Test
    @DisplayName("Should stay quiet while baselines are still warming up")
    void shouldNotAlertDuringWarmUp() {
        for (int i = 0; i < 5; i++) {
            analyzer.analyze(healthy(ENDPOINT, i));
        }

        assertThat(analyzer.analyze(degraded(ENDPOINT, 5, 3))).isEmpty();
        assertThat(counters.get(PipelineCounters.SIGNALS_EMITTED)).isZero();
    }

    // ---- Helpers ----

    private void warmUp() {
        for (int i = 0; i < WARM_UP; i++) {
            assertThat(analyzer.analyze(healthy(ENDPOINT, i))).isEmpty();
        }
    }

    /** In-memory baselines that can be switched off to simulate an outage. */
    private static final class SwitchableBaselineStore implements BaselineStore {

        private final InMemoryBaselineStore delegate = new InMemoryBaselineStore();
        private volatile boolean down;

        @Override
        public Optional<BaselineStat> get(BaselineKey key) {
            check();
            return delegate.get(key);
        }

        @Override
        public BaselineStat update(BaselineKey key, UnaryOperator<BaselineStat> fn) {
            check();
            return delegate.update(key, fn);
        }

        @Override
        public int size() {
            return delegate.size();
        }

        private void check() {
            if (down) {
                throw new StoreUnavailableException("baseline store connection refused");
            }
        }
    }
}
