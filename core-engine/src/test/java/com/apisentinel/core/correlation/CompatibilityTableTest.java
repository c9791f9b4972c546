package com.apisentinel.core.correlation;

import com.apisentinel.core.config.SentinelConfig;
import com.apisentinel.core.model.AnomalySignal;
import com.apisentinel.core.model.Direction;
import com.apisentinel.core.model.Metric;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link CompatibilityTable} and {@link MetricPattern}.
 */
class CompatibilityTableTest {

    private CompatibilityTable table;

    @BeforeEach
    void setUp() {
        table = CompatibilityTable.parse(SentinelConfig.DEFAULT_COMPATIBLE_PAIRS);
    }

    @Test
    @DisplayName("Should parse the default pairs")
    void shouldParseDefaults() {
        assertThat(table.size()).isEqualTo(5);
    }

    @Test
    @DisplayName("Should corroborate latency with error rate")
    void shouldCorroborateLatencyAndErrors() {
        List<AnomalySignal> signals = List.of(
                signal(Metric.AVG_LATENCY, Direction.INCREASE),
                signal(Metric.P95_LATENCY, Direction.INCREASE),
                signal(Metric.ERROR_RATE, Direction.INCREASE));

        assertThat(table.corroborated(signals))
                .containsExactlyInAnyOrder(Metric.AVG_LATENCY, Metric.P95_LATENCY, Metric.ERROR_RATE);
    }

    @Test
    @DisplayName("Should never let the two latency metrics corroborate each other")
    void shouldNotCorroborateLatencyAlone() {
        List<AnomalySignal> signals = List.of(
                signal(Metric.AVG_LATENCY, Direction.INCREASE),
                signal(Metric.P95_LATENCY, Direction.INCREASE));

        assertThat(table.corroborated(signals)).isEmpty();
    }

    @Test
    @DisplayName("Should respect the direction constraint of a pair")
    void shouldRespectDirection() {
        AnomalySignal errors = signal(Metric.ERROR_RATE, Direction.INCREASE);

        assertThat(table.corroborated(List.of(signal(Metric.REQUEST_VOLUME, Direction.INCREASE), errors)))
                .isEmpty();
        assertThat(table.corroborated(List.of(signal(Metric.REQUEST_VOLUME, Direction.DECREASE), errors)))
                .containsExactlyInAnyOrder(Metric.REQUEST_VOLUME, Metric.ERROR_RATE);
    }

    @Test
    @DisplayName("Should leave uncorroborated metrics out of the result")
    void shouldExcludeBystanders() {
        List<AnomalySignal> signals = List.of(
                signal(Metric.AVG_LATENCY, Direction.INCREASE),
                signal(Metric.ERROR_RATE, Direction.INCREASE),
                signal(Metric.REQUEST_VOLUME, Direction.INCREASE));

        assertThat(table.corroborated(signals)).doesNotContain(Metric.REQUEST_VOLUME);
    }

    @Test
    @DisplayName("Should tell whether a new signal corroborates confirmed ones")
    void shouldCheckCorroborationAgainstConfirmed() {
        List<AnomalySignal> confirmed = List.of(
                signal(Metric.AVG_LATENCY, Direction.INCREASE),
                signal(Metric.ERROR_RATE, Direction.INCREASE));

        assertThat(table.corroborates(signal(Metric.RESPONSE_SIZE_VARIANCE, Direction.INCREASE), confirmed))
                .isTrue();
        assertThat(table.corroborates(signal(Metric.REQUEST_VOLUME, Direction.INCREASE), confirmed)).isFalse();
        assertThat(table.corroborates(signal(Metric.AVG_LATENCY, Direction.INCREASE),
                List.of(signal(Metric.AVG_LATENCY, Direction.INCREASE)))).isFalse();
    }

    @Test
    @DisplayName("Should reject a pair without exactly two sides")
    void shouldRejectMalformedPair() {
        assertThatThrownBy(() -> CompatibilityTable.parse(List.of("latency + error_rate + request_volume")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Invalid compatible pair");
    }

    @Test
    @DisplayName("Should reject a pair made only of latency metrics")
    void shouldRejectLatencyPair() {
        assertThatThrownBy(() -> CompatibilityTable.parse(List.of("avg_latency + p95_latency")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("latency metrics cannot corroborate each other");
    }

    @Test
    @DisplayName("Should parse metric patterns with and without direction")
    void shouldParsePatterns() {
        MetricPattern latency = MetricPattern.parse(" Latency ");
        MetricPattern volumeDrop = MetricPattern.parse("request_volume:decrease");

        assertThat(latency.covers(Metric.AVG_LATENCY)).isTrue();
        assertThat(latency.covers(Metric.P95_LATENCY)).isTrue();
        assertThat(latency.matches(Metric.AVG_LATENCY, Direction.DECREASE)).isTrue();
        assertThat(volumeDrop.matches(Metric.REQUEST_VOLUME, Direction.DECREASE)).isTrue();
        assertThat(volumeDrop.matches(Metric.REQUEST_VOLUME, Direction.INCREASE)).isFalse();
        assertThatThrownBy(() -> MetricPattern.parse("cpu")).isInstanceOf(IllegalArgumentException.class);
    }

    // ---- Helpers ----

    private static AnomalySignal signal(Metric metric, Direction direction) {
        double current = direction == Direction.INCREASE ? 200.0 : 50.0;
        return new AnomalySignal("/checkout", metric, Duration.ofMinutes(1), Instant.parse("2026-01-01T00:10:00Z"),
                100.0, current, direction == Direction.INCREASE ? 8.0 : -8.0, direction);
    }
}
