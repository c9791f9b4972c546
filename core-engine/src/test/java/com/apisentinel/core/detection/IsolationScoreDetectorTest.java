package com.apisentinel.core.detection;

import com.apisentinel.core.config.MetricSettings;
import com.apisentinel.core.model.BaselineKey;
import com.apisentinel.core.model.BaselineStat;
import com.apisentinel.core.model.Metric;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link IsolationScoreDetector}.
 */
class IsolationScoreDetectorTest {

    private static final BaselineKey KEY = new BaselineKey("/checkout", Duration.ofMinutes(1), Metric.AVG_LATENCY);
    private static final MetricSettings SETTINGS = new MetricSettings(0.2, 3.0, 5.0, 0.05);

    private IsolationScoreDetector detector;
    private List<Double> history;

    @BeforeEach
    void setUp() {
        detector = new IsolationScoreDetector(0.7, 50, 42L);
        history = new ArrayList<>();
        for (int i = 0; i < 16; i++) {
            history.add(100.0 + i);
        }
    }

    @Test
    @DisplayName("Should score a far outlier above the threshold")
    void shouldFlagOutlier() {
        MetricScore score = detector.score(Metric.AVG_LATENCY, 500.0, baseline(history), SETTINGS);

        assertThat(score.isAnomalous()).isTrue();
        assertThat(score.getScore()).isGreaterThanOrEqualTo(0.7);
        assertThat(score.getZScore()).isGreaterThan(0.0);
    }

    @Test
    @DisplayName("Should score a typical value below the threshold")
    void shouldNotFlagTypicalValue() {
        MetricScore typical = detector.score(Metric.AVG_LATENCY, 107.0, baseline(history), SETTINGS);
        MetricScore outlier = detector.score(Metric.AVG_LATENCY, 500.0, baseline(history), SETTINGS);

        assertThat(typical.isAnomalous()).isFalse();
        assertThat(typical.getScore()).isLessThan(outlier.getScore());
    }

    @Test
    @DisplayName("Should give the same score for the same inputs")
    void shouldBeDeterministic() {
        assertThat(detector.isolationScore(130.0, history)).isEqualTo(detector.isolationScore(130.0, history));
    }

    @Test
    @DisplayName("Should fall back to the z-score rule with a short history")
    void shouldFallBackWithShortHistory() {
        List<Double> shortHistory = history.subList(0, IsolationScoreDetector.MIN_HISTORY_SIZE - 1);
        BaselineStat stat = baseline(shortHistory);

        MetricScore score = detector.score(Metric.AVG_LATENCY, 500.0, stat, SETTINGS);
        MetricScore expected = new EwmaZScoreDetector().score(Metric.AVG_LATENCY, 500.0, stat, SETTINGS);

        assertThat(score.getScore()).isEqualTo(expected.getScore());
        assertThat(score.isAnomalous()).isEqualTo(expected.isAnomalous());
    }

    @Test
    @DisplayName("Should compute the average path length normaliser")
    void shouldComputeAveragePathLength() {
        assertThat(IsolationScoreDetector.averagePathLength(1)).isZero();
        assertThat(IsolationScoreDetector.averagePathLength(2)).isEqualTo(1.0);
        assertThat(IsolationScoreDetector.averagePathLength(16)).isBetween(4.6, 4.8);
    }

    @Test
    @DisplayName("Should reject invalid constructor arguments")
    void shouldRejectInvalidArguments() {
        assertThatThrownBy(() -> new IsolationScoreDetector(1.0, 10, 1L))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("scoreThreshold");
        assertThatThrownBy(() -> new IsolationScoreDetector(0.7, 0, 1L))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("trees");
    }

    // ---- Helpers ----

    private static BaselineStat baseline(List<Double> recent) {
        return new BaselineStat(KEY, 107.5, 21.25, recent.size(), 0, recent, Instant.EPOCH);
    }
}
