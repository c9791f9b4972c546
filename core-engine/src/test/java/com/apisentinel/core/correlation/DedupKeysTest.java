package com.apisentinel.core.correlation;

import com.apisentinel.core.model.Metric;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link DedupKeys}.
 */
class DedupKeysTest {

    private static final Duration HOUR = Duration.ofHours(1);
    private static final Instant AT = Instant.parse("2026-01-01T10:15:00Z");

    @Test
    @DisplayName("Should produce a 64 character hex digest")
    void shouldProduceHexDigest() {
        String key = DedupKeys.of("/checkout", List.of(Metric.AVG_LATENCY, Metric.ERROR_RATE), AT, HOUR);

        assertThat(key).hasSize(64).matches("[0-9a-f]+");
    }

    @Test
    @DisplayName("Should ignore metric order and duplicates")
    void shouldIgnoreMetricOrder() {
        String a = DedupKeys.of("/checkout", List.of(Metric.AVG_LATENCY, Metric.ERROR_RATE), AT, HOUR);
        String b = DedupKeys.of("/checkout",
                List.of(Metric.ERROR_RATE, Metric.AVG_LATENCY, Metric.ERROR_RATE), AT, HOUR);

        assertThat(a).isEqualTo(b);
    }

    @Test
    @DisplayName("Should map instants of the same bucket to the same key")
    void shouldShareKeyWithinBucket() {
        List<Metric> metrics = List.of(Metric.AVG_LATENCY, Metric.ERROR_RATE);

        assertThat(DedupKeys.of("/checkout", metrics, AT, HOUR))
                .isEqualTo(DedupKeys.of("/checkout", metrics, AT.plus(Duration.ofMinutes(40)), HOUR))
                .isNotEqualTo(DedupKeys.of("/checkout", metrics, AT.plus(Duration.ofMinutes(50)), HOUR));
    }

    @Test
    @DisplayName("Should distinguish endpoints and metric sets")
    void shouldDistinguishEndpointsAndMetrics() {
        String checkout = DedupKeys.of("/checkout", List.of(Metric.AVG_LATENCY, Metric.ERROR_RATE), AT, HOUR);

        assertThat(DedupKeys.of("/search", List.of(Metric.AVG_LATENCY, Metric.ERROR_RATE), AT, HOUR))
                .isNotEqualTo(checkout);
        assertThat(DedupKeys.of("/checkout", List.of(Metric.AVG_LATENCY, Metric.REQUEST_VOLUME), AT, HOUR))
                .isNotEqualTo(checkout);
    }
}
