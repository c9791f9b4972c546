package com.apisentinel.core.aggregation;

import com.apisentinel.core.model.Metric;
import com.apisentinel.core.model.NormalizedRecord;
import com.apisentinel.core.model.WindowAggregate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.withinPercentage;

/**
 * Unit tests for {@link WindowAggregator}.
 */
class WindowAggregatorTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");
    private static final Duration ONE_MINUTE = Duration.ofMinutes(1);
    private static final Duration GRACE = Duration.ofSeconds(10);

    private WindowAggregator aggregator;

    @BeforeEach
    void setUp() {
        aggregator = new WindowAggregator(List.of(ONE_MINUTE), GRACE);
    }

    @Test
    @DisplayName("Should compute exact window statistics")
    void shouldComputeExactStatistics() {
        for (int i = 1; i <= 100; i++) {
            int status = i % 10 == 0 ? 503 : 200;
            aggregator.add(record("/checkout", T0.plusMillis(i * 100L), i, status, i % 2 == 0 ? 1200 : 800));
        }

        List<WindowAggregate> closed = aggregator.closeDue(T0.plusSeconds(70));

        assertThat(closed).hasSize(1);
        WindowAggregate window = closed.get(0);
        assertThat(window.getEndpoint()).isEqualTo("/checkout");
        assertThat(window.getWindowStart()).isEqualTo(T0);
        assertThat(window.getWindowEnd()).isEqualTo(T0.plus(ONE_MINUTE));
        assertThat(window.getRequestVolume()).isEqualTo(100);
        assertThat(window.getSampleCount()).isEqualTo(100);
        assertThat(window.getAvgLatency()).isEqualTo(50.5);
        assertThat(window.getErrorRate()).isEqualTo(0.1);
        assertThat(window.getResponseSizeVariance()).isCloseTo(40_000.0, withinPercentage(0.001));
        assertThat(window.getP95Latency()).isCloseTo(95.0, withinPercentage(1.5));
    }

    @Test
    @DisplayName("Should keep a window open until its grace period has passed")
    void shouldHonourGracePeriod() {
        aggregator.add(record("/checkout", T0.plusSeconds(30), 100, 200, 500));

        assertThat(aggregator.closeDue(T0.plusSeconds(65))).isEmpty();

        assertThat(aggregator.add(record("/checkout", T0.plusSeconds(59), 100, 200, 500))).isTrue();
        List<WindowAggregate> closed = aggregator.closeDue(T0.plusSeconds(70));
        assertThat(closed).hasSize(1);
        assertThat(closed.get(0).getRequestVolume()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should drop and count records for an already emitted window")
    void shouldDropLateRecords() {
        aggregator.add(record("/checkout", T0.plusSeconds(30), 100, 200, 500));
        aggregator.closeDue(T0.plusSeconds(70));

        boolean accepted = aggregator.add(record("/checkout", T0.plusSeconds(45), 100, 200, 500));

        assertThat(accepted).isFalse();
        assertThat(aggregator.getLateDropped()).isEqualTo(1);
        assertThat(aggregator.openWindowCount()).isZero();
    }

    @Test
    @DisplayName("Should emit empty windows for gaps after the first emission")
    void shouldFillGaps() {
        aggregator.add(record("/checkout", T0.plusSeconds(10), 100, 200, 500));
        aggregator.add(record("/checkout", T0.plus(Duration.ofMinutes(3)).plusSeconds(10), 100, 200, 500));

        List<WindowAggregate> closed = aggregator.closeDue(T0.plus(Duration.ofMinutes(4)).plusSeconds(10));

        assertThat(closed).extracting(WindowAggregate::getWindowStart).containsExactly(
                T0, T0.plus(Duration.ofMinutes(1)), T0.plus(Duration.ofMinutes(2)), T0.plus(Duration.ofMinutes(3)));
        assertThat(closed).extracting(WindowAggregate::getRequestVolume).containsExactly(1L, 0L, 0L, 1L);
        WindowAggregate empty = closed.get(1);
        assertThat(empty.valueOf(Metric.AVG_LATENCY)).isEmpty();
        assertThat(empty.valueOf(Metric.REQUEST_VOLUME)).hasValue(0.0);
    }

    @Test
    @DisplayName("Should keep emitting empty windows while an endpoint is silent")
    void shouldEmitSilenceAsEmptyWindows() {
        aggregator.add(record("/checkout", T0.plusSeconds(10), 100, 200, 500));
        aggregator.closeDue(T0.plusSeconds(70));

        List<WindowAggregate> closed = aggregator.closeDue(T0.plus(Duration.ofMinutes(3)).plusSeconds(10));

        assertThat(closed).hasSize(2);
        assertThat(closed).allMatch(w -> w.getRequestVolume() == 0);
    }

    @Test
    @DisplayName("Should not emit anything for an endpoint never closed before")
    void shouldNotFillBeforeFirstEmission() {
        assertThat(aggregator.closeDue(T0.plus(Duration.ofHours(1)))).isEmpty();
    }

    @Test
    @DisplayName("Should report when the next window is due")
    void shouldReportNextDue() {
        assertThat(aggregator.nextDue("/checkout")).isEmpty();

        aggregator.add(record("/checkout", T0.plusSeconds(30), 100, 200, 500));
        assertThat(aggregator.nextDue("/checkout")).hasValue(T0.plus(ONE_MINUTE).plus(GRACE));

        aggregator.closeDue(T0.plusSeconds(70));
        assertThat(aggregator.nextDue("/checkout")).hasValue(T0.plus(Duration.ofMinutes(2)).plus(GRACE));
    }

    @Test
    @DisplayName("Should aggregate every window size and order by window end")
    void shouldAggregateMultipleSizes() {
        WindowAggregator multi = new WindowAggregator(List.of(ONE_MINUTE, Duration.ofMinutes(5)), GRACE);
        for (int minute = 0; minute < 5; minute++) {
            multi.add(record("/search", T0.plus(Duration.ofMinutes(minute)).plusSeconds(5), 50, 200, 100));
        }

        List<WindowAggregate> closed = multi.closeDue(T0.plus(Duration.ofMinutes(5)).plus(GRACE));

        assertThat(closed).hasSize(6);
        WindowAggregate last = closed.get(closed.size() - 1);
        assertThat(last.getWindowSize()).isEqualTo(Duration.ofMinutes(5));
        assertThat(last.getRequestVolume()).isEqualTo(5);
        assertThat(closed.subList(0, 5)).allMatch(w -> w.getWindowSize().equals(ONE_MINUTE));
    }

    @Test
    @DisplayName("Should flush a single endpoint without touching others")
    void shouldCloseSingleEndpoint() {
        aggregator.add(record("/a", T0.plusSeconds(5), 10, 200, 10));
        aggregator.add(record("/b", T0.plusSeconds(5), 10, 200, 10));

        assertThat(aggregator.closeDue("/a", T0.plusSeconds(70))).hasSize(1);
        assertThat(aggregator.openWindowCount()).isEqualTo(1);
        assertThat(aggregator.closeDue("/unknown", T0.plusSeconds(70))).isEmpty();
    }

    @Test
    @DisplayName("Should not lose records under concurrent writers")
    void shouldCountConcurrentRecordsExactly() throws Exception {
        int threads = 8;
        int perThread = 1000;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        for (int t = 0; t < threads; t++) {
            futures.add(pool.submit(() -> {
                start.await();
                for (int i = 0; i < perThread; i++) {
                    aggregator.add(record("/checkout", T0.plusMillis(i), 20, 200, 100));
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get();
        }
        pool.shutdown();

        List<WindowAggregate> closed = aggregator.closeDue(T0.plusSeconds(70));

        assertThat(closed).hasSize(1);
        assertThat(closed.get(0).getRequestVolume()).isEqualTo((long) threads * perThread);
    }

    @Test
    @DisplayName("Should reject an empty list of window sizes")
    void shouldRejectNoWindowSizes() {
        assertThatThrownBy(() -> new WindowAggregator(List.of(), GRACE))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("At least one window size");
    }

    // ---- Helpers ----

    private static NormalizedRecord record(String endpoint, Instant at, double latencyMs, int status, long size) {
        return NormalizedRecord.builder()
                .endpoint(endpoint)
                .timestamp(at)
                .latencyMs(latencyMs)
                .statusCode(status)
                .responseSizeBytes(size)
                .build();
    }
}
