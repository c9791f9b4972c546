package com.apisentinel.core.engine;

import com.apisentinel.core.MutableClock;
import com.apisentinel.core.model.NormalizedRecord;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;

import static com.apisentinel.core.WindowFixtures.ONE_MINUTE;
import static com.apisentinel.core.WindowFixtures.T0;

/**
 * Plays one minute of traffic at a time into a {@link SentinelEngine} and
 * closes the minute's 1m window.
 */
final class TrafficFeeder {

    private final SentinelEngine engine;
    private final MutableClock clock;
    private final String endpoint;

    TrafficFeeder(SentinelEngine engine, MutableClock clock, String endpoint) {
        this.engine = engine;
        this.clock = clock;
        this.endpoint = endpoint;
    }

    /** 100 requests around 120ms, 2% errors. */
    void healthy(int minute) throws Exception {
        play(minute, healthyLatency(minute), 2, 100);
    }

    /** 100 requests at 800ms, 15% errors. */
    void degraded(int minute) throws Exception {
        play(minute, 800.0, 15, 100);
    }

    /** Healthy latency and error rate at three times the usual volume. */
    void trafficSpike(int minute) throws Exception {
        play(minute, healthyLatency(minute), 6, 300);
    }

    void play(int minute, double latencyMs, int errors, int count) throws Exception {
        Instant start = T0.plus(ONE_MINUTE.multipliedBy(minute));
        clock.set(start.plusSeconds(55));
        long step = 50_000L / count;
        for (int k = 0; k < count; k++) {
            engine.ingest(NormalizedRecord.builder()
                    .endpoint(endpoint)
                    .timestamp(start.plusMillis(k * step))
                    .latencyMs(latencyMs)
                    .statusCode(k < errors ? 503 : 200)
                    .responseSizeBytes(k % 2 == 0 ? 500 : 600)
                    .requestId(endpoint + "-" + minute + "-" + k)
                    .build());
        }
        // past the window end plus the 10s grace period
        clock.set(start.plus(ONE_MINUTE).plus(Duration.ofSeconds(11)));
        engine.tick().get(10, TimeUnit.SECONDS);
    }

    private static double healthyLatency(int minute) {
        return 120.0 + ((minute % 5) - 2) * 3.0;
    }
}
