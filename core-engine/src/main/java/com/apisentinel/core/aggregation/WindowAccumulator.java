package com.apisentinel.core.aggregation;

import com.apisentinel.core.model.NormalizedRecord;
import com.apisentinel.core.model.WindowAggregate;

import java.time.Duration;
import java.time.Instant;

/**
 * Running totals of one open window.
 *
 * <p>
 * Only sums are kept, so folding is order-independent. Not thread-safe.
 * </p>
 *
 * @since 1.0.0
 */
final class WindowAccumulator {

    private final LatencySketch latencies;
    private long count;
    private long errorCount;
    private double latencySum;
    private double sizeSum;
    private double sizeSumOfSquares;

    WindowAccumulator(double sketchAccuracy) {
        this.latencies = new LatencySketch(sketchAccuracy);
    }

    void add(NormalizedRecord record) {
        count++;
        if (record.isError()) {
            errorCount++;
        }
        latencySum += record.getLatencyMs();
        latencies.add(record.getLatencyMs());
        double size = record.getResponseSizeBytes();
        sizeSum += size;
        sizeSumOfSquares += size * size;
    }

    long count() {
        return count;
    }

    WindowAggregate toAggregate(String endpoint, Duration windowSize, Instant windowStart) {
        WindowAggregate.Builder builder = WindowAggregate.builder()
                .endpoint(endpoint)
                .windowSize(windowSize)
                .windowStart(windowStart)
                .windowEnd(windowStart.plus(windowSize))
                .requestVolume(count)
                .sampleCount(count);
        if (count > 0) {
            double meanSize = sizeSum / count;
            // population variance; clamp rounding noise below zero
            double variance = Math.max(0.0, sizeSumOfSquares / count - meanSize * meanSize);
            builder.avgLatency(latencySum / count)
                    .p95Latency(latencies.quantile(0.95))
                    .errorRate((double) errorCount / count)
                    .responseSizeVariance(variance);
        }
        return builder.build();
    }

    static WindowAggregate empty(String endpoint, Duration windowSize, Instant windowStart) {
        return WindowAggregate.builder()
                .endpoint(endpoint)
                .windowSize(windowSize)
                .windowStart(windowStart)
                .windowEnd(windowStart.plus(windowSize))
                .requestVolume(0)
                .sampleCount(0)
                .build();
    }
}
