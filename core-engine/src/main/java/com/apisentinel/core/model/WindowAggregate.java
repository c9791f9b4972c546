package com.apisentinel.core.model;

import com.apisentinel.core.config.Durations;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Rollup of every record of one endpoint inside one closed window.
 *
 * <p>
 * Created exactly once per {@code (endpoint, windowSize, windowEnd)} when the
 * window closes and never mutated afterwards. A window that received no records
 * has a {@code sampleCount} of zero; only its request volume carries a value
 * then (see {@link #valueOf(Metric)}).
 * </p>
 *
 * @since 1.0.0
 */
public final class WindowAggregate implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String endpoint;
    private final Duration windowSize;
    private final Instant windowStart;
    private final Instant windowEnd;
    private final double avgLatency;
    private final double p95Latency;
    private final double errorRate;
    private final long requestVolume;
    private final double responseSizeVariance;
    private final long sampleCount;

    private WindowAggregate(Builder b) {
        this.endpoint = Objects.requireNonNull(b.endpoint, "endpoint must not be null");
        this.windowSize = Objects.requireNonNull(b.windowSize, "windowSize must not be null");
        this.windowEnd = Objects.requireNonNull(b.windowEnd, "windowEnd must not be null");
        this.windowStart = b.windowStart != null ? b.windowStart : b.windowEnd.minus(b.windowSize);
        if (b.sampleCount < 0) {
            throw new IllegalArgumentException("sampleCount must be >= 0, got: " + b.sampleCount);
        }
        this.avgLatency = b.avgLatency;
        this.p95Latency = b.p95Latency;
        this.errorRate = b.errorRate;
        this.requestVolume = b.requestVolume;
        this.responseSizeVariance = b.responseSizeVariance;
        this.sampleCount = b.sampleCount;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link WindowAggregate}. {@code endpoint},
     * {@code windowSize} and {@code windowEnd} are required; {@code windowStart}
     * defaults to {@code windowEnd - windowSize}.
     */
    public static class Builder {
        private String endpoint;
        private Duration windowSize;
        private Instant windowStart;
        private Instant windowEnd;
        private double avgLatency;
        private double p95Latency;
        private double errorRate;
        private long requestVolume;
        private double responseSizeVariance;
        private long sampleCount;

        public Builder endpoint(String endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        public Builder windowSize(Duration windowSize) {
            this.windowSize = windowSize;
            return this;
        }

        public Builder windowStart(Instant windowStart) {
            this.windowStart = windowStart;
            return this;
        }

        public Builder windowEnd(Instant windowEnd) {
            this.windowEnd = windowEnd;
            return this;
        }

        public Builder avgLatency(double avgLatency) {
            this.avgLatency = avgLatency;
            return this;
        }

        public Builder p95Latency(double p95Latency) {
            this.p95Latency = p95Latency;
            return this;
        }

        public Builder errorRate(double errorRate) {
            this.errorRate = errorRate;
            return this;
        }

        public Builder requestVolume(long requestVolume) {
            this.requestVolume = requestVolume;
            return this;
        }

        public Builder responseSizeVariance(double responseSizeVariance) {
            this.responseSizeVariance = responseSizeVariance;
            return this;
        }

        public Builder sampleCount(long sampleCount) {
            this.sampleCount = sampleCount;
            return this;
        }

        public WindowAggregate build() {
            return new WindowAggregate(this);
        }
    }

    /**
     * Value of a tracked metric for this window.
     *
     * @param metric the metric
     * @return the value, or empty when the metric is undefined for an empty
     *         window
     */
    public OptionalDouble valueOf(Metric metric) {
        if (metric == Metric.REQUEST_VOLUME) {
            return OptionalDouble.of(requestVolume);
        }
        if (sampleCount == 0) {
            return OptionalDouble.empty();
        }
        return switch (metric) {
            case AVG_LATENCY -> OptionalDouble.of(avgLatency);
            case P95_LATENCY -> OptionalDouble.of(p95Latency);
            case ERROR_RATE -> OptionalDouble.of(errorRate);
            case RESPONSE_SIZE_VARIANCE -> OptionalDouble.of(responseSizeVariance);
            default -> throw new IllegalArgumentException("Unhandled metric: " + metric);
        };
    }

    public String getEndpoint() {
        return endpoint;
    }

    public Duration getWindowSize() {
        return windowSize;
    }

    /**
     * @return window size in the configuration notation ({@code 1m}, {@code 15m})
     */
    @JsonProperty("window")
    public String getWindowLabel() {
        return Durations.format(windowSize);
    }

    public Instant getWindowStart() {
        return windowStart;
    }

    public Instant getWindowEnd() {
        return windowEnd;
    }

    public double getAvgLatency() {
        return avgLatency;
    }

    public double getP95Latency() {
        return p95Latency;
    }

    public double getErrorRate() {
        return errorRate;
    }

    public long getRequestVolume() {
        return requestVolume;
    }

    public double getResponseSizeVariance() {
        return responseSizeVariance;
    }

    public long getSampleCount() {
        return sampleCount;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof WindowAggregate that))
            return false;
        return Double.compare(avgLatency, that.avgLatency) == 0
                && Double.compare(p95Latency, that.p95Latency) == 0
                && Double.compare(errorRate, that.errorRate) == 0
                && requestVolume == that.requestVolume
                && Double.compare(responseSizeVariance, that.responseSizeVariance) == 0
                && sampleCount == that.sampleCount
                && endpoint.equals(that.endpoint)
                && windowSize.equals(that.windowSize)
                && windowStart.equals(that.windowStart)
                && windowEnd.equals(that.windowEnd);
    }

    @Override
    public int hashCode() {
        return Objects.hash(endpoint, windowSize, windowEnd, sampleCount);
    }

    @Override
    public String toString() {
        return "WindowAggregate{" +
                "endpoint='" + endpoint + '\'' +
                ", window=" + getWindowLabel() +
                ", windowEnd=" + windowEnd +
                ", avgLatency=" + avgLatency +
                ", p95Latency=" + p95Latency +
                ", errorRate=" + errorRate +
                ", requestVolume=" + requestVolume +
                ", responseSizeVariance=" + responseSizeVariance +
                ", sampleCount=" + sampleCount +
                '}';
    }
}
