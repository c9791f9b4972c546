package com.apisentinel.core.model;

import java.io.Serializable;
import java.time.Duration;
import java.util.Objects;

/**
 * Identity of a baseline: one per endpoint, window size and metric.
 *
 * <p>
 * The window size is part of the key because volume-like metrics scale with
 * the window length; a 15-minute window cannot share statistics with a
 * 1-minute window.
 * </p>
 *
 * @since 1.0.0
 */
public final class BaselineKey implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String endpoint;
    private final Duration windowSize;
    private final Metric metric;

    public BaselineKey(String endpoint, Duration windowSize, Metric metric) {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint must not be null");
        this.windowSize = Objects.requireNonNull(windowSize, "windowSize must not be null");
        this.metric = Objects.requireNonNull(metric, "metric must not be null");
    }

    public static BaselineKey of(WindowAggregate window, Metric metric) {
        return new BaselineKey(window.getEndpoint(), window.getWindowSize(), metric);
    }

    public String getEndpoint() {
        return endpoint;
    }

    public Duration getWindowSize() {
        return windowSize;
    }

    public Metric getMetric() {
        return metric;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof BaselineKey that))
            return false;
        return endpoint.equals(that.endpoint)
                && windowSize.equals(that.windowSize)
                && metric == that.metric;
    }

    @Override
    public int hashCode() {
        return Objects.hash(endpoint, windowSize, metric);
    }

    @Override
    public String toString() {
        return endpoint + "/" + windowSize + "/" + metric.key();
    }
}
