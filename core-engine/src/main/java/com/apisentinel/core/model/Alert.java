package com.apisentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Confirmed, corroborated degradation of one endpoint.
 *
 * <p>
 * Serialized to JSON for the alert sinks, the query API and the Kafka alerts
 * topic. Storage backends keep their own copies; callers receive copies too, so
 * an alert obtained from the lifecycle manager can be modified freely without
 * affecting stored state.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code endpoint} and {@code dedupKey} are required;
 * {@code id} and the timestamps are assigned when the alert is first persisted.
 * </p>
 *
 * @since 1.0.0
 */
public class Alert implements Serializable {

    private static final long serialVersionUID = 1L;

    private String id;
    private String endpoint;
    private Severity severity = Severity.INFO;

    /** Corroborating signals, ordered by window end. */
    private List<AnomalySignal> signals = new ArrayList<>();

    private Instant windowStart;
    private Instant windowEnd;
    private Explanation explanation;
    private AlertStatus status = AlertStatus.OPEN;
    private Instant createdAt;
    private Instant updatedAt;
    private String dedupKey;

    /** Healthy windows observed in a row since the last matching signal. */
    private int consecutiveHealthyWindows;

    // ---------------------------------------------------------------
    // Constructors
    // ---------------------------------------------------------------

    /** No-arg constructor required by Jackson. */
    public Alert() {
    }

    private Alert(Builder builder) {
        this.id = builder.id;
        this.endpoint = Objects.requireNonNull(builder.endpoint, "endpoint must not be null");
        this.dedupKey = Objects.requireNonNull(builder.dedupKey, "dedupKey must not be null");
        this.severity = builder.severity != null ? builder.severity : Severity.INFO;
        setSignals(builder.signals);
        this.windowStart = builder.windowStart;
        this.windowEnd = builder.windowEnd;
        this.explanation = builder.explanation;
        this.status = builder.status != null ? builder.status : AlertStatus.OPEN;
        this.createdAt = builder.createdAt;
        this.updatedAt = builder.updatedAt;
        this.consecutiveHealthyWindows = builder.consecutiveHealthyWindows;
    }

    /**
     * @return a deep-enough copy: lists are copied, immutable elements shared
     */
    public Alert copy() {
        return toBuilder().build();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .endpoint(endpoint)
                .dedupKey(dedupKey)
                .severity(severity)
                .signals(signals)
                .windowStart(windowStart)
                .windowEnd(windowEnd)
                .explanation(explanation)
                .status(status)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .consecutiveHealthyWindows(consecutiveHealthyWindows);
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link Alert} instances.
     */
    public static class Builder {
        private String id;
        private String endpoint;
        private Severity severity;
        private List<AnomalySignal> signals;
        private Instant windowStart;
        private Instant windowEnd;
        private Explanation explanation;
        private AlertStatus status;
        private Instant createdAt;
        private Instant updatedAt;
        private String dedupKey;
        private int consecutiveHealthyWindows;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder endpoint(String endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder signals(List<AnomalySignal> signals) {
            this.signals = signals;
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

        public Builder explanation(Explanation explanation) {
            this.explanation = explanation;
            return this;
        }

        public Builder status(AlertStatus status) {
            this.status = status;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Builder dedupKey(String dedupKey) {
            this.dedupKey = dedupKey;
            return this;
        }

        public Builder consecutiveHealthyWindows(int consecutiveHealthyWindows) {
            this.consecutiveHealthyWindows = consecutiveHealthyWindows;
            return this;
        }

        /**
         * @return a new {@link Alert}
         * @throws NullPointerException if {@code endpoint} or {@code dedupKey} is
         *                              {@code null}
         */
        public Alert build() {
            return new Alert(this);
        }
    }

    // ---------------------------------------------------------------
    // Derived views
    // ---------------------------------------------------------------

    /**
     * @return the distinct metrics carried by this alert's signals
     */
    @JsonIgnore
    public Set<Metric> getMetrics() {
        Set<Metric> metrics = EnumSet.noneOf(Metric.class);
        for (AnomalySignal signal : signals) {
            metrics.add(signal.getMetric());
        }
        return metrics;
    }

    /**
     * @return the largest absolute z-score among the signals, 0 if none
     */
    @JsonIgnore
    public double getMaxAbsZScore() {
        double max = 0.0;
        for (AnomalySignal signal : signals) {
            max = Math.max(max, Math.abs(signal.getZScore()));
        }
        return max;
    }

    @JsonIgnore
    public boolean isActive() {
        return status != null && status.isActive();
    }

    // ---------------------------------------------------------------
    // Getters / Setters (required for Jackson)
    // ---------------------------------------------------------------

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getEndpoint() {
        return endpoint;
    }

    public void setEndpoint(String endpoint) {
        this.endpoint = endpoint;
    }

    public Severity getSeverity() {
        return severity;
    }

    public void setSeverity(Severity severity) {
        this.severity = severity;
    }

    /**
     * @return unmodifiable view of the signals, ordered by window end
     */
    public List<AnomalySignal> getSignals() {
        return Collections.unmodifiableList(signals);
    }

    public void setSignals(List<AnomalySignal> signals) {
        this.signals = signals != null ? new ArrayList<>(signals) : new ArrayList<>();
    }

    public Instant getWindowStart() {
        return windowStart;
    }

    public void setWindowStart(Instant windowStart) {
        this.windowStart = windowStart;
    }

    public Instant getWindowEnd() {
        return windowEnd;
    }

    public void setWindowEnd(Instant windowEnd) {
        this.windowEnd = windowEnd;
    }

    public Explanation getExplanation() {
        return explanation;
    }

    public void setExplanation(Explanation explanation) {
        this.explanation = explanation;
    }

    public AlertStatus getStatus() {
        return status;
    }

    public void setStatus(AlertStatus status) {
        this.status = status;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    public String getDedupKey() {
        return dedupKey;
    }

    public void setDedupKey(String dedupKey) {
        this.dedupKey = dedupKey;
    }

    public int getConsecutiveHealthyWindows() {
        return consecutiveHealthyWindows;
    }

    public void setConsecutiveHealthyWindows(int consecutiveHealthyWindows) {
        this.consecutiveHealthyWindows = consecutiveHealthyWindows;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Alert alert))
            return false;
        return consecutiveHealthyWindows == alert.consecutiveHealthyWindows
                && Objects.equals(id, alert.id)
                && Objects.equals(endpoint, alert.endpoint)
                && severity == alert.severity
                && Objects.equals(signals, alert.signals)
                && Objects.equals(windowStart, alert.windowStart)
                && Objects.equals(windowEnd, alert.windowEnd)
                && Objects.equals(explanation, alert.explanation)
                && status == alert.status
                && Objects.equals(createdAt, alert.createdAt)
                && Objects.equals(updatedAt, alert.updatedAt)
                && Objects.equals(dedupKey, alert.dedupKey);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, dedupKey);
    }

    @Override
    public String toString() {
        return "Alert{" +
                "id='" + id + '\'' +
                ", endpoint='" + endpoint + '\'' +
                ", severity=" + severity +
                ", status=" + status +
                ", metrics=" + getMetrics() +
                ", window=[" + windowStart + ", " + windowEnd + ']' +
                ", dedupKey='" + dedupKey + '\'' +
                '}';
    }
}
