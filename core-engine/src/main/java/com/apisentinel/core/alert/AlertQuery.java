package com.apisentinel.core.alert;

import com.apisentinel.core.model.Alert;
import com.apisentinel.core.model.AlertStatus;
import com.apisentinel.core.model.Severity;

import java.time.Instant;

/**
 * Filter for alert listings. Every criterion is optional; results are ordered
 * newest first by {@code createdAt} and capped at {@code limit}.
 *
 * <p>
 * {@code from} is inclusive and {@code to} exclusive.
 * </p>
 *
 * @since 1.0.0
 */
public final class AlertQuery {

    public static final int DEFAULT_LIMIT = 100;

    private final String endpoint;
    private final Severity severity;
    private final AlertStatus status;
    private final Instant from;
    private final Instant to;
    private final int limit;

    private AlertQuery(Builder b) {
        if (b.limit <= 0) {
            throw new IllegalArgumentException("limit must be > 0, got: " + b.limit);
        }
        this.endpoint = b.endpoint;
        this.severity = b.severity;
        this.status = b.status;
        this.from = b.from;
        this.to = b.to;
        this.limit = b.limit;
    }

    public static AlertQuery all() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @param alert candidate
     * @return {@code true} if the alert satisfies every criterion
     */
    public boolean matches(Alert alert) {
        if (endpoint != null && !endpoint.equals(alert.getEndpoint())) {
            return false;
        }
        if (severity != null && severity != alert.getSeverity()) {
            return false;
        }
        if (status != null && status != alert.getStatus()) {
            return false;
        }
        Instant createdAt = alert.getCreatedAt();
        if (from != null && (createdAt == null || createdAt.isBefore(from))) {
            return false;
        }
        return to == null || (createdAt != null && createdAt.isBefore(to));
    }

    public String getEndpoint() {
        return endpoint;
    }

    public Severity getSeverity() {
        return severity;
    }

    public AlertStatus getStatus() {
        return status;
    }

    public Instant getFrom() {
        return from;
    }

    public Instant getTo() {
        return to;
    }

    public int getLimit() {
        return limit;
    }

    public static class Builder {
        private String endpoint;
        private Severity severity;
        private AlertStatus status;
        private Instant from;
        private Instant to;
        private int limit = DEFAULT_LIMIT;

        public Builder endpoint(String endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder status(AlertStatus status) {
            this.status = status;
            return this;
        }

        public Builder from(Instant from) {
            this.from = from;
            return this;
        }

        public Builder to(Instant to) {
            this.to = to;
            return this;
        }

        public Builder limit(int limit) {
            this.limit = limit;
            return this;
        }

        public AlertQuery build() {
            return new AlertQuery(this);
        }
    }

    @Override
    public String toString() {
        return "AlertQuery{endpoint=" + endpoint + ", severity=" + severity + ", status=" + status
                + ", from=" + from + ", to=" + to + ", limit=" + limit + '}';
    }
}
