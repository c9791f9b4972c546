package com.apisentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * One request as delivered by the record normalizer.
 *
 * <p>
 * Instances are immutable. The {@code timestamp} is the authoritative
 * ordering key; ingestion time plays no role in window assignment. Field
 * validation happens at the ingestion boundary
 * ({@link com.apisentinel.core.engine.RecordValidator}), not here, so that
 * malformed records can still be represented, counted and rejected.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class NormalizedRecord implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Status codes at or above this value count as errors. */
    public static final int ERROR_STATUS_THRESHOLD = 500;

    private final String endpoint;
    private final Instant timestamp;
    private final double latencyMs;
    private final int statusCode;
    private final long responseSizeBytes;
    private final String requestId;

    @JsonCreator
    public NormalizedRecord(@JsonProperty("endpoint") String endpoint,
            @JsonProperty("timestamp") Instant timestamp,
            @JsonProperty("latencyMs") double latencyMs,
            @JsonProperty("statusCode") int statusCode,
            @JsonProperty("responseSizeBytes") long responseSizeBytes,
            @JsonProperty("requestId") String requestId) {
        this.endpoint = endpoint;
        this.timestamp = timestamp;
        this.latencyMs = latencyMs;
        this.statusCode = statusCode;
        this.responseSizeBytes = responseSizeBytes;
        this.requestId = requestId;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder, mostly for tests and producers assembling records field by
     * field.
     */
    public static class Builder {
        private String endpoint;
        private Instant timestamp;
        private double latencyMs;
        private int statusCode = 200;
        private long responseSizeBytes;
        private String requestId;

        public Builder endpoint(String endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder latencyMs(double latencyMs) {
            this.latencyMs = latencyMs;
            return this;
        }

        public Builder statusCode(int statusCode) {
            this.statusCode = statusCode;
            return this;
        }

        public Builder responseSizeBytes(long responseSizeBytes) {
            this.responseSizeBytes = responseSizeBytes;
            return this;
        }

        public Builder requestId(String requestId) {
            this.requestId = requestId;
            return this;
        }

        public NormalizedRecord build() {
            return new NormalizedRecord(endpoint, timestamp, latencyMs, statusCode,
                    responseSizeBytes, requestId);
        }
    }

    public String getEndpoint() {
        return endpoint;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public double getLatencyMs() {
        return latencyMs;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public long getResponseSizeBytes() {
        return responseSizeBytes;
    }

    public String getRequestId() {
        return requestId;
    }

    /**
     * @return {@code true} if the status code is a server error
     */
    @JsonIgnore
    public boolean isError() {
        return statusCode >= ERROR_STATUS_THRESHOLD;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof NormalizedRecord that))
            return false;
        return Double.compare(latencyMs, that.latencyMs) == 0
                && statusCode == that.statusCode
                && responseSizeBytes == that.responseSizeBytes
                && Objects.equals(endpoint, that.endpoint)
                && Objects.equals(timestamp, that.timestamp)
                && Objects.equals(requestId, that.requestId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(endpoint, timestamp, latencyMs, statusCode, responseSizeBytes, requestId);
    }

    @Override
    public String toString() {
        return "NormalizedRecord{" +
                "endpoint='" + endpoint + '\'' +
                ", timestamp=" + timestamp +
                ", latencyMs=" + latencyMs +
                ", statusCode=" + statusCode +
                ", responseSizeBytes=" + responseSizeBytes +
                ", requestId='" + requestId + '\'' +
                '}';
    }
}
