package com.apisentinel.core.engine;

import com.apisentinel.core.model.NormalizedRecord;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Boundary checks for incoming records.
 *
 * <h3>Rejected</h3>
 * <ul>
 * <li>blank endpoint</li>
 * <li>missing timestamp, or one more than {@code maxClockSkew} in the
 * future</li>
 * <li>negative or non-finite latency</li>
 * <li>status code outside 100–599</li>
 * <li>negative response size</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class RecordValidator {

    private final Duration maxClockSkew;

    public RecordValidator(Duration maxClockSkew) {
        this.maxClockSkew = Objects.requireNonNull(maxClockSkew, "maxClockSkew must not be null");
    }

    /**
     * @param record record to check; may be {@code null}
     * @param now    current processing time
     * @return the reason the record is invalid, empty if it is valid
     */
    public Optional<String> validate(NormalizedRecord record, Instant now) {
        if (record == null) {
            return Optional.of("record is null");
        }
        if (record.getEndpoint() == null || record.getEndpoint().isBlank()) {
            return Optional.of("endpoint is blank");
        }
        if (record.getTimestamp() == null) {
            return Optional.of("timestamp is missing");
        }
        if (record.getTimestamp().isAfter(now.plus(maxClockSkew))) {
            return Optional.of("timestamp " + record.getTimestamp() + " is more than " + maxClockSkew
                    + " in the future");
        }
        double latency = record.getLatencyMs();
        if (!Double.isFinite(latency) || latency < 0) {
            return Optional.of("latencyMs must be finite and >= 0, got: " + latency);
        }
        if (record.getStatusCode() < 100 || record.getStatusCode() > 599) {
            return Optional.of("statusCode must be in [100, 599], got: " + record.getStatusCode());
        }
        if (record.getResponseSizeBytes() < 0) {
            return Optional.of("responseSizeBytes must be >= 0, got: " + record.getResponseSizeBytes());
        }
        return Optional.empty();
    }
}
