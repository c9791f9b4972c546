package com.apisentinel.core.engine;

import com.apisentinel.core.model.NormalizedRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

/** Unit tests for {@link RecordValidator}. */
class RecordValidatorTest {

    private static final Instant NOW = Instant.parse("2026-01-01T12:00:00Z");

    private RecordValidator validator;

    @BeforeEach
    void setUp() {
        validator = new RecordValidator(Duration.ofMinutes(5));
    }

    @Test
    @DisplayName("Should accept a well-formed record")
    void shouldAcceptValidRecord() {
        assertThat(validator.validate(valid().build(), NOW)).isEmpty();
    }

    @Test
    @DisplayName("Should accept old timestamps and timestamps within the allowed skew")
    void shouldAcceptPastAndSlightlyFutureTimestamps() {
        assertThat(validator.validate(valid().timestamp(NOW.minus(Duration.ofDays(1))).build(), NOW)).isEmpty();
        assertThat(validator.validate(valid().timestamp(NOW.plus(Duration.ofMinutes(5))).build(), NOW)).isEmpty();
    }

    @Test
    @DisplayName("Should reject null records and blank endpoints")
    void shouldRejectNullAndBlankEndpoint() {
        assertThat(validator.validate(null, NOW)).hasValue("record is null");
        assertThat(validator.validate(valid().endpoint("  ").build(), NOW)).hasValue("endpoint is blank");
        assertThat(validator.validate(valid().endpoint(null).build(), NOW)).hasValue("endpoint is blank");
    }

    @Test
    @DisplayName("Should reject missing and far-future timestamps")
    void shouldRejectBadTimestamps() {
        assertThat(validator.validate(valid().timestamp(null).build(), NOW)).hasValue("timestamp is missing");
        assertThat(validator.validate(valid().timestamp(NOW.plus(Duration.ofMinutes(6))).build(), NOW))
                .hasValueSatisfying(reason -> assertThat(reason).contains("in the future"));
    }

    @Test
    @DisplayName("Should reject negative or non-finite latency")
    void shouldRejectBadLatency() {
        assertThat(validator.validate(valid().latencyMs(-1).build(), NOW)).isPresent();
        assertThat(validator.validate(valid().latencyMs(Double.NaN).build(), NOW)).isPresent();
        assertThat(validator.validate(valid().latencyMs(Double.POSITIVE_INFINITY).build(), NOW)).isPresent();
        assertThat(validator.validate(valid().latencyMs(0).build(), NOW)).isEmpty();
    }

    @Test
    @DisplayName("Should reject status codes outside 100-599 and negative sizes")
    void shouldRejectBadStatusAndSize() {
        assertThat(validator.validate(valid().statusCode(99).build(), NOW))
                .hasValueSatisfying(reason -> assertThat(reason).startsWith("statusCode"));
        assertThat(validator.validate(valid().statusCode(600).build(), NOW)).isPresent();
        assertThat(validator.validate(valid().statusCode(599).build(), NOW)).isEmpty();
        assertThat(validator.validate(valid().responseSizeBytes(-1).build(), NOW))
                .hasValueSatisfying(reason -> assertThat(reason).startsWith("responseSizeBytes"));
    }

    // ---- Helpers ----

    private static NormalizedRecord.Builder valid() {
        return NormalizedRecord.builder()
                .endpoint("/checkout")
                .timestamp(NOW.minusSeconds(1))
                .latencyMs(120.0)
                .statusCode(200)
                .responseSizeBytes(512);
    }
}
