package com.apisentinel.flink;

import com.apisentinel.core.model.Alert;
import com.apisentinel.core.model.AlertStatus;
import com.apisentinel.core.model.Explanation;
import com.apisentinel.core.model.JsonMappers;
import com.apisentinel.core.model.Metric;
import com.apisentinel.core.model.Severity;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/** Unit tests for {@link AlertSerializationSchema}. */
class AlertSerializationSchemaTest {

    private final ObjectMapper mapper = JsonMappers.create();

    @Test
    @DisplayName("Should key alert records by endpoint with a JSON body")
    void shouldSerializeAlert() throws Exception {
        ProducerRecord<byte[], byte[]> record = new AlertSerializationSchema("api-alerts")
                .serialize(alert(), null, 1_767_226_871_000L);

        assertThat(record.topic()).isEqualTo("api-alerts");
        assertThat(record.timestamp()).isEqualTo(1_767_226_871_000L);
        assertThat(new String(record.key(), StandardCharsets.UTF_8)).isEqualTo("/checkout");

        JsonNode json = mapper.readTree(record.value());
        assertThat(json.get("id").asText()).isEqualTo("a-1");
        assertThat(json.get("severity").asText()).isEqualTo("CRITICAL");
        assertThat(json.get("createdAt").asText()).isEqualTo("2026-01-01T00:21:11Z");
        assertThat(json.get("explanation").get("summary").asText()).startsWith("error rate rose");
        assertThat(json.has("metrics")).isFalse();
    }

    @Test
    @DisplayName("Should carry status and severity as headers")
    void shouldAddHeaders() {
        ProducerRecord<byte[], byte[]> record = new AlertSerializationSchema("api-alerts")
                .serialize(alert(), null, null);

        assertThat(header(record, AlertSerializationSchema.STATUS_HEADER)).isEqualTo("OPEN");
        assertThat(header(record, AlertSerializationSchema.SEVERITY_HEADER)).isEqualTo("CRITICAL");
        assertThat(record.timestamp()).isNull();
    }

    // ---- Helpers ----

    private static Alert alert() {
        return Alert.builder()
                .id("a-1")
                .endpoint("/checkout")
                .dedupKey("/checkout|avg_latency,error_rate|2026-01-01T00:00:00Z")
                .severity(Severity.CRITICAL)
                .status(AlertStatus.OPEN)
                .windowStart(Instant.parse("2026-01-01T00:20:00Z"))
                .windowEnd(Instant.parse("2026-01-01T00:21:00Z"))
                .createdAt(Instant.parse("2026-01-01T00:21:11Z"))
                .updatedAt(Instant.parse("2026-01-01T00:21:11Z"))
                .explanation(new Explanation("error rate rose from 2.0% to 15.0% for /checkout over 1m.",
                        List.of(), List.of(Metric.REQUEST_VOLUME), List.of("Check backend services.")))
                .build();
    }

    private static String header(ProducerRecord<byte[], byte[]> record, String name) {
        return new String(record.headers().lastHeader(name).value(), StandardCharsets.UTF_8);
    }
}
