package com.apisentinel.core.engine;

import com.apisentinel.core.MutableClock;
import com.apisentinel.core.alert.InMemoryAlertStore;
import com.apisentinel.core.baseline.InMemoryBaselineStore;
import com.apisentinel.core.config.SentinelConfig;
import com.apisentinel.core.model.JsonMappers;
import com.apisentinel.core.sink.LoggingAlertSink;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;

import static com.apisentinel.core.WindowFixtures.T0;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Unit tests for {@link QueryServer}. */
class QueryServerTest {

    private final ObjectMapper mapper = JsonMappers.create();
    private final HttpClient client = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build();

    private MutableClock clock;
    private SentinelEngine engine;
    private QueryServer server;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        SentinelConfig config = new SentinelConfig();
        config.setWindowSizes(List.of("1m"));
        engine = new SentinelEngine(config, clock, new InMemoryBaselineStore(), new InMemoryAlertStore(100),
                List.of(new LoggingAlertSink()));
        server = new QueryServer(engine);
        server.start(0);
    }

    @AfterEach
    void tearDown() {
        server.stop();
        engine.close();
    }

    @Test
    @DisplayName("Should report UP with pipeline counters")
    void shouldReportHealth() throws Exception {
        HttpResponse<String> response = get("/health");

        assertThat(response.statusCode()).isEqualTo(200);
        JsonNode body = mapper.readTree(response.body());
        assertThat(body.get("status").asText()).isEqualTo("UP");
        assertThat(body.get("counters").has("records_accepted")).isTrue();
    }

    @Test
    @DisplayName("Should be ready only while the engine runs")
    void shouldReportReadiness() throws Exception {
        assertThat(get("/readiness").statusCode()).isEqualTo(503);

        engine.start();

        HttpResponse<String> response = get("/readiness");
        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(mapper.readTree(response.body()).get("status").asText()).isEqualTo("READY");
    }

    @Test
    @DisplayName("Should ingest a batch and report accepted and rejected counts")
    void shouldIngestBatch() throws Exception {
        String batch = "["
                + "{\"endpoint\":\"/checkout\",\"timestamp\":\"2026-01-01T00:00:01Z\",\"latencyMs\":120,"
                + "\"statusCode\":200,\"responseSizeBytes\":512},"
                + "{\"endpoint\":\"/checkout\",\"timestamp\":\"2026-01-01T00:00:02Z\",\"latencyMs\":130,"
                + "\"statusCode\":500,\"responseSizeBytes\":64},"
                + "{\"endpoint\":\"\",\"timestamp\":\"2026-01-01T00:00:03Z\",\"latencyMs\":1,"
                + "\"statusCode\":200,\"responseSizeBytes\":1},"
                + "{\"endpoint\":\"/checkout\",\"latencyMs\":\"slow\"}"
                + "]";

        HttpResponse<String> response = post("/ingest", batch);

        assertThat(response.statusCode()).isEqualTo(202);
        JsonNode body = mapper.readTree(response.body());
        assertThat(body.get("accepted").asInt()).isEqualTo(2);
        assertThat(body.get("rejected").asInt()).isEqualTo(2);
        assertThat(body.get("dropped").asInt()).isZero();
    }

    @Test
    @DisplayName("Should answer 400 for malformed ingest bodies")
    void shouldRejectMalformedIngest() throws Exception {
        HttpResponse<String> response = post("/ingest", "{not json");

        assertThat(response.statusCode()).isEqualTo(400);
        assertThat(mapper.readTree(response.body()).get("error").asText()).contains("Malformed JSON");
    }

    @Test
    @DisplayName("Should list, acknowledge and resolve alerts")
    void shouldManageAlerts() throws Exception {
        openCheckoutAlert();

        JsonNode open = mapper.readTree(get("/alerts?status=open&endpoint=/checkout").body());
        assertThat(open).hasSize(1);
        String id = open.get(0).get("id").asText();
        assertThat(open.get(0).get("severity").asText()).isEqualTo("CRITICAL");

        HttpResponse<String> ack = post("/alerts/" + id + "/ack", "");
        assertThat(ack.statusCode()).isEqualTo(200);
        assertThat(mapper.readTree(ack.body()).get("status").asText()).isEqualTo("ACKNOWLEDGED");

        assertThat(post("/alerts/" + id + "/ack", "").statusCode()).isEqualTo(409);
        assertThat(post("/alerts/" + id + "/resolve", "").statusCode()).isEqualTo(200);
        assertThat(mapper.readTree(get("/alerts/" + id).body()).get("status").asText()).isEqualTo("RESOLVED");
        assertThat(mapper.readTree(get("/alerts?status=open").body())).isEmpty();
    }

    @Test
    @DisplayName("Should answer 404, 405 and 400 for bad alert requests")
    void shouldRejectBadAlertRequests() throws Exception {
        assertThat(get("/alerts/missing").statusCode()).isEqualTo(404);
        assertThat(post("/alerts/missing/resolve", "").statusCode()).isEqualTo(404);
        assertThat(post("/alerts/missing/snooze", "").statusCode()).isEqualTo(404);
        assertThat(get("/alerts/missing/ack").statusCode()).isEqualTo(405);
        assertThat(get("/alerts?severity=fatal").statusCode()).isEqualTo(400);
        assertThat(get("/alerts?limit=0").statusCode()).isEqualTo(400);
        assertThat(get("/alerts?from=yesterday").statusCode()).isEqualTo(400);
    }

    @Test
    @DisplayName("Should page through closed windows of an endpoint")
    void shouldServeMetrics() throws Exception {
        TrafficFeeder feeder = new TrafficFeeder(engine, clock, "/checkout");
        for (int minute = 0; minute < 3; minute++) {
            feeder.healthy(minute);
        }

        JsonNode first = mapper.readTree(get("/metrics?endpoint=/checkout&window=1m&limit=2").body());
        assertThat(first.get("aggregates")).hasSize(2);
        String next = first.get("next").asText();
        assertThat(next).isEqualTo("2026-01-01T00:02:00Z");

        JsonNode second = mapper.readTree(get("/metrics?endpoint=/checkout&after=" + next).body());
        assertThat(second.get("aggregates")).hasSize(1);
        assertThat(second.get("aggregates").get(0).get("sampleCount").asLong()).isEqualTo(100);
    }

    @Test
    @DisplayName("Should require the endpoint parameter for metrics")
    void shouldRequireEndpointForMetrics() throws Exception {
        HttpResponse<String> response = get("/metrics");

        assertThat(response.statusCode()).isEqualTo(400);
        assertThat(mapper.readTree(response.body()).get("error").asText()).contains("endpoint");
        assertThat(get("/metrics?endpoint=/checkout&window=soon").statusCode()).isEqualTo(400);
    }

    @Test
    @DisplayName("Should reject ports out of range")
    void shouldRejectInvalidPort() {
        QueryServer other = new QueryServer(engine);

        assertThatThrownBy(() -> other.start(70_000))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("65535");
    }

    // ---- Helpers ----

    private void openCheckoutAlert() throws Exception {
        TrafficFeeder feeder = new TrafficFeeder(engine, clock, "/checkout");
        for (int minute = 0; minute < 20; minute++) {
            feeder.healthy(minute);
        }
        feeder.degraded(20);
    }

    private HttpResponse<String> get(String path) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(uri(path)).GET().timeout(Duration.ofSeconds(5)).build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> post(String path, String body) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(uri(path))
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .header("Content-Type", "application/json")
                .timeout(Duration.ofSeconds(5))
                .build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private URI uri(String path) {
        return URI.create("http://localhost:" + server.getPort() + path);
    }
}
