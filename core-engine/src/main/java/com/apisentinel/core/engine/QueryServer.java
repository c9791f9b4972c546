package com.apisentinel.core.engine;

import com.apisentinel.core.alert.AlertNotFoundException;
import com.apisentinel.core.alert.AlertQuery;
import com.apisentinel.core.alert.IllegalStateTransitionException;
import com.apisentinel.core.config.Durations;
import com.apisentinel.core.model.Alert;
import com.apisentinel.core.model.AlertStatus;
import com.apisentinel.core.model.JsonMappers;
import com.apisentinel.core.model.NormalizedRecord;
import com.apisentinel.core.model.Severity;
import com.apisentinel.core.model.WindowAggregate;
import com.apisentinel.core.pipeline.DegradedModeIndicator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * HTTP front end of a {@link SentinelEngine}.
 *
 * <h3>Endpoints</h3>
 * <ul>
 * <li>{@code GET /health}: {@code UP}, or {@code DEGRADED} with the failing
 * components; always {@code 200} so probes do not restart a degraded
 * engine</li>
 * <li>{@code GET /readiness}: {@code 200} once the engine runs, else
 * {@code 503}</li>
 * <li>{@code GET /alerts?endpoint=&severity=&status=&from=&to=&limit=}</li>
 * <li>{@code GET /alerts/{id}}</li>
 * <li>{@code POST /alerts/{id}/ack}, {@code POST /alerts/{id}/resolve}</li>
 * <li>{@code GET /metrics?endpoint=&window=&after=&limit=}</li>
 * <li>{@code POST /ingest}: one record or an array of records</li>
 * </ul>
 *
 * <p>
 * Bodies are JSON. Bad parameters answer {@code 400}, unknown alerts
 * {@code 404} and illegal transitions {@code 409}, each with an
 * {@code {"error": ...}} body.
 * </p>
 *
 * @since 1.0.0
 */
public class QueryServer {

    private static final Logger LOG = LoggerFactory.getLogger(QueryServer.class);

    static final int DEFAULT_METRICS_LIMIT = 100;

    private final SentinelEngine engine;
    private final ObjectMapper mapper = JsonMappers.create();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private HttpServer server;

    public QueryServer(SentinelEngine engine) {
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
    }

    /**
     * Start the server.
     *
     * @param port TCP port in [0, 65535]; 0 binds an ephemeral port
     * @throws IllegalArgumentException if port is out of range
     * @throws IllegalStateException    if the port cannot be bound
     */
    public void start(int port) {
        if (port < 0 || port > 65_535) {
            throw new IllegalArgumentException("Server port must be in range [0, 65535], got: " + port);
        }
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to bind query server on port " + port, e);
        }
        server.createContext("/health", exchange -> handle(exchange, this::health));
        server.createContext("/readiness", exchange -> handle(exchange, this::readiness));
        server.createContext("/alerts", exchange -> handle(exchange, this::alerts));
        server.createContext("/metrics", exchange -> handle(exchange, this::metrics));
        server.createContext("/ingest", exchange -> handle(exchange, this::ingest));

        AtomicInteger index = new AtomicInteger();
        server.setExecutor(Executors.newFixedThreadPool(2, r -> {
            Thread t = new Thread(r, "query-server-" + index.getAndIncrement());
            t.setDaemon(true);
            return t;
        }));
        server.start();
        running.set(true);
        LOG.info("Query server started on port {}", getPort());
    }

    /**
     * Stop the server gracefully.
     */
    public void stop() {
        if (server != null && running.compareAndSet(true, false)) {
            server.stop(0);
            LOG.info("Query server stopped");
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /** @return the bound port; only meaningful once started */
    public int getPort() {
        return server.getAddress().getPort();
    }

    // ---------------------------------------------------------------
    // Handlers
    // ---------------------------------------------------------------

    private Response health(HttpExchange exchange) {
        requireMethod(exchange, "GET");
        DegradedModeIndicator degraded = engine.getDegradedModeIndicator();
        ObjectNode body = mapper.createObjectNode();
        body.put("status", degraded.isDegraded() ? "DEGRADED" : "UP");
        if (degraded.isDegraded()) {
            body.set("reasons", mapper.valueToTree(degraded.reasons()));
        }
        body.set("counters", mapper.valueToTree(engine.counters()));
        return Response.ok(body);
    }

    private Response readiness(HttpExchange exchange) {
        requireMethod(exchange, "GET");
        boolean ready = engine.isRunning();
        ObjectNode body = mapper.createObjectNode().put("status", ready ? "READY" : "NOT_READY");
        return new Response(ready ? 200 : 503, body);
    }

    private Response alerts(HttpExchange exchange) {
        String path = exchange.getRequestURI().getPath();
        List<String> segments = new ArrayList<>();
        for (String s : path.split("/")) {
            if (!s.isEmpty()) {
                segments.add(s);
            }
        }
        // segments[0] is "alerts"
        if (segments.size() == 1) {
            requireMethod(exchange, "GET");
            return Response.ok(engine.alerts(alertQuery(queryParams(exchange))));
        }
        String id = segments.get(1);
        if (segments.size() == 2) {
            requireMethod(exchange, "GET");
            Alert alert = engine.alert(id).orElseThrow(() -> new AlertNotFoundException(id));
            return Response.ok(alert);
        }
        if (segments.size() == 3) {
            requireMethod(exchange, "POST");
            return switch (segments.get(2)) {
                case "ack" -> Response.ok(engine.acknowledge(id));
                case "resolve" -> Response.ok(engine.resolve(id));
                default -> throw new NotFound("No such action: " + segments.get(2));
            };
        }
        throw new NotFound("No such resource: " + path);
    }

    private Response metrics(HttpExchange exchange) {
        requireMethod(exchange, "GET");
        Map<String, String> params = queryParams(exchange);
        String endpoint = params.get("endpoint");
        if (endpoint == null || endpoint.isBlank()) {
            throw new IllegalArgumentException("Query parameter 'endpoint' is required");
        }
        Duration window = params.containsKey("window") ? Durations.parse(params.get("window")) : null;
        Instant after = params.containsKey("after") ? instant("after", params.get("after")) : null;
        int limit = params.containsKey("limit") ? positiveInt("limit", params.get("limit")) : DEFAULT_METRICS_LIMIT;

        List<WindowAggregate> aggregates = engine.metrics(endpoint, window, after, limit);
        ObjectNode body = mapper.createObjectNode();
        body.put("endpoint", endpoint);
        body.set("aggregates", mapper.valueToTree(aggregates));
        if (!aggregates.isEmpty()) {
            body.put("next", aggregates.get(aggregates.size() - 1).getWindowEnd().toString());
        }
        return Response.ok(body);
    }

    private Response ingest(HttpExchange exchange) throws IOException {
        requireMethod(exchange, "POST");
        JsonNode root;
        try (InputStream in = exchange.getRequestBody()) {
            root = mapper.readTree(in);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed JSON body: " + e.getOriginalMessage(), e);
        }
        if (root == null || root.isMissingNode()) {
            throw new IllegalArgumentException("Request body is empty");
        }
        List<JsonNode> nodes = new ArrayList<>();
        if (root.isArray()) {
            root.forEach(nodes::add);
        } else {
            nodes.add(root);
        }

        Map<IngestResult, Integer> outcome = new EnumMap<>(IngestResult.class);
        for (IngestResult result : IngestResult.values()) {
            outcome.put(result, 0);
        }
        for (JsonNode node : nodes) {
            IngestResult result;
            try {
                result = engine.ingest(mapper.treeToValue(node, NormalizedRecord.class));
            } catch (JsonProcessingException e) {
                // unparseable records count as invalid, like any other malformed record
                result = engine.ingest(null);
            }
            outcome.merge(result, 1, Integer::sum);
        }
        Map<String, Integer> body = new LinkedHashMap<>();
        body.put("accepted", outcome.get(IngestResult.ACCEPTED));
        body.put("rejected", outcome.get(IngestResult.REJECTED_INVALID));
        body.put("dropped", outcome.get(IngestResult.DROPPED_BUFFER_FULL));
        return new Response(202, body);
    }

    // ---------------------------------------------------------------
    // Plumbing
    // ---------------------------------------------------------------

    private void handle(HttpExchange exchange, Handler handler) throws IOException {
        Response response;
        try {
            response = handler.handle(exchange);
        } catch (MethodNotAllowed e) {
            response = Response.error(405, e.getMessage());
        } catch (NotFound | AlertNotFoundException e) {
            response = Response.error(404, e.getMessage());
        } catch (IllegalStateTransitionException e) {
            response = Response.error(409, e.getMessage());
        } catch (IllegalArgumentException e) {
            response = Response.error(400, e.getMessage());
        } catch (RuntimeException e) {
            LOG.error("{} {} failed", exchange.getRequestMethod(), exchange.getRequestURI(), e);
            response = Response.error(500, "Internal error");
        }
        byte[] bytes = mapper.writeValueAsBytes(response.body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(response.status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private static void requireMethod(HttpExchange exchange, String method) {
        if (!method.equalsIgnoreCase(exchange.getRequestMethod())) {
            throw new MethodNotAllowed(exchange.getRequestMethod() + " not allowed, use " + method);
        }
    }

    static Map<String, String> queryParams(HttpExchange exchange) {
        Map<String, String> params = new LinkedHashMap<>();
        String query = exchange.getRequestURI().getRawQuery();
        if (query == null || query.isEmpty()) {
            return params;
        }
        for (String pair : query.split("&")) {
            int eq = pair.indexOf('=');
            String key = eq < 0 ? pair : pair.substring(0, eq);
            String value = eq < 0 ? "" : pair.substring(eq + 1);
            if (!value.isEmpty()) {
                params.put(URLDecoder.decode(key, StandardCharsets.UTF_8),
                        URLDecoder.decode(value, StandardCharsets.UTF_8));
            }
        }
        return params;
    }

    private static AlertQuery alertQuery(Map<String, String> params) {
        AlertQuery.Builder builder = AlertQuery.builder();
        if (params.containsKey("endpoint")) {
            builder.endpoint(params.get("endpoint"));
        }
        if (params.containsKey("severity")) {
            builder.severity(Severity.parse(params.get("severity")));
        }
        if (params.containsKey("status")) {
            builder.status(AlertStatus.parse(params.get("status")));
        }
        if (params.containsKey("from")) {
            builder.from(instant("from", params.get("from")));
        }
        if (params.containsKey("to")) {
            builder.to(instant("to", params.get("to")));
        }
        if (params.containsKey("limit")) {
            builder.limit(positiveInt("limit", params.get("limit")));
        }
        return builder.build();
    }

    private static Instant instant(String name, String value) {
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Query parameter '" + name + "' must be an ISO-8601 instant, got: "
                    + value, e);
        }
    }

    private static int positiveInt(String name, String value) {
        try {
            int parsed = Integer.parseInt(value);
            if (parsed > 0) {
                return parsed;
            }
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Query parameter '" + name + "' must be a positive integer, got: "
                    + value, e);
        }
        throw new IllegalArgumentException("Query parameter '" + name + "' must be a positive integer, got: "
                + value);
    }

    @FunctionalInterface
    private interface Handler {
        Response handle(HttpExchange exchange) throws IOException;
    }

    private static final class Response {
        private final int status;
        private final Object body;

        Response(int status, Object body) {
            this.status = status;
            this.body = body;
        }

        static Response ok(Object body) {
            return new Response(200, body);
        }

        static Response error(int status, String message) {
            return new Response(status, Map.of("error", message == null ? "" : message));
        }
    }

    private static final class NotFound extends RuntimeException {
        NotFound(String message) {
            super(message);
        }
    }

    private static final class MethodNotAllowed extends RuntimeException {
        MethodNotAllowed(String message) {
            super(message);
        }
    }
}
