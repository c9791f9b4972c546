package com.apisentinel.core.sink;

import com.apisentinel.core.alert.AlertNotification;
import com.apisentinel.core.config.SinkSettings;
import com.apisentinel.core.model.Alert;
import com.apisentinel.core.model.JsonMappers;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;

/**
 * POSTs notifications as JSON to a webhook.
 *
 * <p>
 * The body carries a Slack-compatible {@code text} field plus the full alert:
 * </p>
 *
 * <pre>
 * {"text": "[CRITICAL] /checkout: avg latency increased …",
 *  "event": "CREATED",
 *  "alert": { … }}
 * </pre>
 *
 * <p>
 * 5xx and 429 responses and I/O errors are retryable; other non-2xx responses
 * are not.
 * </p>
 *
 * @since 1.0.0
 */
public class WebhookAlertSink implements AlertSink {

    private static final Logger LOG = LoggerFactory.getLogger(WebhookAlertSink.class);

    private final URI url;
    private final Duration timeout;
    private final HttpClient client;
    private final ObjectMapper mapper = JsonMappers.create();

    public WebhookAlertSink(URI url, Duration timeout) {
        this(url, timeout, HttpClient.newBuilder().connectTimeout(timeout).build());
    }

    public WebhookAlertSink(URI url, Duration timeout, HttpClient client) {
        this.url = Objects.requireNonNull(url, "url must not be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
        this.client = Objects.requireNonNull(client, "client must not be null");
    }

    @Override
    public void deliver(AlertNotification notification) throws SinkDeliveryException {
        byte[] body = payload(notification);
        HttpRequest request = HttpRequest.newBuilder(url)
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofByteArray(body))
                .build();
        HttpResponse<String> response;
        try {
            response = client.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new SinkDeliveryException("Webhook " + url.getHost() + " unreachable: " + e.getMessage(), e, true);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SinkDeliveryException("Interrupted while posting to webhook", e, false);
        }
        int status = response.statusCode();
        if (status >= 200 && status < 300) {
            LOG.debug("Webhook accepted alert {} ({})", notification.getAlert().getId(), status);
            return;
        }
        boolean retryable = status >= 500 || status == 429;
        throw new SinkDeliveryException("Webhook responded " + status, retryable);
    }

    @Override
    public String getName() {
        return SinkSettings.WEBHOOK;
    }

    byte[] payload(AlertNotification notification) throws SinkDeliveryException {
        Alert alert = notification.getAlert();
        ObjectNode root = mapper.createObjectNode();
        root.put("text", text(notification));
        root.put("event", notification.getType().name());
        root.set("alert", mapper.valueToTree(alert));
        try {
            return mapper.writeValueAsBytes(root);
        } catch (JsonProcessingException e) {
            throw new SinkDeliveryException("Cannot serialize alert " + alert.getId(), e, false);
        }
    }

    static String text(AlertNotification notification) {
        Alert alert = notification.getAlert();
        StringBuilder sb = new StringBuilder()
                .append('[').append(alert.getSeverity()).append("] ");
        if (notification.getType() == AlertNotification.Type.RESOLVED) {
            sb.append("Resolved: ");
        }
        sb.append(alert.getEndpoint());
        if (alert.getExplanation() != null) {
            sb.append(": ").append(alert.getExplanation().getSummary());
            for (String recommendation : alert.getExplanation().getRecommendations()) {
                sb.append("\n• ").append(recommendation);
            }
        }
        return sb.toString();
    }
}
