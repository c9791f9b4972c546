package com.apisentinel.core.config;

import com.apisentinel.core.model.Severity;

import java.io.Serializable;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Notification delivery settings.
 *
 * <pre>
 * sinks:
 *   webhookUrl: https://hooks.example.com/T000/B000
 *   webhookTimeout: 5s
 *   maxAttempts: 4
 *   initialBackoff: 500ms
 *   maxBackoff: 30s
 *   dispatchThreads: 2
 *   routing:
 *     INFO: [console]
 *     WARN: [console, webhook]
 *     CRITICAL: [console, webhook]
 *   cooldown:
 *     INFO: 1h
 *     WARN: 30m
 *     CRITICAL: 5m
 * </pre>
 *
 * <p>
 * Duration-valued properties are kept as text for SnakeYAML and exposed parsed
 * through the accessor without the {@code get} prefix.
 * </p>
 *
 * @since 1.0.0
 */
public class SinkSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final String CONSOLE = "console";
    public static final String WEBHOOK = "webhook";

    private String webhookUrl;
    private String webhookTimeout = "5s";
    private int maxAttempts = 4;
    private String initialBackoff = "500ms";
    private String maxBackoff = "30s";
    private int dispatchThreads = 2;
    private Map<String, List<String>> routing = defaultRouting();
    private Map<String, String> cooldown = defaultCooldown();

    // ---------------------------------------------------------------
    // Typed views
    // ---------------------------------------------------------------

    public Duration webhookTimeout() {
        return Durations.parse(webhookTimeout);
    }

    public Duration initialBackoff() {
        return Durations.parse(initialBackoff);
    }

    public Duration maxBackoff() {
        return Durations.parse(maxBackoff);
    }

    /**
     * @return sink names per severity; severities missing from the YAML route
     *         nowhere
     */
    public Map<Severity, List<String>> routing() {
        Map<Severity, List<String>> result = new EnumMap<>(Severity.class);
        routing.forEach((severity, sinks) -> result.put(Severity.parse(severity), List.copyOf(sinks)));
        return result;
    }

    /**
     * @return notify cool-down per severity; missing severities have none
     */
    public Map<Severity, Duration> cooldown() {
        Map<Severity, Duration> result = new EnumMap<>(Severity.class);
        cooldown.forEach((severity, duration) -> result.put(Severity.parse(severity), Durations.parse(duration)));
        return result;
    }

    void validate(List<String> errors) {
        if (maxAttempts < 1) {
            errors.add("sinks.maxAttempts must be >= 1");
        }
        if (dispatchThreads < 1) {
            errors.add("sinks.dispatchThreads must be >= 1");
        }
        checkDuration(errors, "sinks.webhookTimeout", webhookTimeout);
        checkDuration(errors, "sinks.initialBackoff", initialBackoff);
        checkDuration(errors, "sinks.maxBackoff", maxBackoff);
        if (isDuration(initialBackoff) && isDuration(maxBackoff)) {
            Duration initial = Durations.parse(initialBackoff);
            if (initial.toMillis() < 1) {
                errors.add("sinks.initialBackoff must be >= 1ms");
            } else if (Durations.parse(maxBackoff).compareTo(initial) < 0) {
                errors.add("sinks.maxBackoff must be >= sinks.initialBackoff");
            }
        }
        routing.forEach((severity, sinks) -> {
            checkSeverity(errors, "sinks.routing", severity);
            for (String sink : sinks == null ? List.<String>of() : sinks) {
                if (!CONSOLE.equals(sink) && !WEBHOOK.equals(sink)) {
                    errors.add("sinks.routing." + severity + ": unknown sink '" + sink
                            + "'. Supported: console, webhook");
                }
            }
        });
        cooldown.forEach((severity, duration) -> {
            checkSeverity(errors, "sinks.cooldown", severity);
            checkDuration(errors, "sinks.cooldown." + severity, duration);
        });
    }

    private static void checkSeverity(List<String> errors, String path, String severity) {
        try {
            Severity.parse(severity);
        } catch (IllegalArgumentException e) {
            errors.add(path + ": " + e.getMessage());
        }
    }

    private static boolean isDuration(String value) {
        List<String> problems = new ArrayList<>();
        checkDuration(problems, "", value);
        return problems.isEmpty();
    }

    static void checkDuration(List<String> errors, String path, String value) {
        try {
            Durations.parse(value);
        } catch (IllegalArgumentException | NullPointerException e) {
            errors.add(path + ": invalid duration '" + value + "'");
        }
    }

    private static Map<String, List<String>> defaultRouting() {
        Map<String, List<String>> routing = new LinkedHashMap<>();
        routing.put("INFO", new ArrayList<>(List.of(CONSOLE)));
        routing.put("WARN", new ArrayList<>(List.of(CONSOLE, WEBHOOK)));
        routing.put("CRITICAL", new ArrayList<>(List.of(CONSOLE, WEBHOOK)));
        return routing;
    }

    private static Map<String, String> defaultCooldown() {
        Map<String, String> cooldown = new LinkedHashMap<>();
        cooldown.put("INFO", "1h");
        cooldown.put("WARN", "30m");
        cooldown.put("CRITICAL", "5m");
        return cooldown;
    }

    // ---------------------------------------------------------------
    // Getters / Setters (required for SnakeYAML)
    // ---------------------------------------------------------------

    public String getWebhookUrl() {
        return webhookUrl;
    }

    public void setWebhookUrl(String webhookUrl) {
        this.webhookUrl = webhookUrl;
    }

    public String getWebhookTimeout() {
        return webhookTimeout;
    }

    public void setWebhookTimeout(String webhookTimeout) {
        this.webhookTimeout = webhookTimeout;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public String getInitialBackoff() {
        return initialBackoff;
    }

    public void setInitialBackoff(String initialBackoff) {
        this.initialBackoff = initialBackoff;
    }

    public String getMaxBackoff() {
        return maxBackoff;
    }

    public void setMaxBackoff(String maxBackoff) {
        this.maxBackoff = maxBackoff;
    }

    public int getDispatchThreads() {
        return dispatchThreads;
    }

    public void setDispatchThreads(int dispatchThreads) {
        this.dispatchThreads = dispatchThreads;
    }

    public Map<String, List<String>> getRouting() {
        return Collections.unmodifiableMap(routing);
    }

    public void setRouting(Map<String, List<String>> routing) {
        this.routing = routing != null ? new LinkedHashMap<>(routing) : new LinkedHashMap<>();
    }

    public Map<String, String> getCooldown() {
        return Collections.unmodifiableMap(cooldown);
    }

    public void setCooldown(Map<String, String> cooldown) {
        this.cooldown = cooldown != null ? new LinkedHashMap<>(cooldown) : new LinkedHashMap<>();
    }

    @Override
    public String toString() {
        return "SinkSettings{webhookUrl=" + (webhookUrl != null ? "<set>" : "<none>")
                + ", maxAttempts=" + maxAttempts + ", routing=" + routing + ", cooldown=" + cooldown + '}';
    }
}
