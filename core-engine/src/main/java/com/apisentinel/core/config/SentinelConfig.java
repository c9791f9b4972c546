package com.apisentinel.core.config;

import com.apisentinel.core.model.Metric;

import java.io.Serializable;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Top-level POJO for the {@code sentinel.yml} configuration.
 *
 * <p>
 * Every property has a default, so {@code new SentinelConfig()} is a complete,
 * valid configuration and a YAML file only needs the keys it overrides.
 * </p>
 *
 * <pre>
 * windowSizes: [1m, 5m, 15m]
 * lateGracePeriod: 10s
 * minSamples: 10
 * minSignalCount: 2
 * joinTolerance: 2m
 * resolveAfterHealthyWindows: 3
 * metrics:
 *   avg_latency: { alpha: 0.2, zThreshold: 3.0, minStdDev: 5.0 }
 * compatiblePairs:
 *   - latency + error_rate
 *   - request_volume:decrease + error_rate
 * </pre>
 *
 * <p>
 * Durations are written in the compact notation understood by
 * {@link Durations}. They are stored as text so SnakeYAML can bind them, and
 * read through the typed accessors without the {@code get} prefix
 * ({@link #lateGracePeriod()}, {@link #windowSizes()}, …).
 * </p>
 *
 * <p>
 * Call {@link #validate()} after loading; {@link ConfigLoader} does so for
 * every source.
 * </p>
 *
 * @since 1.0.0
 */
public class SentinelConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    private List<String> windowSizes = new ArrayList<>(List.of("1m", "5m", "15m"));
    private String lateGracePeriod = "10s";
    private String tickInterval = "5s";
    private String maxClockSkew = "5m";

    private int ingestBufferCapacity = 10_000;
    private int ingestWorkers = 2;
    private int analysisThreads = 4;

    private int minSamples = 10;
    private int minSignalCount = 2;
    private String joinTolerance = "2m";
    private int resolveAfterHealthyWindows = 3;

    /** Anomalous windows in a row before the baseline starts adapting anyway. */
    private int coldRecoveryCycles = 10;
    private double dampenedAlphaFactor = 0.1;

    private String dedupBucket = "1h";

    private Map<String, MetricSettings> metrics = defaultMetrics();
    private DetectorSettings detector = new DetectorSettings();
    private SeverityBands severityBands = new SeverityBands();
    private List<String> compatiblePairs = new ArrayList<>(DEFAULT_COMPATIBLE_PAIRS);
    private List<RecommendationRuleConfig> recommendations = defaultRecommendations();
    private SinkSettings sinks = new SinkSettings();

    private String alertRetention = "90d";
    private String retentionInterval = "1h";
    private int maxAlerts = 1000;
    private int metricsHistorySize = 1440;
    /** Newest signals kept per metric of an alert. */
    private int maxSignalsPerAlert = 200;

    /** Port of the HTTP query server; {@code 0} binds an ephemeral port. */
    private int serverPort = 8081;

    /** Default corroboration table, in the notation parsed by the correlator. */
    public static final List<String> DEFAULT_COMPATIBLE_PAIRS = List.of(
            "latency + error_rate",
            "latency + response_size_variance",
            "error_rate + response_size_variance",
            "request_volume:decrease + error_rate",
            "request_volume:decrease + latency");

    // ---------------------------------------------------------------
    // Typed views
    // ---------------------------------------------------------------

    /**
     * @return parsed window sizes, smallest first
     */
    public List<Duration> windowSizes() {
        return windowSizes.stream().map(Durations::parse).sorted().toList();
    }

    public Duration lateGracePeriod() {
        return Durations.parse(lateGracePeriod);
    }

    public Duration tickInterval() {
        return Durations.parse(tickInterval);
    }

    public Duration maxClockSkew() {
        return Durations.parse(maxClockSkew);
    }

    public Duration joinTolerance() {
        return Durations.parse(joinTolerance);
    }

    public Duration dedupBucket() {
        return Durations.parse(dedupBucket);
    }

    public Duration alertRetention() {
        return Durations.parse(alertRetention);
    }

    public Duration retentionInterval() {
        return Durations.parse(retentionInterval);
    }

    /**
     * Settings of a metric. Metrics missing from the YAML fall back to their
     * built-in defaults.
     *
     * @param metric the metric
     * @return its tuning
     */
    public MetricSettings settingsFor(Metric metric) {
        MetricSettings configured = metrics.get(metric.key());
        return configured != null ? configured : defaultSettings(metric);
    }

    /**
     * @return settings for every metric
     */
    public Map<Metric, MetricSettings> metricSettings() {
        Map<Metric, MetricSettings> result = new EnumMap<>(Metric.class);
        for (Metric metric : Metric.values()) {
            result.put(metric, settingsFor(metric));
        }
        return result;
    }

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate every property. Collects all problems and throws a single
     * exception listing them.
     *
     * @throws IllegalStateException if one or more properties are invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (windowSizes == null || windowSizes.isEmpty()) {
            errors.add("windowSizes must contain at least one size");
        } else {
            for (String size : windowSizes) {
                SinkSettings.checkDuration(errors, "windowSizes", size);
            }
        }
        SinkSettings.checkDuration(errors, "lateGracePeriod", lateGracePeriod);
        SinkSettings.checkDuration(errors, "tickInterval", tickInterval);
        SinkSettings.checkDuration(errors, "maxClockSkew", maxClockSkew);
        SinkSettings.checkDuration(errors, "joinTolerance", joinTolerance);
        SinkSettings.checkDuration(errors, "dedupBucket", dedupBucket);
        SinkSettings.checkDuration(errors, "alertRetention", alertRetention);
        SinkSettings.checkDuration(errors, "retentionInterval", retentionInterval);

        checkPositive(errors, "ingestBufferCapacity", ingestBufferCapacity);
        checkPositive(errors, "ingestWorkers", ingestWorkers);
        checkPositive(errors, "analysisThreads", analysisThreads);
        checkPositive(errors, "minSamples", minSamples);
        checkPositive(errors, "resolveAfterHealthyWindows", resolveAfterHealthyWindows);
        checkPositive(errors, "coldRecoveryCycles", coldRecoveryCycles);
        checkPositive(errors, "maxAlerts", maxAlerts);
        checkPositive(errors, "metricsHistorySize", metricsHistorySize);
        checkPositive(errors, "maxSignalsPerAlert", maxSignalsPerAlert);
        if (minSignalCount < 2) {
            errors.add("minSignalCount must be >= 2 (a single metric never confirms an alert)");
        }
        if (dampenedAlphaFactor <= 0.0 || dampenedAlphaFactor > 1.0) {
            errors.add("dampenedAlphaFactor must be in (0, 1]");
        }
        if (serverPort < 0 || serverPort > 65_535) {
            errors.add("serverPort must be in [0, 65535]");
        }

        metrics.forEach((key, settings) -> {
            try {
                Metric.fromKey(key);
            } catch (IllegalArgumentException e) {
                errors.add("metrics: " + e.getMessage());
                return;
            }
            if (settings == null) {
                errors.add("metrics." + key + " must not be empty");
                return;
            }
            if (settings.getAlpha() <= 0.0 || settings.getAlpha() > 1.0) {
                errors.add("metrics." + key + ".alpha must be in (0, 1]");
            }
            if (settings.getZThreshold() <= 0.0) {
                errors.add("metrics." + key + ".zThreshold must be > 0");
            }
            if (settings.getMinStdDev() < 0.0 || settings.getMinRelativeStdDev() < 0.0) {
                errors.add("metrics." + key + " standard deviation floors must be >= 0");
            }
        });

        if (detector == null) {
            errors.add("detector must not be empty");
        } else {
            String type = detector.getType() == null ? "" : detector.getType().toLowerCase(Locale.ROOT);
            if (!type.equals("ewma") && !type.equals("isolation")) {
                errors.add("detector.type: unknown detector type '" + detector.getType()
                        + "'. Supported: ewma, isolation");
            }
            if (detector.getIsolationScoreThreshold() <= 0.0 || detector.getIsolationScoreThreshold() >= 1.0) {
                errors.add("detector.isolationScoreThreshold must be in (0, 1)");
            }
            checkPositive(errors, "detector.isolationTrees", detector.getIsolationTrees());
            if (detector.getRecentValuesSize() < 2) {
                errors.add("detector.recentValuesSize must be >= 2");
            }
        }

        if (severityBands == null) {
            errors.add("severityBands must not be empty");
        } else if (severityBands.getWarn() <= 0.0 || severityBands.getCritical() < severityBands.getWarn()) {
            errors.add("severityBands must satisfy 0 < warn <= critical");
        }

        for (int i = 0; i < recommendations.size(); i++) {
            RecommendationRuleConfig rule = recommendations.get(i);
            if (rule == null || rule.getText() == null || rule.getText().isBlank()) {
                errors.add("recommendations[" + i + "].text is required");
            } else if (rule.getChanged().isEmpty()) {
                errors.add("recommendations[" + i + "].changed must name at least one metric");
            }
        }

        if (sinks == null) {
            errors.add("sinks must not be empty");
        } else {
            sinks.validate(errors);
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Sentinel configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    private static void checkPositive(List<String> errors, String name, long value) {
        if (value <= 0) {
            errors.add(name + " must be > 0");
        }
    }

    // ---------------------------------------------------------------
    // Defaults
    // ---------------------------------------------------------------

    /**
     * @param metric the metric
     * @return built-in tuning: α 0.2, z 3.0, and a unit-appropriate absolute
     *         standard deviation floor
     */
    public static MetricSettings defaultSettings(Metric metric) {
        return switch (metric) {
            case AVG_LATENCY -> new MetricSettings(0.2, 3.0, 5.0, 0.05);
            case P95_LATENCY -> new MetricSettings(0.2, 3.0, 10.0, 0.05);
            case ERROR_RATE -> new MetricSettings(0.2, 3.0, 0.005, 0.05);
            case REQUEST_VOLUME -> new MetricSettings(0.2, 3.0, 1.0, 0.05);
            case RESPONSE_SIZE_VARIANCE -> new MetricSettings(0.2, 3.0, 1.0, 0.05);
        };
    }

    private static Map<String, MetricSettings> defaultMetrics() {
        Map<String, MetricSettings> defaults = new LinkedHashMap<>();
        for (Metric metric : Metric.values()) {
            defaults.put(metric.key(), defaultSettings(metric));
        }
        return defaults;
    }

    private static List<RecommendationRuleConfig> defaultRecommendations() {
        List<RecommendationRuleConfig> rules = new ArrayList<>();
        rules.add(new RecommendationRuleConfig(List.of("latency", "error_rate"), List.of(),
                "Check backend services and database health."));
        rules.add(new RecommendationRuleConfig(List.of("request_volume:decrease", "error_rate"), List.of(),
                "Check upstream routing and load balancer configuration."));
        rules.add(new RecommendationRuleConfig(List.of("latency"), List.of("request_volume"),
                "This indicates backend degradation rather than a traffic surge; inspect recent deploys and dependencies."));
        rules.add(new RecommendationRuleConfig(List.of("response_size_variance", "error_rate"), List.of(),
                "Inspect error response payloads for truncated or malformed bodies."));
        rules.add(new RecommendationRuleConfig(List.of("request_volume:decrease", "latency"), List.of(),
                "Clients may be timing out; check client-side timeouts and retries."));
        return rules;
    }

    // ---------------------------------------------------------------
    // Getters / Setters (required for SnakeYAML)
    // ---------------------------------------------------------------

    public List<String> getWindowSizes() {
        return Collections.unmodifiableList(windowSizes);
    }

    public void setWindowSizes(List<String> windowSizes) {
        this.windowSizes = windowSizes != null ? new ArrayList<>(windowSizes) : new ArrayList<>();
    }

    public String getLateGracePeriod() {
        return lateGracePeriod;
    }

    public void setLateGracePeriod(String lateGracePeriod) {
        this.lateGracePeriod = lateGracePeriod;
    }

    public String getTickInterval() {
        return tickInterval;
    }

    public void setTickInterval(String tickInterval) {
        this.tickInterval = tickInterval;
    }

    public String getMaxClockSkew() {
        return maxClockSkew;
    }

    public void setMaxClockSkew(String maxClockSkew) {
        this.maxClockSkew = maxClockSkew;
    }

    public int getIngestBufferCapacity() {
        return ingestBufferCapacity;
    }

    public void setIngestBufferCapacity(int ingestBufferCapacity) {
        this.ingestBufferCapacity = ingestBufferCapacity;
    }

    public int getIngestWorkers() {
        return ingestWorkers;
    }

    public void setIngestWorkers(int ingestWorkers) {
        this.ingestWorkers = ingestWorkers;
    }

    public int getAnalysisThreads() {
        return analysisThreads;
    }

    public void setAnalysisThreads(int analysisThreads) {
        this.analysisThreads = analysisThreads;
    }

    public int getMinSamples() {
        return minSamples;
    }

    public void setMinSamples(int minSamples) {
        this.minSamples = minSamples;
    }

    public int getMinSignalCount() {
        return minSignalCount;
    }

    public void setMinSignalCount(int minSignalCount) {
        this.minSignalCount = minSignalCount;
    }

    public String getJoinTolerance() {
        return joinTolerance;
    }

    public void setJoinTolerance(String joinTolerance) {
        this.joinTolerance = joinTolerance;
    }

    public int getResolveAfterHealthyWindows() {
        return resolveAfterHealthyWindows;
    }

    public void setResolveAfterHealthyWindows(int resolveAfterHealthyWindows) {
        this.resolveAfterHealthyWindows = resolveAfterHealthyWindows;
    }

    public int getColdRecoveryCycles() {
        return coldRecoveryCycles;
    }

    public void setColdRecoveryCycles(int coldRecoveryCycles) {
        this.coldRecoveryCycles = coldRecoveryCycles;
    }

    public double getDampenedAlphaFactor() {
        return dampenedAlphaFactor;
    }

    public void setDampenedAlphaFactor(double dampenedAlphaFactor) {
        this.dampenedAlphaFactor = dampenedAlphaFactor;
    }

    public String getDedupBucket() {
        return dedupBucket;
    }

    public void setDedupBucket(String dedupBucket) {
        this.dedupBucket = dedupBucket;
    }

    public Map<String, MetricSettings> getMetrics() {
        return Collections.unmodifiableMap(metrics);
    }

    /**
     * Replace per-metric settings. Metrics not present keep their defaults.
     *
     * @param metrics settings by metric key
     */
    public void setMetrics(Map<String, MetricSettings> metrics) {
        Map<String, MetricSettings> merged = defaultMetrics();
        if (metrics != null) {
            merged.putAll(metrics);
        }
        this.metrics = merged;
    }

    public DetectorSettings getDetector() {
        return detector;
    }

    public void setDetector(DetectorSettings detector) {
        this.detector = detector;
    }

    public SeverityBands getSeverityBands() {
        return severityBands;
    }

    public void setSeverityBands(SeverityBands severityBands) {
        this.severityBands = severityBands;
    }

    public List<String> getCompatiblePairs() {
        return Collections.unmodifiableList(compatiblePairs);
    }

    public void setCompatiblePairs(List<String> compatiblePairs) {
        this.compatiblePairs = compatiblePairs != null ? new ArrayList<>(compatiblePairs) : new ArrayList<>();
    }

    public List<RecommendationRuleConfig> getRecommendations() {
        return Collections.unmodifiableList(recommendations);
    }

    public void setRecommendations(List<RecommendationRuleConfig> recommendations) {
        this.recommendations = recommendations != null ? new ArrayList<>(recommendations) : new ArrayList<>();
    }

    public SinkSettings getSinks() {
        return sinks;
    }

    public void setSinks(SinkSettings sinks) {
        this.sinks = sinks;
    }

    public String getAlertRetention() {
        return alertRetention;
    }

    public void setAlertRetention(String alertRetention) {
        this.alertRetention = alertRetention;
    }

    public String getRetentionInterval() {
        return retentionInterval;
    }

    public void setRetentionInterval(String retentionInterval) {
        this.retentionInterval = retentionInterval;
    }

    public int getMaxAlerts() {
        return maxAlerts;
    }

    public void setMaxAlerts(int maxAlerts) {
        this.maxAlerts = maxAlerts;
    }

    public int getMetricsHistorySize() {
        return metricsHistorySize;
    }

    public void setMetricsHistorySize(int metricsHistorySize) {
        this.metricsHistorySize = metricsHistorySize;
    }

    public int getMaxSignalsPerAlert() {
        return maxSignalsPerAlert;
    }

    public void setMaxSignalsPerAlert(int maxSignalsPerAlert) {
        this.maxSignalsPerAlert = maxSignalsPerAlert;
    }

    public int getServerPort() {
        return serverPort;
    }

    public void setServerPort(int serverPort) {
        this.serverPort = serverPort;
    }

    @Override
    public String toString() {
        return "SentinelConfig{" +
                "windowSizes=" + windowSizes +
                ", lateGracePeriod=" + lateGracePeriod +
                ", minSamples=" + minSamples +
                ", minSignalCount=" + minSignalCount +
                ", joinTolerance=" + joinTolerance +
                ", resolveAfterHealthyWindows=" + resolveAfterHealthyWindows +
                ", detector=" + detector +
                ", severityBands=" + severityBands +
                '}';
    }
}
