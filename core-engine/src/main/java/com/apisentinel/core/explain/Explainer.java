package com.apisentinel.core.explain;

import com.apisentinel.core.config.Durations;
import com.apisentinel.core.config.RecommendationRuleConfig;
import com.apisentinel.core.config.SeverityBands;
import com.apisentinel.core.model.AnomalySignal;
import com.apisentinel.core.model.Direction;
import com.apisentinel.core.model.Explanation;
import com.apisentinel.core.model.Metric;
import com.apisentinel.core.model.MetricChange;
import com.apisentinel.core.model.MetricObservation;
import com.apisentinel.core.model.Severity;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Turns an alert's signals into an {@link Explanation} and a
 * {@link Severity}.
 *
 * <h3>Ranking</h3>
 * <p>
 * For each metric the latest signal is used. Changes are ordered by absolute
 * percentage delta, strongest first; when the baseline is zero the delta is
 * undefined and |z| is used instead, which places such changes first.
 * </p>
 *
 * <h3>Summary</h3>
 * <p>
 * The summary names up to {@value #MAX_SUMMARY_CHANGES} changes, the endpoint
 * and the window size, then the tracked metrics that remained stable, e.g.
 * "error rate rose from 2.0% to 15.0% and avg latency increased 566.7% to
 * 800.0ms (from 120.0ms) for /checkout over 1m. Request volume and response
 * size variance remained stable."
 * </p>
 *
 * <p>
 * Instances are immutable and thread-safe; {@link #explain} has no side
 * effects.
 * </p>
 *
 * @since 1.0.0
 */
public class Explainer {

    static final int MAX_SUMMARY_CHANGES = 3;

    /** Undefined deltas first by |z|, then by absolute percentage delta. */
    private static final Comparator<AnomalySignal> STRONGEST_FIRST = Comparator
            .comparing((AnomalySignal s) -> !Double.isNaN(s.getPercentDelta()))
            .thenComparing(s -> Double.isNaN(s.getPercentDelta())
                    ? -Math.abs(s.getZScore())
                    : -Math.abs(s.getPercentDelta()));

    private final List<RecommendationRule> rules;
    private final SeverityBands bands;

    public Explainer(List<RecommendationRule> rules, SeverityBands bands) {
        this.rules = List.copyOf(Objects.requireNonNull(rules, "rules must not be null"));
        this.bands = Objects.requireNonNull(bands, "bands must not be null");
    }

    /**
     * @param configs rule definitions from configuration
     * @param bands   severity bands
     * @return an explainer using the parsed rules
     */
    public static Explainer fromConfig(List<RecommendationRuleConfig> configs, SeverityBands bands) {
        return new Explainer(configs.stream().map(RecommendationRule::from).toList(), bands);
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * @param endpoint   endpoint of the alert
     * @param windowSize window size of the strongest evidence
     * @param signals    the alert's signals; must not be empty
     * @param stable     latest within-threshold observations of the endpoint
     * @return the explanation
     */
    public Explanation explain(String endpoint, Duration windowSize, Collection<AnomalySignal> signals,
            Collection<MetricObservation> stable) {
        Objects.requireNonNull(endpoint, "endpoint must not be null");
        if (signals == null || signals.isEmpty()) {
            throw new IllegalArgumentException("Cannot explain an alert without signals");
        }

        List<AnomalySignal> latest = latestPerMetric(signals);
        latest.sort(STRONGEST_FIRST);

        List<MetricChange> changed = new ArrayList<>();
        for (AnomalySignal signal : latest) {
            double pct = signal.getPercentDelta();
            changed.add(new MetricChange(signal.getMetric(), signal.getBaselineValue(), signal.getCurrentValue(),
                    Double.isNaN(pct) ? null : round(pct, 1), round(signal.getZScore(), 2),
                    signal.getDirection()));
        }

        Set<Metric> changedMetrics = EnumSet.noneOf(Metric.class);
        latest.forEach(s -> changedMetrics.add(s.getMetric()));
        Set<Metric> stableMetrics = EnumSet.noneOf(Metric.class);
        for (MetricObservation observation : stable) {
            if (!changedMetrics.contains(observation.getMetric())) {
                stableMetrics.add(observation.getMetric());
            }
        }

        Set<String> recommendations = new LinkedHashSet<>();
        for (RecommendationRule rule : rules) {
            if (rule.matches(signals, stableMetrics)) {
                recommendations.add(rule.getText());
            }
        }

        String summary = summarize(endpoint, windowSize, latest, stableMetrics);
        return new Explanation(summary, changed, new ArrayList<>(stableMetrics), new ArrayList<>(recommendations));
    }

    /**
     * @param signals an alert's signals
     * @return the band of the strongest |z|
     */
    public Severity severity(Collection<AnomalySignal> signals) {
        double max = 0.0;
        for (AnomalySignal signal : signals) {
            if (!Double.isNaN(signal.getZScore())) {
                max = Math.max(max, Math.abs(signal.getZScore()));
            }
        }
        return bands.classify(max);
    }

    // ---------------------------------------------------------------
    // Rendering
    // ---------------------------------------------------------------

    private static String summarize(String endpoint, Duration windowSize, List<AnomalySignal> ranked,
            Set<Metric> stableMetrics) {
        List<String> phrases = new ArrayList<>();
        for (AnomalySignal signal : ranked.subList(0, Math.min(MAX_SUMMARY_CHANGES, ranked.size()))) {
            phrases.add(describe(signal));
        }
        StringBuilder sb = new StringBuilder(joinWithAnd(phrases))
                .append(" for ").append(endpoint)
                .append(" over ").append(Durations.format(windowSize)).append('.');
        if (ranked.size() > MAX_SUMMARY_CHANGES) {
            sb.append(' ').append(ranked.size() - MAX_SUMMARY_CHANGES).append(" more metric(s) also deviated.");
        }
        if (!stableMetrics.isEmpty()) {
            List<String> names = stableMetrics.stream().map(Metric::displayName).toList();
            String stableText = joinWithAnd(names);
            sb.append(' ').append(Character.toUpperCase(stableText.charAt(0))).append(stableText.substring(1))
                    .append(" remained stable.");
        }
        return sb.toString();
    }

    static String describe(AnomalySignal signal) {
        Metric metric = signal.getMetric();
        boolean up = signal.getDirection() == Direction.INCREASE;
        double pct = Math.abs(signal.getPercentDelta());
        double current = signal.getCurrentValue();
        double baseline = signal.getBaselineValue();
        String name = metric.displayName();
        return switch (metric) {
            case AVG_LATENCY, P95_LATENCY -> Double.isNaN(pct)
                    ? String.format(Locale.ROOT, "%s %s to %.1fms", name, up ? "increased" : "decreased", current)
                    : String.format(Locale.ROOT, "%s %s %.1f%% to %.1fms (from %.1fms)", name,
                            up ? "increased" : "decreased", pct, current, baseline);
            case ERROR_RATE -> String.format(Locale.ROOT, "%s %s from %.1f%% to %.1f%%", name,
                    up ? "rose" : "fell", baseline * 100.0, current * 100.0);
            case REQUEST_VOLUME -> Double.isNaN(pct)
                    ? String.format(Locale.ROOT, "%s %s to %.0f requests", name, up ? "increased" : "dropped", current)
                    : String.format(Locale.ROOT, "%s %s %.1f%% to %.0f requests (from %.0f)", name,
                            up ? "increased" : "dropped", pct, current, baseline);
            case RESPONSE_SIZE_VARIANCE -> Double.isNaN(pct)
                    ? String.format(Locale.ROOT, "%s %s to %.1f", name, up ? "increased" : "decreased", current)
                    : String.format(Locale.ROOT, "%s %s %.1f%% (from %.1f to %.1f)", name,
                            up ? "increased" : "decreased", pct, baseline, current);
        };
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static List<AnomalySignal> latestPerMetric(Collection<AnomalySignal> signals) {
        Map<Metric, AnomalySignal> latest = new EnumMap<>(Metric.class);
        for (AnomalySignal signal : signals) {
            latest.merge(signal.getMetric(), signal, (a, b) -> {
                int byEnd = a.getWindowEnd().compareTo(b.getWindowEnd());
                if (byEnd != 0) {
                    return byEnd > 0 ? a : b;
                }
                return Math.abs(a.getZScore()) >= Math.abs(b.getZScore()) ? a : b;
            });
        }
        return new ArrayList<>(latest.values());
    }

    private static String joinWithAnd(List<String> parts) {
        if (parts.size() == 1) {
            return parts.get(0);
        }
        return String.join(", ", parts.subList(0, parts.size() - 1)) + " and " + parts.get(parts.size() - 1);
    }

    private static double round(double value, int places) {
        double scale = Math.pow(10, places);
        return Math.round(value * scale) / scale;
    }
}
