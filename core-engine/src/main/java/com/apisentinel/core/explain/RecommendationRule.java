package com.apisentinel.core.explain;

import com.apisentinel.core.config.RecommendationRuleConfig;
import com.apisentinel.core.correlation.MetricPattern;
import com.apisentinel.core.model.AnomalySignal;
import com.apisentinel.core.model.Metric;

import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Emits a recommendation when every {@code changed} pattern matches one of an
 * alert's signals and every {@code stable} pattern names a metric that stayed
 * within its threshold.
 *
 * @since 1.0.0
 */
public final class RecommendationRule {

    private final List<MetricPattern> changed;
    private final List<MetricPattern> stable;
    private final String text;

    public RecommendationRule(List<MetricPattern> changed, List<MetricPattern> stable, String text) {
        this.changed = List.copyOf(changed);
        this.stable = List.copyOf(stable);
        this.text = Objects.requireNonNull(text, "Recommendation text must not be null");
    }

    public static RecommendationRule from(RecommendationRuleConfig config) {
        return new RecommendationRule(
                config.getChanged().stream().map(MetricPattern::parse).toList(),
                config.getStable().stream().map(MetricPattern::parse).toList(),
                config.getText());
    }

    /**
     * @param signals       the alert's signals
     * @param stableMetrics metrics observed within threshold
     * @return {@code true} if the rule applies
     */
    public boolean matches(Collection<AnomalySignal> signals, Collection<Metric> stableMetrics) {
        for (MetricPattern pattern : changed) {
            if (signals.stream().noneMatch(pattern::matches)) {
                return false;
            }
        }
        for (MetricPattern pattern : stable) {
            if (stableMetrics.stream().noneMatch(pattern::covers)) {
                return false;
            }
        }
        return true;
    }

    public String getText() {
        return text;
    }

    @Override
    public String toString() {
        return "RecommendationRule{changed=" + changed + ", stable=" + stable + '}';
    }
}
