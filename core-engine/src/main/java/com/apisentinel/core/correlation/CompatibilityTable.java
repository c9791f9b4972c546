package com.apisentinel.core.correlation;

import com.apisentinel.core.model.AnomalySignal;
import com.apisentinel.core.model.Metric;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Which metric deviations corroborate each other.
 *
 * <p>
 * Each entry is written {@code pattern + pattern}, e.g.
 * {@code request_volume:decrease + error_rate}. Two signals corroborate when
 * they have different metrics and one matches each side. A pair of two latency
 * patterns is rejected, so average and p95 latency never confirm each other.
 * </p>
 *
 * @since 1.0.0
 */
public final class CompatibilityTable {

    private final List<MetricPattern[]> pairs;

    private CompatibilityTable(List<MetricPattern[]> pairs) {
        this.pairs = pairs;
    }

    /**
     * @param entries pair definitions
     * @return the parsed table
     * @throws IllegalArgumentException if an entry is malformed
     */
    public static CompatibilityTable parse(List<String> entries) {
        Objects.requireNonNull(entries, "Compatibility entries must not be null");
        List<MetricPattern[]> pairs = new ArrayList<>();
        for (String entry : entries) {
            String[] sides = entry.split("\\+");
            if (sides.length != 2) {
                throw new IllegalArgumentException("Invalid compatible pair '" + entry
                        + "'. Expected: <metric[:direction]> + <metric[:direction]>");
            }
            MetricPattern left = MetricPattern.parse(sides[0]);
            MetricPattern right = MetricPattern.parse(sides[1]);
            if (left.isLatencyOnly() && right.isLatencyOnly()) {
                throw new IllegalArgumentException("Invalid compatible pair '" + entry
                        + "': latency metrics cannot corroborate each other");
            }
            pairs.add(new MetricPattern[] {left, right});
        }
        return new CompatibilityTable(List.copyOf(pairs));
    }

    /**
     * @param signals buffered signals
     * @return the metrics that take part in at least one corroborating pair;
     *         empty when nothing corroborates
     */
    public Set<Metric> corroborated(Collection<AnomalySignal> signals) {
        Set<Metric> result = EnumSet.noneOf(Metric.class);
        for (MetricPattern[] pair : pairs) {
            for (AnomalySignal a : signals) {
                if (!pair[0].matches(a)) {
                    continue;
                }
                for (AnomalySignal b : signals) {
                    if (a.getMetric() != b.getMetric() && pair[1].matches(b)) {
                        result.add(a.getMetric());
                        result.add(b.getMetric());
                    }
                }
            }
        }
        return result;
    }

    /**
     * @param signal    a new signal
     * @param confirmed signals already part of an alert
     * @return {@code true} if the signal corroborates at least one of them
     */
    public boolean corroborates(AnomalySignal signal, Collection<AnomalySignal> confirmed) {
        for (AnomalySignal other : confirmed) {
            if (other.getMetric() == signal.getMetric()) {
                continue;
            }
            for (MetricPattern[] pair : pairs) {
                if ((pair[0].matches(signal) && pair[1].matches(other))
                        || (pair[1].matches(signal) && pair[0].matches(other))) {
                    return true;
                }
            }
        }
        return false;
    }

    public int size() {
        return pairs.size();
    }
}
