package com.apisentinel.core.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Structured and natural-language evidence attached to an {@link Alert}.
 *
 * <ul>
 * <li>{@code summary}: one or two sentences for the on-call engineer</li>
 * <li>{@code changed}: flagged metrics, strongest change first</li>
 * <li>{@code stable}: tracked metrics that stayed within threshold</li>
 * <li>{@code recommendations}: actions from the matching rules</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class Explanation implements Serializable {

    private static final long serialVersionUID = 1L;

    private String summary;
    private List<MetricChange> changed = new ArrayList<>();
    private List<Metric> stable = new ArrayList<>();
    private List<String> recommendations = new ArrayList<>();

    /** No-arg constructor required by Jackson. */
    public Explanation() {
    }

    public Explanation(String summary, List<MetricChange> changed, List<Metric> stable,
            List<String> recommendations) {
        this.summary = summary;
        setChanged(changed);
        setStable(stable);
        setRecommendations(recommendations);
    }

    public String getSummary() {
        return summary;
    }

    public void setSummary(String summary) {
        this.summary = summary;
    }

    public List<MetricChange> getChanged() {
        return Collections.unmodifiableList(changed);
    }

    public void setChanged(List<MetricChange> changed) {
        this.changed = changed != null ? new ArrayList<>(changed) : new ArrayList<>();
    }

    public List<Metric> getStable() {
        return Collections.unmodifiableList(stable);
    }

    public void setStable(List<Metric> stable) {
        this.stable = stable != null ? new ArrayList<>(stable) : new ArrayList<>();
    }

    public List<String> getRecommendations() {
        return Collections.unmodifiableList(recommendations);
    }

    public void setRecommendations(List<String> recommendations) {
        this.recommendations = recommendations != null ? new ArrayList<>(recommendations) : new ArrayList<>();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Explanation that))
            return false;
        return Objects.equals(summary, that.summary)
                && changed.equals(that.changed)
                && stable.equals(that.stable)
                && recommendations.equals(that.recommendations);
    }

    @Override
    public int hashCode() {
        return Objects.hash(summary, changed, stable, recommendations);
    }

    @Override
    public String toString() {
        return summary;
    }
}
