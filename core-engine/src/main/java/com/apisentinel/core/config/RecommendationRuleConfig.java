package com.apisentinel.core.config;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * YAML form of one recommendation rule.
 *
 * <pre>
 * recommendations:
 *   - changed: [latency, error_rate]
 *     stable: []
 *     text: "Check backend services and database health."
 * </pre>
 *
 * <p>
 * Entries of {@code changed} and {@code stable} are metric patterns
 * ({@code metric[:direction]}, with {@code latency} matching either latency
 * metric).
 * </p>
 *
 * @since 1.0.0
 */
public class RecommendationRuleConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    private List<String> changed = new ArrayList<>();
    private List<String> stable = new ArrayList<>();
    private String text;

    public RecommendationRuleConfig() {
    }

    public RecommendationRuleConfig(List<String> changed, List<String> stable, String text) {
        setChanged(changed);
        setStable(stable);
        this.text = text;
    }

    public List<String> getChanged() {
        return Collections.unmodifiableList(changed);
    }

    public void setChanged(List<String> changed) {
        this.changed = changed != null ? new ArrayList<>(changed) : new ArrayList<>();
    }

    public List<String> getStable() {
        return Collections.unmodifiableList(stable);
    }

    public void setStable(List<String> stable) {
        this.stable = stable != null ? new ArrayList<>(stable) : new ArrayList<>();
    }

    public String getText() {
        return text;
    }

    public void setText(String text) {
        this.text = text;
    }

    @Override
    public String toString() {
        return "RecommendationRule{changed=" + changed + ", stable=" + stable + '}';
    }
}
