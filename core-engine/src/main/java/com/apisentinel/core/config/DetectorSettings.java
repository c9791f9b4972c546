package com.apisentinel.core.config;

import java.io.Serializable;

/**
 * Selects and tunes the anomaly detection strategy.
 *
 * <pre>
 * detector:
 *   type: ewma            # ewma | isolation
 *   isolationScoreThreshold: 0.7
 *   isolationTrees: 50
 *   recentValuesSize: 64
 *   seed: 42
 * </pre>
 *
 * @since 1.0.0
 */
public class DetectorSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    private String type = "ewma";
    private double isolationScoreThreshold = 0.7;
    private int isolationTrees = 50;

    /** Healthy observations kept per baseline for the isolation strategy. */
    private int recentValuesSize = 64;

    private long seed = 42L;

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public double getIsolationScoreThreshold() {
        return isolationScoreThreshold;
    }

    public void setIsolationScoreThreshold(double isolationScoreThreshold) {
        this.isolationScoreThreshold = isolationScoreThreshold;
    }

    public int getIsolationTrees() {
        return isolationTrees;
    }

    public void setIsolationTrees(int isolationTrees) {
        this.isolationTrees = isolationTrees;
    }

    public int getRecentValuesSize() {
        return recentValuesSize;
    }

    public void setRecentValuesSize(int recentValuesSize) {
        this.recentValuesSize = recentValuesSize;
    }

    public long getSeed() {
        return seed;
    }

    public void setSeed(long seed) {
        this.seed = seed;
    }

    @Override
    public String toString() {
        return "DetectorSettings{type='" + type + "', isolationScoreThreshold=" + isolationScoreThreshold
                + ", isolationTrees=" + isolationTrees + ", recentValuesSize=" + recentValuesSize + '}';
    }
}
