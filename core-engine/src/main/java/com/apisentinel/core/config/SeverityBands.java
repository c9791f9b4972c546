package com.apisentinel.core.config;

import com.apisentinel.core.model.Severity;

import java.io.Serializable;

/**
 * Maps the strongest |z| of an alert to a {@link Severity}.
 *
 * <pre>
 * severityBands:
 *   warn: 4.0
 *   critical: 6.0
 * </pre>
 *
 * @since 1.0.0
 */
public class SeverityBands implements Serializable {

    private static final long serialVersionUID = 1L;

    private double warn = 4.0;
    private double critical = 6.0;

    public SeverityBands() {
    }

    public SeverityBands(double warn, double critical) {
        this.warn = warn;
        this.critical = critical;
    }

    /**
     * @param absZ absolute z-score
     * @return {@code CRITICAL} at or above {@code critical}, {@code WARN} at or
     *         above {@code warn}, otherwise {@code INFO}
     */
    public Severity classify(double absZ) {
        if (absZ >= critical) {
            return Severity.CRITICAL;
        }
        if (absZ >= warn) {
            return Severity.WARN;
        }
        return Severity.INFO;
    }

    public double getWarn() {
        return warn;
    }

    public void setWarn(double warn) {
        this.warn = warn;
    }

    public double getCritical() {
        return critical;
    }

    public void setCritical(double critical) {
        this.critical = critical;
    }

    @Override
    public String toString() {
        return "SeverityBands{warn=" + warn + ", critical=" + critical + '}';
    }
}
