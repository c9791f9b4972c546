package com.apisentinel.core.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks backends that are currently failing.
 *
 * <p>
 * A component raises the indicator when an operation fails with a
 * store-unavailable error and clears it on the next success; the engine is
 * degraded while any component is raised.
 * </p>
 *
 * @since 1.0.0
 */
public class DegradedModeIndicator {

    private static final Logger LOG = LoggerFactory.getLogger(DegradedModeIndicator.class);

    private final Map<String, String> reasons = new ConcurrentHashMap<>();

    public void raise(String component, String reason) {
        if (reasons.put(component, reason == null ? "unavailable" : reason) == null) {
            LOG.warn("Entering degraded mode: {} unavailable ({})", component, reason);
        }
    }

    public void clear(String component) {
        if (reasons.remove(component) != null) {
            LOG.info("{} recovered", component);
        }
    }

    public boolean isDegraded() {
        return !reasons.isEmpty();
    }

    /**
     * @return failing components and their last error, sorted by component
     */
    public Map<String, String> reasons() {
        return new TreeMap<>(reasons);
    }
}
