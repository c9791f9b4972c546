package com.apisentinel.core.detection;

import com.apisentinel.core.config.DetectorSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Objects;

/**
 * Creates the {@link AnomalyDetector} selected by {@code detector.type}.
 *
 * <p>
 * This is the single point of extension when adding a strategy: register the
 * type string here and create the corresponding detector.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectorFactory {

    private static final Logger LOG = LoggerFactory.getLogger(DetectorFactory.class);

    private DetectorFactory() {
        // utility class, not instantiable
    }

    /**
     * @param settings detector settings; must not be {@code null}
     * @return the configured detector
     * @throws NullPointerException     if {@code settings} or its type is
     *                                  {@code null}
     * @throws IllegalArgumentException if the type is unknown
     */
    public static AnomalyDetector create(DetectorSettings settings) {
        Objects.requireNonNull(settings, "DetectorSettings must not be null");
        Objects.requireNonNull(settings.getType(), "Detector type must not be null");

        String type = settings.getType().toLowerCase(Locale.ROOT);
        AnomalyDetector detector = switch (type) {
            case EwmaZScoreDetector.NAME -> new EwmaZScoreDetector();
            case IsolationScoreDetector.NAME -> new IsolationScoreDetector(
                    settings.getIsolationScoreThreshold(), settings.getIsolationTrees(), settings.getSeed());
            default -> throw new IllegalArgumentException(
                    "Unknown detector type: '" + settings.getType()
                            + "'. Supported types: ewma, isolation");
        };
        LOG.info("Using '{}' anomaly detector", detector.getName());
        return detector;
    }
}
