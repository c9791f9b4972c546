package com.apisentinel.core.correlation;

import com.apisentinel.core.model.Metric;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.HexFormat;
import java.util.stream.Collectors;

/**
 * Dedup keys of alerts: SHA-256 of
 * {@code endpoint|sorted metric keys|bucket start}, hex encoded.
 *
 * @since 1.0.0
 */
public final class DedupKeys {

    private DedupKeys() {
        // utility class, not instantiable
    }

    /**
     * @param endpoint endpoint
     * @param metrics  metrics of the alert
     * @param at       window end of the confirming signals
     * @param bucket   time bucket width
     * @return the dedup key
     */
    public static String of(String endpoint, Collection<Metric> metrics, Instant at, Duration bucket) {
        long bucketMillis = bucket.toMillis();
        long bucketStart = Math.floorDiv(at.toEpochMilli(), bucketMillis) * bucketMillis;
        String metricPart = metrics.stream().map(Metric::key).sorted().distinct()
                .collect(Collectors.joining(","));
        String material = endpoint + "|" + metricPart + "|" + Instant.ofEpochMilli(bucketStart);
        return sha256(material);
    }

    private static String sha256(String material) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(material.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
