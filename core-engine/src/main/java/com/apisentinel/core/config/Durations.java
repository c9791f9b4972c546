package com.apisentinel.core.config;

import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses and formats the compact duration notation used in configuration
 * files: {@code 500ms}, {@code 30s}, {@code 1m}, {@code 15m}, {@code 1h},
 * {@code 90d}.
 *
 * @since 1.0.0
 */
public final class Durations {

    private static final Pattern PATTERN = Pattern.compile("^(\\d+)\\s*(ms|s|m|h|d)$");

    private Durations() {
        // utility class, not instantiable
    }

    /**
     * @param text duration text, e.g. {@code 5m}
     * @return the parsed duration
     * @throws IllegalArgumentException if the text does not match the notation
     */
    public static Duration parse(String text) {
        Objects.requireNonNull(text, "Duration text must not be null");
        Matcher m = PATTERN.matcher(text.trim().toLowerCase(Locale.ROOT));
        if (!m.matches()) {
            throw new IllegalArgumentException("Invalid duration: '" + text
                    + "'. Expected <number><unit> with unit one of ms, s, m, h, d");
        }
        long amount = Long.parseLong(m.group(1));
        return switch (m.group(2)) {
            case "ms" -> Duration.ofMillis(amount);
            case "s" -> Duration.ofSeconds(amount);
            case "m" -> Duration.ofMinutes(amount);
            case "h" -> Duration.ofHours(amount);
            case "d" -> Duration.ofDays(amount);
            default -> throw new IllegalArgumentException("Invalid duration unit in: " + text);
        };
    }

    /**
     * Format a duration with the largest unit that represents it exactly.
     *
     * @param duration the duration
     * @return compact text such as {@code 15m}
     */
    public static String format(Duration duration) {
        long millis = duration.toMillis();
        if (millis != 0 && millis % 86_400_000L == 0) {
            return millis / 86_400_000L + "d";
        }
        if (millis != 0 && millis % 3_600_000L == 0) {
            return millis / 3_600_000L + "h";
        }
        if (millis != 0 && millis % 60_000L == 0) {
            return millis / 60_000L + "m";
        }
        if (millis % 1_000L == 0) {
            return millis / 1_000L + "s";
        }
        return millis + "ms";
    }
}
