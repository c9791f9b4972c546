package com.apisentinel.core.engine;

import com.apisentinel.core.model.WindowAggregate;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Bounded history of closed window aggregates.
 *
 * <p>
 * Keeps the most recent {@code historySize} aggregates per
 * {@code (endpoint, windowSize)}. Queries return aggregates in ascending
 * window-end order strictly after a cursor, so a client pages through history
 * by passing the last window end it saw.
 * </p>
 *
 * @since 1.0.0
 */
public class MetricsRepository {

    private static final Comparator<WindowAggregate> BY_END = Comparator
            .comparing(WindowAggregate::getWindowEnd)
            .thenComparing(WindowAggregate::getWindowSize);

    private final int historySize;
    private final Map<String, Map<Duration, Deque<WindowAggregate>>> history = new ConcurrentHashMap<>();

    public MetricsRepository(int historySize) {
        if (historySize <= 0) {
            throw new IllegalArgumentException("historySize must be > 0, got: " + historySize);
        }
        this.historySize = historySize;
    }

    public void record(WindowAggregate window) {
        Objects.requireNonNull(window, "window must not be null");
        Deque<WindowAggregate> series = history
                .computeIfAbsent(window.getEndpoint(), e -> new ConcurrentHashMap<>())
                .computeIfAbsent(window.getWindowSize(), s -> new ArrayDeque<>());
        synchronized (series) {
            series.addLast(window);
            while (series.size() > historySize) {
                series.removeFirst();
            }
        }
    }

    /**
     * @param endpoint   endpoint
     * @param windowSize window size, or {@code null} for every size
     * @param after      exclusive lower bound on window end, or {@code null}
     * @param limit      maximum number of aggregates
     * @return matching aggregates, ascending by window end
     */
    public List<WindowAggregate> query(String endpoint, Duration windowSize, Instant after, int limit) {
        Objects.requireNonNull(endpoint, "endpoint must not be null");
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be > 0, got: " + limit);
        }
        Map<Duration, Deque<WindowAggregate>> bySize = history.getOrDefault(endpoint, Map.of());
        List<WindowAggregate> matches = new ArrayList<>();
        for (Map.Entry<Duration, Deque<WindowAggregate>> entry : bySize.entrySet()) {
            if (windowSize != null && !windowSize.equals(entry.getKey())) {
                continue;
            }
            Deque<WindowAggregate> series = entry.getValue();
            synchronized (series) {
                for (WindowAggregate window : series) {
                    if (after == null || window.getWindowEnd().isAfter(after)) {
                        matches.add(window);
                    }
                }
            }
        }
        matches.sort(BY_END);
        return matches.size() > limit ? new ArrayList<>(matches.subList(0, limit)) : matches;
    }
}
