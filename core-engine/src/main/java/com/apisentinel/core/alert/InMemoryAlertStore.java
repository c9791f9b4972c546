package com.apisentinel.core.alert;

import com.apisentinel.core.model.Alert;
import com.apisentinel.core.model.AlertStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BinaryOperator;

/**
 * Reference {@link AlertStore} held in memory.
 *
 * <h3>Capacity</h3>
 * <p>
 * When a new alert would exceed {@code capacity}, the oldest resolved alert
 * (by last update) is evicted. Active alerts are never evicted; if every
 * stored alert is active the store grows beyond its capacity and logs a
 * warning.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * All operations synchronize on the store.
 * </p>
 *
 * @since 1.0.0
 */
public class InMemoryAlertStore implements AlertStore {

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryAlertStore.class);

    public static final int DEFAULT_CAPACITY = 1000;

    private static final Comparator<Alert> NEWEST_FIRST = Comparator
            .comparing(Alert::getCreatedAt, Comparator.nullsLast(Comparator.<Instant>reverseOrder()))
            .thenComparing(Alert::getId, Comparator.nullsLast(Comparator.<String>naturalOrder()));

    private final int capacity;
    private final Map<String, Alert> byId = new LinkedHashMap<>();
    private final Map<String, String> activeIdByDedupKey = new HashMap<>();

    public InMemoryAlertStore() {
        this(DEFAULT_CAPACITY);
    }

    public InMemoryAlertStore(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0, got: " + capacity);
        }
        this.capacity = capacity;
    }

    @Override
    public synchronized UpsertResult upsert(Alert candidate, BinaryOperator<Alert> merge) {
        Objects.requireNonNull(candidate, "candidate must not be null");
        Objects.requireNonNull(merge, "merge must not be null");
        String activeId = activeIdByDedupKey.get(candidate.getDedupKey());
        if (activeId != null) {
            Alert merged = Objects.requireNonNull(merge.apply(byId.get(activeId).copy(), candidate.copy()),
                    "merge returned null");
            byId.put(activeId, merged.copy());
            return new UpsertResult(merged, false);
        }
        Objects.requireNonNull(candidate.getId(), "new alert must carry an id");
        evictIfFull();
        byId.put(candidate.getId(), candidate.copy());
        if (candidate.isActive()) {
            activeIdByDedupKey.put(candidate.getDedupKey(), candidate.getId());
        }
        return new UpsertResult(candidate.copy(), true);
    }

    @Override
    public synchronized Optional<Alert> get(String id) {
        Alert alert = byId.get(id);
        return alert == null ? Optional.empty() : Optional.of(alert.copy());
    }

    @Override
    public synchronized Optional<Alert> findActive(String dedupKey) {
        String id = activeIdByDedupKey.get(dedupKey);
        return id == null ? Optional.empty() : get(id);
    }

    @Override
    public synchronized List<Alert> list(AlertQuery query) {
        Objects.requireNonNull(query, "query must not be null");
        return byId.values().stream()
                .filter(query::matches)
                .sorted(NEWEST_FIRST)
                .limit(query.getLimit())
                .map(Alert::copy)
                .toList();
    }

    @Override
    public synchronized Optional<Alert> transition(String id, AlertStatus expected, AlertStatus next, Instant at) {
        Alert alert = byId.get(id);
        if (alert == null) {
            throw new AlertNotFoundException(id);
        }
        if (alert.getStatus() != expected) {
            return Optional.empty();
        }
        alert.setStatus(next);
        alert.setUpdatedAt(at);
        if (!next.isActive()) {
            activeIdByDedupKey.remove(alert.getDedupKey(), id);
        }
        return Optional.of(alert.copy());
    }

    @Override
    public synchronized Optional<Alert> updateHealthyWindows(String id, int count) {
        Alert alert = byId.get(id);
        if (alert == null || !alert.isActive()) {
            return Optional.empty();
        }
        alert.setConsecutiveHealthyWindows(count);
        return Optional.of(alert.copy());
    }

    @Override
    public synchronized int purgeResolvedBefore(Instant cutoff) {
        int removed = 0;
        Iterator<Alert> it = byId.values().iterator();
        while (it.hasNext()) {
            Alert alert = it.next();
            if (!alert.isActive() && alert.getUpdatedAt() != null && alert.getUpdatedAt().isBefore(cutoff)) {
                it.remove();
                removed++;
            }
        }
        return removed;
    }

    @Override
    public synchronized int size() {
        return byId.size();
    }

    private void evictIfFull() {
        if (byId.size() < capacity) {
            return;
        }
        Optional<Alert> oldestResolved = byId.values().stream()
                .filter(a -> !a.isActive())
                .min(Comparator.comparing(Alert::getUpdatedAt, Comparator.nullsFirst(Comparator.naturalOrder())));
        if (oldestResolved.isPresent()) {
            byId.remove(oldestResolved.get().getId());
            LOG.debug("Evicted resolved alert {} (capacity {})", oldestResolved.get().getId(), capacity);
        } else {
            LOG.warn("Alert store holds {} active alerts, exceeding capacity {}", byId.size(), capacity);
        }
    }
}
