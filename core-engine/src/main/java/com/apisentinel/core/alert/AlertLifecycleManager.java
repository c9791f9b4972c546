package com.apisentinel.core.alert;

import com.apisentinel.core.model.Alert;
import com.apisentinel.core.model.AlertStatus;
import com.apisentinel.core.model.AnomalySignal;
import com.apisentinel.core.model.Metric;
import com.apisentinel.core.model.Severity;
import com.google.common.util.concurrent.Striped;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.Lock;

/**
 * Creates, merges, transitions and purges alerts on top of an
 * {@link AlertStore}.
 *
 * <h3>Idempotent upsert</h3>
 * <p>
 * {@link #upsert(Alert)} creates a new alert (fresh id, {@code createdAt})
 * when no active alert has the candidate's dedup key, and otherwise merges
 * into it: signals are unioned (deduplicated by metric, window size and window
 * end), the window range widens, the stronger severity and the latest
 * explanation win. Each metric keeps its newest {@code maxSignalsPerAlert}
 * signals, so a metric that confirmed the alert stays on it however long
 * another metric keeps firing.
 * </p>
 *
 * <h3>Locking</h3>
 * <p>
 * Upserts, healthy-counter updates and status transitions of one dedup key
 * serialize on a lock striped by key, so the one-active-alert invariant holds
 * on any backend and a resolved alert is never reopened.
 * </p>
 *
 * <h3>Notifications</h3>
 * <p>
 * After every successful persist an {@link AlertNotification} is published to
 * the registered {@link AlertListener}s. A failing listener is logged and
 * skipped.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertLifecycleManager {

    private static final Logger LOG = LoggerFactory.getLogger(AlertLifecycleManager.class);

    private static final int LOCK_STRIPES = 64;

    private static final Comparator<AnomalySignal> SIGNAL_ORDER = Comparator
            .comparing(AnomalySignal::getWindowEnd)
            .thenComparing(AnomalySignal::getWindowSize)
            .thenComparing(AnomalySignal::getMetric);

    private final AlertStore store;
    private final Clock clock;
    private final int maxSignalsPerAlert;
    private final Striped<Lock> locks = Striped.lock(LOCK_STRIPES);
    private final List<AlertListener> listeners = new CopyOnWriteArrayList<>();

    public AlertLifecycleManager(AlertStore store, Clock clock, int maxSignalsPerAlert) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (maxSignalsPerAlert <= 0) {
            throw new IllegalArgumentException("maxSignalsPerAlert must be > 0, got: " + maxSignalsPerAlert);
        }
        this.maxSignalsPerAlert = maxSignalsPerAlert;
    }

    public void addListener(AlertListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    // ---------------------------------------------------------------
    // Upsert
    // ---------------------------------------------------------------

    /**
     * Create or extend the active alert with the candidate's dedup key.
     *
     * @param candidate alert carrying endpoint, dedup key, signals, severity and
     *                  explanation; id and timestamps are assigned here
     * @return a copy of the stored alert
     */
    public Alert upsert(Alert candidate) {
        Objects.requireNonNull(candidate, "candidate must not be null");
        Objects.requireNonNull(candidate.getDedupKey(), "candidate dedupKey must not be null");
        Instant now = clock.instant();

        Alert fresh = candidate.toBuilder()
                .id(UUID.randomUUID().toString())
                .status(AlertStatus.OPEN)
                .signals(normalize(candidate.getSignals()))
                .createdAt(now)
                .updatedAt(now)
                .build();
        Severity[] previous = new Severity[1];

        UpsertResult result;
        Lock lock = locks.get(candidate.getDedupKey());
        lock.lock();
        try {
            result = store.upsert(fresh, (existing, incoming) -> {
                previous[0] = existing.getSeverity();
                return merge(existing, incoming, now);
            });
        } finally {
            lock.unlock();
        }

        Alert stored = result.getAlert();
        if (result.isCreated()) {
            LOG.info("Alert {} opened for {}: {} {}", stored.getId(), stored.getEndpoint(),
                    stored.getSeverity(), stored.getMetrics());
            publish(new AlertNotification(AlertNotification.Type.CREATED, stored, null));
        } else {
            LOG.debug("Alert {} updated: {} signal(s), severity {}", stored.getId(),
                    stored.getSignals().size(), stored.getSeverity());
            publish(new AlertNotification(AlertNotification.Type.UPDATED, stored, previous[0]));
        }
        return stored;
    }

    /**
     * Store the healthy-window counter of an active alert. Publishes nothing.
     *
     * @param dedupKey dedup key of the alert
     * @param count    consecutive healthy windows
     * @return the updated alert, empty if no alert with the key is active
     */
    public Optional<Alert> recordHealthyWindows(String dedupKey, int count) {
        Objects.requireNonNull(dedupKey, "dedupKey must not be null");
        Lock lock = locks.get(dedupKey);
        lock.lock();
        try {
            Optional<Alert> active = store.findActive(dedupKey);
            if (active.isEmpty()) {
                return Optional.empty();
            }
            // the store refuses the update if the alert was resolved meanwhile
            return store.updateHealthyWindows(active.get().getId(), count);
        } finally {
            lock.unlock();
        }
    }

    // ---------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------

    public Optional<Alert> get(String id) {
        Objects.requireNonNull(id, "id must not be null");
        return store.get(id);
    }

    public List<Alert> list(AlertQuery query) {
        return store.list(query);
    }

    public Optional<Alert> findActive(String dedupKey) {
        Objects.requireNonNull(dedupKey, "dedupKey must not be null");
        return store.findActive(dedupKey);
    }

    // ---------------------------------------------------------------
    // Transitions
    // ---------------------------------------------------------------

    /**
     * @param id   alert id
     * @param next requested status
     * @return the updated alert
     * @throws AlertNotFoundException           if the id is unknown
     * @throws IllegalStateTransitionException if the edge is not legal from the
     *                                          alert's current status
     */
    public Alert transition(String id, AlertStatus next) {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(next, "next status must not be null");
        String dedupKey = store.get(id).orElseThrow(() -> new AlertNotFoundException(id)).getDedupKey();
        Alert current;
        Alert alert;
        Lock lock = locks.get(dedupKey);
        lock.lock();
        try {
            while (true) {
                current = store.get(id).orElseThrow(() -> new AlertNotFoundException(id));
                if (!current.getStatus().canTransitionTo(next)) {
                    throw new IllegalStateTransitionException(id, current.getStatus(), next);
                }
                Optional<Alert> updated = store.transition(id, current.getStatus(), next, clock.instant());
                if (updated.isPresent()) {
                    alert = updated.get();
                    break;
                }
                LOG.debug("Alert {} changed concurrently, retrying transition to {}", id, next);
            }
        } finally {
            lock.unlock();
        }
        LOG.info("Alert {} for {}: {} -> {}", id, alert.getEndpoint(), current.getStatus(), next);
        AlertNotification.Type type = next == AlertStatus.RESOLVED
                ? AlertNotification.Type.RESOLVED
                : AlertNotification.Type.ACKNOWLEDGED;
        publish(new AlertNotification(type, alert, current.getSeverity()));
        return alert;
    }

    /**
     * @param retention resolved alerts older than this are removed
     * @return number of alerts removed
     */
    public int purgeResolvedOlderThan(Duration retention) {
        int removed = store.purgeResolvedBefore(clock.instant().minus(retention));
        if (removed > 0) {
            LOG.info("Purged {} resolved alert(s) older than {}", removed, retention);
        }
        return removed;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private Alert merge(Alert existing, Alert incoming, Instant now) {
        List<AnomalySignal> signals = new ArrayList<>(existing.getSignals());
        signals.addAll(incoming.getSignals());

        Alert merged = existing.toBuilder()
                .signals(normalize(signals))
                .windowStart(earliest(existing.getWindowStart(), incoming.getWindowStart()))
                .windowEnd(latest(existing.getWindowEnd(), incoming.getWindowEnd()))
                .severity(existing.getSeverity().max(incoming.getSeverity()))
                .explanation(incoming.getExplanation() != null ? incoming.getExplanation() : existing.getExplanation())
                .consecutiveHealthyWindows(incoming.getConsecutiveHealthyWindows())
                .updatedAt(now)
                .build();
        return merged;
    }

    /** Deduplicate by (metric, windowSize, windowEnd), keep the newest of each metric, order by window end. */
    private List<AnomalySignal> normalize(List<AnomalySignal> signals) {
        Map<String, AnomalySignal> unique = new LinkedHashMap<>();
        for (AnomalySignal signal : signals) {
            unique.put(signal.getMetric() + "|" + signal.getWindowSize() + "|" + signal.getWindowEnd(), signal);
        }
        Map<Metric, List<AnomalySignal>> byMetric = new EnumMap<>(Metric.class);
        for (AnomalySignal signal : unique.values()) {
            byMetric.computeIfAbsent(signal.getMetric(), m -> new ArrayList<>()).add(signal);
        }
        List<AnomalySignal> kept = new ArrayList<>();
        for (List<AnomalySignal> ofMetric : byMetric.values()) {
            ofMetric.sort(SIGNAL_ORDER);
            kept.addAll(ofMetric.subList(Math.max(0, ofMetric.size() - maxSignalsPerAlert), ofMetric.size()));
        }
        kept.sort(SIGNAL_ORDER);
        return kept;
    }

    private void publish(AlertNotification notification) {
        for (AlertListener listener : listeners) {
            try {
                listener.onAlert(notification);
            } catch (RuntimeException e) {
                LOG.error("Alert listener {} failed for {}", listener, notification, e);
            }
        }
    }

    private static Instant earliest(Instant a, Instant b) {
        if (a == null) {
            return b;
        }
        return b == null || a.isBefore(b) ? a : b;
    }

    private static Instant latest(Instant a, Instant b) {
        if (a == null) {
            return b;
        }
        return b == null || a.isAfter(b) ? a : b;
    }
}
