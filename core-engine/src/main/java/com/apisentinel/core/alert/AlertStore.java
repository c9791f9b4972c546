package com.apisentinel.core.alert;

import com.apisentinel.core.model.Alert;
import com.apisentinel.core.model.AlertStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.BinaryOperator;

/**
 * Persistence SPI for alerts.
 *
 * <h3>Contract</h3>
 * <ul>
 * <li>At most one non-resolved alert per dedup key.</li>
 * <li>{@link #upsert} stores the candidate when no active alert has its dedup
 * key, otherwise stores {@code merge(existing, candidate)}. It is atomic per
 * dedup key.</li>
 * <li>{@link #transition} is a compare-and-set on the status.</li>
 * <li>{@link #updateHealthyWindows} never touches a resolved alert.</li>
 * <li>Every returned alert is a copy; modifying it never changes stored
 * state.</li>
 * <li>Backends that cannot reach their storage throw
 * {@link com.apisentinel.core.baseline.StoreUnavailableException}.</li>
 * </ul>
 *
 * @since 1.0.0
 */
public interface AlertStore {

    /**
     * @param candidate alert to store; carries id, dedup key and timestamps
     * @param merge     combines the active alert with the candidate
     * @return the stored alert and whether it was created
     */
    UpsertResult upsert(Alert candidate, BinaryOperator<Alert> merge);

    Optional<Alert> get(String id);

    /**
     * @param dedupKey dedup key
     * @return the non-resolved alert with the key, if any
     */
    Optional<Alert> findActive(String dedupKey);

    /**
     * @param query filter
     * @return matching alerts, newest first, at most {@code query.limit}
     */
    List<Alert> list(AlertQuery query);

    /**
     * Change the status of an alert if it still has {@code expected}.
     *
     * @param id       alert id
     * @param expected status the caller observed
     * @param next     new status
     * @param at       time of the change
     * @return the updated alert, or empty if the status was no longer
     *         {@code expected}
     * @throws AlertNotFoundException if the id is unknown
     */
    Optional<Alert> transition(String id, AlertStatus expected, AlertStatus next, Instant at);

    /**
     * Set the healthy-window counter of an alert that is still active.
     *
     * @param id    alert id
     * @param count consecutive healthy windows
     * @return the updated alert, or empty if the alert is unknown or resolved
     */
    Optional<Alert> updateHealthyWindows(String id, int count);

    /**
     * @param cutoff resolved alerts last updated before this are removed
     * @return number of alerts removed
     */
    int purgeResolvedBefore(Instant cutoff);

    int size();
}
