package com.apisentinel.core.baseline;

import com.apisentinel.core.model.BaselineKey;
import com.apisentinel.core.model.BaselineStat;

import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Owner of the per-{@code (endpoint, windowSize, metric)} baselines.
 *
 * <h3>Contract</h3>
 * <ul>
 * <li>{@link #update} applies the function atomically: concurrent updates of
 * one key never lose an observation.</li>
 * <li>Updates of one key must be applied in window order by the caller; the
 * store does not reorder them.</li>
 * <li>Backends that cannot reach their storage throw
 * {@link StoreUnavailableException}.</li>
 * </ul>
 *
 * @since 1.0.0
 */
public interface BaselineStore {

    /**
     * @param key baseline identity
     * @return the current baseline, empty if the key has never been observed
     * @throws StoreUnavailableException if the backend is unreachable
     */
    Optional<BaselineStat> get(BaselineKey key);

    /**
     * Atomically replace a baseline with {@code fn(current)}. The function
     * receives {@link BaselineStat#empty(BaselineKey)} for unseen keys and may
     * be invoked more than once by optimistic backends, so it must be pure.
     *
     * @param key baseline identity
     * @param fn  update function
     * @return the stored result
     * @throws StoreUnavailableException if the backend is unreachable
     */
    BaselineStat update(BaselineKey key, UnaryOperator<BaselineStat> fn);

    /**
     * @return number of baselines held
     */
    int size();
}
