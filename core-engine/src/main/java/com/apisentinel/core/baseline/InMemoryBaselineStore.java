package com.apisentinel.core.baseline;

import com.apisentinel.core.model.BaselineKey;
import com.apisentinel.core.model.BaselineStat;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.UnaryOperator;

/**
 * {@link BaselineStore} backed by a {@link ConcurrentHashMap}; updates run
 * inside {@code compute}, which makes them atomic per key.
 *
 * @since 1.0.0
 */
public class InMemoryBaselineStore implements BaselineStore {

    private final ConcurrentMap<BaselineKey, BaselineStat> baselines = new ConcurrentHashMap<>();

    @Override
    public Optional<BaselineStat> get(BaselineKey key) {
        Objects.requireNonNull(key, "key must not be null");
        return Optional.ofNullable(baselines.get(key));
    }

    @Override
    public BaselineStat update(BaselineKey key, UnaryOperator<BaselineStat> fn) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(fn, "update function must not be null");
        return baselines.compute(key, (k, current) -> Objects.requireNonNull(
                fn.apply(current != null ? current : BaselineStat.empty(k)),
                "update function returned null for " + k));
    }

    @Override
    public int size() {
        return baselines.size();
    }
}
