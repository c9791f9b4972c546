package com.apisentinel.core.pipeline;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.LongSupplier;

/**
 * Named monotonic counters of the pipeline.
 *
 * <p>
 * Counters are created on first use. Components that keep their own counts
 * (the aggregator, the correlator, the sink dispatcher) are attached with
 * {@link #register(String, LongSupplier)} and read at snapshot time.
 * </p>
 *
 * @since 1.0.0
 */
public class PipelineCounters {

    public static final String RECORDS_ACCEPTED = "records_accepted";
    public static final String REJECTED_INVALID = "rejected_invalid";
    public static final String BUFFER_DROPPED = "buffer_dropped";
    public static final String LATE_DROPPED = "late_dropped";
    public static final String WINDOWS_CLOSED = "windows_closed";
    public static final String SIGNALS_EMITTED = "signals_emitted";
    public static final String NEAR_MISSES = "near_misses";
    public static final String ALERTS_OPENED = "alerts_opened";
    public static final String ALERTS_RESOLVED = "alerts_resolved";
    public static final String SINK_FAILURES = "sink_failures";
    public static final String ANALYSIS_FAILURES = "analysis_failures";

    private final Map<String, LongAdder> counters = new ConcurrentHashMap<>();
    private final Map<String, LongSupplier> external = new ConcurrentHashMap<>();

    public void increment(String name) {
        add(name, 1);
    }

    public void add(String name, long delta) {
        counters.computeIfAbsent(name, n -> new LongAdder()).add(delta);
    }

    /**
     * @param name     counter name
     * @param supplier source read at snapshot time
     */
    public void register(String name, LongSupplier supplier) {
        external.put(name, supplier);
    }

    public long get(String name) {
        LongSupplier supplier = external.get(name);
        long own = counters.containsKey(name) ? counters.get(name).sum() : 0L;
        return supplier != null ? own + supplier.getAsLong() : own;
    }

    /**
     * @return every counter by name, sorted
     */
    public Map<String, Long> snapshot() {
        Map<String, Long> snapshot = new TreeMap<>();
        counters.keySet().forEach(name -> snapshot.put(name, get(name)));
        external.keySet().forEach(name -> snapshot.put(name, get(name)));
        return snapshot;
    }
}
