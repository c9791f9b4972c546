package com.apisentinel.core.aggregation;

import com.apisentinel.core.model.NormalizedRecord;
import com.apisentinel.core.model.WindowAggregate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Folds normalized records into epoch-aligned tumbling windows and emits one
 * {@link WindowAggregate} per {@code (endpoint, windowSize, windowStart)}.
 *
 * <h3>Closing</h3>
 * <p>
 * A window closes once {@code now >= windowEnd + lateGracePeriod}. Records for
 * a window still inside its grace period are accepted; records for a window
 * that has already been emitted are dropped and counted. After the first
 * emission of a slot, windows without records are emitted as empty aggregates
 * (volume 0) up to the latest due window, so silence shows up as a volume drop.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * State is split into one slot per {@code (endpoint, windowSize)}, each guarded
 * by its own lock. Writers on different endpoints never contend, and a slot
 * emits under its lock so a flush is all-or-nothing.
 * </p>
 *
 * @since 1.0.0
 */
public class WindowAggregator {

    private static final Logger LOG = LoggerFactory.getLogger(WindowAggregator.class);

    /** Largest run of empty windows filled in one go; longer gaps are skipped. */
    static final int MAX_EMPTY_WINDOWS = 1440;

    private static final Comparator<WindowAggregate> EMIT_ORDER = Comparator
            .comparing(WindowAggregate::getWindowEnd)
            .thenComparing(WindowAggregate::getWindowSize)
            .thenComparing(WindowAggregate::getEndpoint);

    private final List<Duration> windowSizes;
    private final long graceMillis;
    private final double sketchAccuracy;
    private final Map<String, Slot[]> slotsByEndpoint = new ConcurrentHashMap<>();
    private final LongAdder lateDropped = new LongAdder();

    public WindowAggregator(List<Duration> windowSizes, Duration lateGracePeriod) {
        this(windowSizes, lateGracePeriod, LatencySketch.DEFAULT_RELATIVE_ACCURACY);
    }

    /**
     * @param windowSizes     tumbling window sizes; must not be empty
     * @param lateGracePeriod how long a window stays open after its end
     * @param sketchAccuracy  relative error of the p95 estimate
     */
    public WindowAggregator(List<Duration> windowSizes, Duration lateGracePeriod, double sketchAccuracy) {
        Objects.requireNonNull(windowSizes, "windowSizes must not be null");
        Objects.requireNonNull(lateGracePeriod, "lateGracePeriod must not be null");
        if (windowSizes.isEmpty()) {
            throw new IllegalArgumentException("At least one window size is required");
        }
        for (Duration size : windowSizes) {
            if (size.isNegative() || size.isZero()) {
                throw new IllegalArgumentException("Window size must be positive, got " + size);
            }
        }
        if (lateGracePeriod.isNegative()) {
            throw new IllegalArgumentException("lateGracePeriod must be >= 0, got " + lateGracePeriod);
        }
        this.windowSizes = List.copyOf(windowSizes);
        this.graceMillis = lateGracePeriod.toMillis();
        this.sketchAccuracy = sketchAccuracy;
    }

    // ---------------------------------------------------------------
    // Ingestion
    // ---------------------------------------------------------------

    /**
     * Fold a record into every window size.
     *
     * @param record validated record; must not be {@code null}
     * @return {@code false} if the record arrived after one of its windows had
     *         already been emitted (it still counts towards the others)
     */
    public boolean add(NormalizedRecord record) {
        Objects.requireNonNull(record, "record must not be null");
        Slot[] slots = slotsByEndpoint.computeIfAbsent(record.getEndpoint(), this::newSlots);
        long timestamp = record.getTimestamp().toEpochMilli();
        boolean onTime = true;
        for (Slot slot : slots) {
            onTime &= slot.add(record, timestamp);
        }
        if (!onTime) {
            lateDropped.increment();
            LOG.debug("Late record for {} at {} dropped from closed window(s)",
                    record.getEndpoint(), record.getTimestamp());
        }
        return onTime;
    }

    // ---------------------------------------------------------------
    // Closing
    // ---------------------------------------------------------------

    /**
     * Close every window that is due at {@code now}.
     *
     * @param now current time
     * @return emitted aggregates ordered by window end, then window size
     */
    public List<WindowAggregate> closeDue(Instant now) {
        List<WindowAggregate> emitted = new ArrayList<>();
        long nowMillis = now.toEpochMilli();
        for (Slot[] slots : slotsByEndpoint.values()) {
            for (Slot slot : slots) {
                slot.closeDue(nowMillis, emitted);
            }
        }
        emitted.sort(EMIT_ORDER);
        return emitted;
    }

    /**
     * Close the due windows of a single endpoint.
     *
     * @param endpoint endpoint to flush
     * @param now      current time
     * @return emitted aggregates ordered by window end, then window size
     */
    public List<WindowAggregate> closeDue(String endpoint, Instant now) {
        Slot[] slots = slotsByEndpoint.get(endpoint);
        if (slots == null) {
            return List.of();
        }
        List<WindowAggregate> emitted = new ArrayList<>();
        for (Slot slot : slots) {
            slot.closeDue(now.toEpochMilli(), emitted);
        }
        emitted.sort(EMIT_ORDER);
        return emitted;
    }

    /**
     * @param endpoint endpoint
     * @return the earliest instant at which {@link #closeDue(String, Instant)}
     *         will emit something for the endpoint, empty if it has no state
     */
    public Optional<Instant> nextDue(String endpoint) {
        Slot[] slots = slotsByEndpoint.get(endpoint);
        if (slots == null) {
            return Optional.empty();
        }
        long earliest = Long.MAX_VALUE;
        for (Slot slot : slots) {
            earliest = Math.min(earliest, slot.nextDue());
        }
        return earliest == Long.MAX_VALUE ? Optional.empty() : Optional.of(Instant.ofEpochMilli(earliest));
    }

    // ---------------------------------------------------------------
    // Introspection
    // ---------------------------------------------------------------

    public long getLateDropped() {
        return lateDropped.sum();
    }

    public Set<String> endpoints() {
        return Set.copyOf(slotsByEndpoint.keySet());
    }

    public List<Duration> getWindowSizes() {
        return windowSizes;
    }

    /**
     * @return windows currently accumulating records, across all endpoints
     */
    public int openWindowCount() {
        int open = 0;
        for (Slot[] slots : slotsByEndpoint.values()) {
            for (Slot slot : slots) {
                open += slot.openCount();
            }
        }
        return open;
    }

    private Slot[] newSlots(String endpoint) {
        Slot[] slots = new Slot[windowSizes.size()];
        for (int i = 0; i < slots.length; i++) {
            slots[i] = new Slot(endpoint, windowSizes.get(i));
        }
        return slots;
    }

    // ---------------------------------------------------------------
    // Slot
    // ---------------------------------------------------------------

    private final class Slot {

        private final String endpoint;
        private final Duration size;
        private final long sizeMillis;
        private final ReentrantLock lock = new ReentrantLock();

        /** Open windows keyed by start, epoch millis. */
        private final TreeMap<Long, WindowAccumulator> open = new TreeMap<>();

        /** End of the latest emitted window; {@code Long.MIN_VALUE} before the first. */
        private long closedThrough = Long.MIN_VALUE;

        Slot(String endpoint, Duration size) {
            this.endpoint = endpoint;
            this.size = size;
            this.sizeMillis = size.toMillis();
        }

        boolean add(NormalizedRecord record, long timestamp) {
            long start = Math.floorDiv(timestamp, sizeMillis) * sizeMillis;
            lock.lock();
            try {
                if (start + sizeMillis <= closedThrough) {
                    return false;
                }
                open.computeIfAbsent(start, s -> new WindowAccumulator(sketchAccuracy)).add(record);
                return true;
            } finally {
                lock.unlock();
            }
        }

        void closeDue(long now, List<WindowAggregate> sink) {
            long latestDueEnd = Math.floorDiv(now - graceMillis, sizeMillis) * sizeMillis;
            lock.lock();
            try {
                Iterator<Map.Entry<Long, WindowAccumulator>> it = open.entrySet().iterator();
                while (it.hasNext()) {
                    Map.Entry<Long, WindowAccumulator> entry = it.next();
                    long start = entry.getKey();
                    if (start + sizeMillis > latestDueEnd) {
                        break;
                    }
                    fillGap(start, sink);
                    sink.add(entry.getValue().toAggregate(endpoint, size, Instant.ofEpochMilli(start)));
                    closedThrough = start + sizeMillis;
                    it.remove();
                }
                if (closedThrough != Long.MIN_VALUE && closedThrough < latestDueEnd) {
                    fillGap(latestDueEnd, sink);
                }
            } finally {
                lock.unlock();
            }
        }

        /** Emit empty windows from {@code closedThrough} up to {@code until}. */
        private void fillGap(long until, List<WindowAggregate> sink) {
            if (closedThrough == Long.MIN_VALUE || closedThrough >= until) {
                return;
            }
            long missing = (until - closedThrough) / sizeMillis;
            if (missing > MAX_EMPTY_WINDOWS) {
                LOG.warn("Skipping {} empty {} windows for {} (gap too long)", missing, size, endpoint);
                closedThrough = until;
                return;
            }
            for (long start = closedThrough; start < until; start += sizeMillis) {
                sink.add(WindowAccumulator.empty(endpoint, size, Instant.ofEpochMilli(start)));
            }
            closedThrough = until;
        }

        long nextDue() {
            lock.lock();
            try {
                if (!open.isEmpty()) {
                    return open.firstKey() + sizeMillis + graceMillis;
                }
                if (closedThrough != Long.MIN_VALUE) {
                    return closedThrough + sizeMillis + graceMillis;
                }
                return Long.MAX_VALUE;
            } finally {
                lock.unlock();
            }
        }

        int openCount() {
            lock.lock();
            try {
                return open.size();
            } finally {
                lock.unlock();
            }
        }
    }
}
