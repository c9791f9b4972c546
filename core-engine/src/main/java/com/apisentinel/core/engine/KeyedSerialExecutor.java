package com.apisentinel.core.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs tasks on a shared pool, serially per key.
 *
 * <p>
 * Tasks submitted with the same key run one at a time in submission order;
 * tasks of different keys run in parallel. A failing task is logged and does
 * not stop the chain of its key.
 * </p>
 *
 * <p>
 * {@link #close()} lets every queued chain run to its end before the pool is
 * shut down; keys still busy after the drain timeout are logged as abandoned.
 * </p>
 *
 * @since 1.0.0
 */
public class KeyedSerialExecutor implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(KeyedSerialExecutor.class);

    private static final Duration DEFAULT_DRAIN_TIMEOUT = Duration.ofSeconds(30);

    private final ExecutorService pool;
    private final Duration drainTimeout;
    private final Map<String, CompletableFuture<Void>> tails = new ConcurrentHashMap<>();
    private final AtomicBoolean closed = new AtomicBoolean();

    public KeyedSerialExecutor(ExecutorService pool) {
        this(pool, DEFAULT_DRAIN_TIMEOUT);
    }

    public KeyedSerialExecutor(ExecutorService pool, Duration drainTimeout) {
        this.pool = Objects.requireNonNull(pool, "pool must not be null");
        this.drainTimeout = Objects.requireNonNull(drainTimeout, "drainTimeout must not be null");
    }

    /**
     * @param key  serialization key
     * @param task task to run after every earlier task of the key
     * @return completes when the task has run, normally even if it failed
     * @throws RejectedExecutionException after {@link #close()}
     */
    public CompletableFuture<Void> submit(String key, Runnable task) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(task, "task must not be null");
        if (closed.get()) {
            throw new RejectedExecutionException("Executor is closed, task for key " + key + " not accepted");
        }
        CompletableFuture<Void> next = tails.compute(key, (k, tail) -> {
            CompletableFuture<Void> previous = tail == null ? CompletableFuture.completedFuture(null) : tail;
            return previous.thenRunAsync(() -> runSafely(k, task), pool);
        });
        // forget the key once its last task is done
        next.whenComplete((ignored, error) -> {
            tails.remove(key, next);
            if (error != null) {
                LOG.error("Task for key {} was not run", key, error);
            }
        });
        return next;
    }

    private static void runSafely(String key, Runnable task) {
        try {
            task.run();
        } catch (RuntimeException e) {
            LOG.error("Task for key {} failed", key, e);
        }
    }

    /** @return number of keys with queued or running tasks */
    public int activeKeys() {
        return tails.size();
    }

    /**
     * Stop accepting tasks, run the queued ones, then shut the pool down.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        CompletableFuture<?>[] pending = tails.values().toArray(new CompletableFuture[0]);
        try {
            CompletableFuture.allOf(pending).get(drainTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            LOG.warn("Tasks still queued after {}; abandoning keys {}", drainTimeout, tails.keySet());
        } catch (ExecutionException e) {
            // already logged per key
            LOG.debug("Queued task ended exceptionally during drain", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while draining; abandoning keys {}", tails.keySet());
        }
        pool.shutdown();
        try {
            if (!pool.awaitTermination(drainTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                LOG.warn("Pool did not terminate in time; {} key(s) still busy", tails.size());
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pool.shutdownNow();
        }
    }
}
