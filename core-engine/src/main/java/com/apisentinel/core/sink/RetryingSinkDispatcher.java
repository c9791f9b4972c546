package com.apisentinel.core.sink;

import com.apisentinel.core.alert.AlertListener;
import com.apisentinel.core.alert.AlertNotification;
import com.apisentinel.core.model.Alert;
import com.apisentinel.core.model.Severity;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.LongAdder;

/**
 * Routes alert notifications to sinks and retries failed deliveries.
 *
 * <h3>Routing</h3>
 * <p>
 * The alert's severity selects the sinks, e.g. INFO to the console only and
 * WARN and CRITICAL to console and webhook.
 * </p>
 *
 * <h3>Cool-down</h3>
 * <p>
 * Created, acknowledged and resolved alerts are always notified. Updates of an
 * alert notified less than the severity's cool-down ago are suppressed unless
 * the update raises the severity.
 * </p>
 *
 * <h3>Retries</h3>
 * <p>
 * Each sink has a Resilience4j {@link Retry}: retryable
 * {@link SinkDeliveryException}s are retried with exponential backoff from
 * {@code initialBackoff}, doubling up to {@code maxBackoff}, for at most
 * {@code maxAttempts} attempts. Attempts and backoff waits run on the
 * dispatcher's scheduler. Exhausted deliveries are logged and counted; stored
 * alert state is never affected. Once the dispatcher is closed, failed
 * deliveries are given up instead of retried.
 * </p>
 *
 * @since 1.0.0
 */
public class RetryingSinkDispatcher implements AlertListener, AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(RetryingSinkDispatcher.class);

    private final Map<String, AlertSink> sinks = new LinkedHashMap<>();
    private final Map<String, Retry> retries = new LinkedHashMap<>();
    private final Map<Severity, List<String>> routing;
    private final Map<Severity, Duration> cooldown;
    private final ScheduledExecutorService executor;
    private final Clock clock;

    private final Map<String, Instant> lastNotified = new ConcurrentHashMap<>();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final LongAdder delivered = new LongAdder();
    private final LongAdder failures = new LongAdder();
    private final LongAdder suppressed = new LongAdder();

    public RetryingSinkDispatcher(List<AlertSink> sinks, Map<Severity, List<String>> routing,
            Map<Severity, Duration> cooldown, int maxAttempts, Duration initialBackoff, Duration maxBackoff,
            ScheduledExecutorService executor, Clock clock) {
        Objects.requireNonNull(sinks, "sinks must not be null");
        this.routing = new EnumMap<>(Severity.class);
        this.routing.putAll(Objects.requireNonNull(routing, "routing must not be null"));
        this.cooldown = new EnumMap<>(Severity.class);
        this.cooldown.putAll(Objects.requireNonNull(cooldown, "cooldown must not be null"));
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got: " + maxAttempts);
        }
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");

        RetryConfig retryConfig = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        Objects.requireNonNull(initialBackoff, "initialBackoff must not be null"), 2.0,
                        Objects.requireNonNull(maxBackoff, "maxBackoff must not be null")))
                .retryOnException(this::isRetryable)
                .build();
        for (AlertSink sink : sinks) {
            this.sinks.put(sink.getName(), sink);
            Retry retry = Retry.of(sink.getName(), retryConfig);
            retry.getEventPublisher().onRetry(event -> LOG.warn(
                    "Delivery to {} failed (attempt {}/{}), retrying in {}: {}", event.getName(),
                    event.getNumberOfRetryAttempts(), maxAttempts, event.getWaitInterval(),
                    event.getLastThrowable() == null ? "" : event.getLastThrowable().getMessage()));
            retries.put(sink.getName(), retry);
        }
    }

    // ---------------------------------------------------------------
    // AlertListener
    // ---------------------------------------------------------------

    @Override
    public void onAlert(AlertNotification notification) {
        Alert alert = notification.getAlert();
        if (!shouldNotify(notification, alert)) {
            suppressed.increment();
            LOG.debug("Notification for alert {} suppressed by {} cool-down", alert.getId(), alert.getSeverity());
            return;
        }
        for (String name : routing.getOrDefault(alert.getSeverity(), List.of())) {
            AlertSink sink = sinks.get(name);
            if (sink == null) {
                LOG.debug("Sink '{}' routed for {} is not configured", name, alert.getSeverity());
                continue;
            }
            dispatch(sink, notification);
        }
    }

    private boolean shouldNotify(AlertNotification notification, Alert alert) {
        Instant now = clock.instant();
        switch (notification.getType()) {
            case RESOLVED -> {
                lastNotified.remove(alert.getId());
                return true;
            }
            case UPDATED -> {
                Instant last = lastNotified.get(alert.getId());
                Duration window = cooldown.getOrDefault(alert.getSeverity(), Duration.ZERO);
                if (!notification.isEscalation() && last != null && now.isBefore(last.plus(window))) {
                    return false;
                }
                lastNotified.put(alert.getId(), now);
                return true;
            }
            default -> {
                lastNotified.put(alert.getId(), now);
                return true;
            }
        }
    }

    // ---------------------------------------------------------------
    // Delivery
    // ---------------------------------------------------------------

    private void dispatch(AlertSink sink, AlertNotification notification) {
        String alertId = notification.getAlert().getId();
        AtomicInteger attempts = new AtomicInteger();
        inFlight.incrementAndGet();
        try {
            retries.get(sink.getName())
                    .executeCompletionStage(executor, () -> attempt(sink, notification, attempts))
                    .whenComplete((ignored, error) -> {
                        if (error == null) {
                            delivered.increment();
                            inFlight.decrementAndGet();
                        } else {
                            giveUp(sink, alertId, attempts.get(), error);
                        }
                    });
        } catch (RejectedExecutionException e) {
            giveUp(sink, alertId, attempts.get(), e);
        }
    }

    /** One delivery attempt on the scheduler; never throws, failures complete the stage. */
    private CompletionStage<Void> attempt(AlertSink sink, AlertNotification notification, AtomicInteger attempts) {
        CompletableFuture<Void> outcome = new CompletableFuture<>();
        try {
            executor.execute(() -> {
                attempts.incrementAndGet();
                try {
                    sink.deliver(notification);
                    outcome.complete(null);
                } catch (SinkDeliveryException | RuntimeException e) {
                    outcome.completeExceptionally(e);
                }
            });
        } catch (RejectedExecutionException e) {
            outcome.completeExceptionally(e);
        }
        return outcome;
    }

    private boolean isRetryable(Throwable error) {
        return error instanceof SinkDeliveryException
                && ((SinkDeliveryException) error).isRetryable()
                && !executor.isShutdown();
    }

    private void giveUp(AlertSink sink, String alertId, int attempts, Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null
                ? error.getCause()
                : error;
        failures.increment();
        inFlight.decrementAndGet();
        LOG.error("Giving up delivery of alert {} to {} after {} attempt(s)", alertId, sink.getName(), attempts,
                cause);
    }

    // ---------------------------------------------------------------
    // Introspection / shutdown
    // ---------------------------------------------------------------

    /**
     * Wait until every accepted delivery has succeeded or been given up.
     *
     * @param timeout maximum wait
     * @return {@code true} if idle within the timeout
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (inFlight.get() > 0) {
            if (System.nanoTime() >= deadline) {
                return false;
            }
            TimeUnit.MILLISECONDS.sleep(10);
        }
        return true;
    }

    public long getDelivered() {
        return delivered.sum();
    }

    public long getFailures() {
        return failures.sum();
    }

    public long getSuppressed() {
        return suppressed.sum();
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                LOG.warn("Sink dispatcher did not drain in time; {} delivery(ies) abandoned", inFlight.get());
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }
}
