package com.apisentinel.core.engine;

import com.apisentinel.core.aggregation.WindowAggregator;
import com.apisentinel.core.alert.AlertLifecycleManager;
import com.apisentinel.core.alert.AlertNotification;
import com.apisentinel.core.alert.AlertQuery;
import com.apisentinel.core.alert.AlertStore;
import com.apisentinel.core.alert.InMemoryAlertStore;
import com.apisentinel.core.baseline.BaselineStore;
import com.apisentinel.core.baseline.InMemoryBaselineStore;
import com.apisentinel.core.config.SentinelConfig;
import com.apisentinel.core.config.SinkSettings;
import com.apisentinel.core.model.Alert;
import com.apisentinel.core.model.AlertStatus;
import com.apisentinel.core.model.NormalizedRecord;
import com.apisentinel.core.model.WindowAggregate;
import com.apisentinel.core.pipeline.DegradedModeIndicator;
import com.apisentinel.core.pipeline.EndpointAnalyzer;
import com.apisentinel.core.pipeline.PipelineCounters;
import com.apisentinel.core.sink.AlertSink;
import com.apisentinel.core.sink.LoggingAlertSink;
import com.apisentinel.core.sink.RetryingSinkDispatcher;
import com.apisentinel.core.sink.WebhookAlertSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Standalone degradation-detection pipeline.
 *
 * <h3>Flow</h3>
 * <ol>
 * <li>{@link #ingest} validates a record and offers it to a bounded buffer;
 * a full buffer drops the newest record.</li>
 * <li>Ingest workers drain the buffer into the {@link WindowAggregator}.</li>
 * <li>Every {@code tickInterval}, {@link #tick()} closes due windows, records
 * them in the {@link MetricsRepository} and hands each endpoint's windows, in
 * window-end order, to a {@link KeyedSerialExecutor} running the
 * {@link EndpointAnalyzer}.</li>
 * <li>Alert changes are published to the {@link RetryingSinkDispatcher}.</li>
 * </ol>
 *
 * <p>
 * {@link #tick()} can also be driven by hand, together with an injected
 * {@link Clock}; it drains the buffer itself, so a started engine is not
 * needed for deterministic use.
 * </p>
 *
 * @since 1.0.0
 */
public class SentinelEngine implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(SentinelEngine.class);

    private final SentinelConfig config;
    private final Clock clock;
    private final RecordValidator validator;
    private final BlockingQueue<NormalizedRecord> buffer;
    private final WindowAggregator aggregator;
    private final MetricsRepository metrics;
    private final AlertLifecycleManager lifecycle;
    private final EndpointAnalyzer analyzer;
    private final KeyedSerialExecutor analysis;
    private final RetryingSinkDispatcher dispatcher;
    private final PipelineCounters counters = new PipelineCounters();
    private final DegradedModeIndicator degraded = new DegradedModeIndicator();

    private final Object tickLock = new Object();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final List<Thread> workers = new ArrayList<>();
    private ScheduledExecutorService scheduler;

    public SentinelEngine(SentinelConfig config) {
        this(config, Clock.systemUTC());
    }

    public SentinelEngine(SentinelConfig config, Clock clock) {
        this(config, clock, new InMemoryBaselineStore(), new InMemoryAlertStore(config.getMaxAlerts()),
                defaultSinks(config.getSinks()));
    }

    /**
     * @param config    validated configuration
     * @param clock     processing-time clock
     * @param baselines baseline backend
     * @param alerts    alert backend
     * @param sinks     notification sinks, selected per severity by name
     */
    public SentinelEngine(SentinelConfig config, Clock clock, BaselineStore baselines, AlertStore alerts,
            List<AlertSink> sinks) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        Objects.requireNonNull(baselines, "baselines must not be null");
        Objects.requireNonNull(alerts, "alerts must not be null");

        this.validator = new RecordValidator(config.maxClockSkew());
        this.buffer = new ArrayBlockingQueue<>(config.getIngestBufferCapacity());
        this.aggregator = new WindowAggregator(config.windowSizes(), config.lateGracePeriod());
        this.metrics = new MetricsRepository(config.getMetricsHistorySize());
        this.lifecycle = new AlertLifecycleManager(alerts, clock, config.getMaxSignalsPerAlert());
        this.analyzer = EndpointAnalyzer.create(config, baselines, lifecycle, counters, degraded);
        this.analysis = new KeyedSerialExecutor(
                Executors.newFixedThreadPool(config.getAnalysisThreads(), daemonThreads("sentinel-analysis")));

        SinkSettings sinkSettings = config.getSinks();
        this.dispatcher = new RetryingSinkDispatcher(sinks, sinkSettings.routing(), sinkSettings.cooldown(),
                sinkSettings.getMaxAttempts(), sinkSettings.initialBackoff(), sinkSettings.maxBackoff(),
                Executors.newScheduledThreadPool(sinkSettings.getDispatchThreads(), daemonThreads("sentinel-sink")),
                clock);
        lifecycle.addListener(dispatcher);
        lifecycle.addListener(this::countAlert);

        counters.register(PipelineCounters.LATE_DROPPED, aggregator::getLateDropped);
        counters.register(PipelineCounters.SINK_FAILURES, dispatcher::getFailures);
    }

    private static List<AlertSink> defaultSinks(SinkSettings settings) {
        List<AlertSink> sinks = new ArrayList<>();
        sinks.add(new LoggingAlertSink());
        if (settings.getWebhookUrl() != null && !settings.getWebhookUrl().isBlank()) {
            sinks.add(new WebhookAlertSink(URI.create(settings.getWebhookUrl()), settings.webhookTimeout()));
        }
        return sinks;
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    /**
     * Start ingest workers, the window ticker and the retention purge.
     */
    public void start() {
        if (closed.get()) {
            throw new IllegalStateException("Engine is closed");
        }
        if (!running.compareAndSet(false, true)) {
            return;
        }
        for (int i = 0; i < config.getIngestWorkers(); i++) {
            Thread worker = new Thread(this::drainLoop, "sentinel-ingest-" + i);
            worker.setDaemon(true);
            worker.start();
            workers.add(worker);
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(daemonThreads("sentinel-ticker"));
        long tickMillis = config.tickInterval().toMillis();
        scheduler.scheduleAtFixedRate(this::scheduledTick, tickMillis, tickMillis, TimeUnit.MILLISECONDS);
        long purgeMillis = config.retentionInterval().toMillis();
        scheduler.scheduleAtFixedRate(this::scheduledPurge, purgeMillis, purgeMillis, TimeUnit.MILLISECONDS);
        LOG.info("API Sentinel engine started: windows {}, tick {}, {} ingest worker(s), {} analysis thread(s)",
                config.getWindowSizes(), config.getTickInterval(), config.getIngestWorkers(),
                config.getAnalysisThreads());
    }

    /**
     * Stop ticking, wait for in-flight analyses and pending notifications.
     * Windows still open are discarded.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        running.set(false);
        if (scheduler != null) {
            scheduler.shutdown();
        }
        for (Thread worker : workers) {
            worker.interrupt();
        }
        synchronized (tickLock) {
            analysis.close();
        }
        dispatcher.close();
        LOG.info("API Sentinel engine stopped; {} record(s) left in buffer, {} open window(s) discarded",
                buffer.size(), aggregator.openWindowCount());
    }

    public boolean isRunning() {
        return running.get();
    }

    // ---------------------------------------------------------------
    // Ingestion
    // ---------------------------------------------------------------

    /**
     * @param record incoming record
     * @return whether the record was buffered
     */
    public IngestResult ingest(NormalizedRecord record) {
        Optional<String> problem = validator.validate(record, clock.instant());
        if (problem.isPresent()) {
            counters.increment(PipelineCounters.REJECTED_INVALID);
            LOG.debug("Rejected record {}: {}", record, problem.get());
            return IngestResult.REJECTED_INVALID;
        }
        if (!buffer.offer(record)) {
            counters.increment(PipelineCounters.BUFFER_DROPPED);
            LOG.warn("Ingest buffer full ({}), dropping record for {}", config.getIngestBufferCapacity(),
                    record.getEndpoint());
            return IngestResult.DROPPED_BUFFER_FULL;
        }
        counters.increment(PipelineCounters.RECORDS_ACCEPTED);
        return IngestResult.ACCEPTED;
    }

    private void drainLoop() {
        while (running.get()) {
            try {
                NormalizedRecord record = buffer.poll(200, TimeUnit.MILLISECONDS);
                if (record != null) {
                    aggregator.add(record);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    // ---------------------------------------------------------------
    // Window closing
    // ---------------------------------------------------------------

    /**
     * Close every window due at the clock's current time and analyse it.
     *
     * @return completes when every closed window has been analysed
     */
    public CompletableFuture<Void> tick() {
        synchronized (tickLock) {
            if (closed.get()) {
                return CompletableFuture.completedFuture(null);
            }
            List<NormalizedRecord> pending = new ArrayList<>();
            buffer.drainTo(pending);
            pending.forEach(aggregator::add);

            List<WindowAggregate> due = aggregator.closeDue(clock.instant());
            Map<String, List<WindowAggregate>> byEndpoint = new LinkedHashMap<>();
            for (WindowAggregate window : due) {
                metrics.record(window);
                byEndpoint.computeIfAbsent(window.getEndpoint(), e -> new ArrayList<>()).add(window);
            }
            List<CompletableFuture<Void>> futures = new ArrayList<>();
            byEndpoint.forEach((endpoint, windows) -> futures.add(
                    analysis.submit(endpoint, () -> windows.forEach(analyzer::analyze))));
            if (!due.isEmpty()) {
                LOG.debug("Closed {} window(s) across {} endpoint(s)", due.size(), byEndpoint.size());
            }
            return CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]));
        }
    }

    private void scheduledTick() {
        try {
            tick();
        } catch (RuntimeException e) {
            LOG.error("Window tick failed", e);
        }
    }

    private void scheduledPurge() {
        try {
            purgeExpiredAlerts();
        } catch (RuntimeException e) {
            LOG.error("Alert retention purge failed", e);
        }
    }

    /**
     * @return number of resolved alerts older than {@code alertRetention} removed
     */
    public int purgeExpiredAlerts() {
        return lifecycle.purgeResolvedOlderThan(config.alertRetention());
    }

    // ---------------------------------------------------------------
    // Queries and operator actions
    // ---------------------------------------------------------------

    /**
     * @param endpoint   endpoint
     * @param windowSize window size, or {@code null} for every size
     * @param after      exclusive lower bound on window end, or {@code null}
     * @param limit      maximum number of aggregates
     * @return closed aggregates ascending by window end
     */
    public List<WindowAggregate> metrics(String endpoint, Duration windowSize, Instant after, int limit) {
        return metrics.query(endpoint, windowSize, after, limit);
    }

    public List<Alert> alerts(AlertQuery query) {
        return lifecycle.list(query);
    }

    public Optional<Alert> alert(String id) {
        return lifecycle.get(id);
    }

    /**
     * @throws com.apisentinel.core.alert.AlertNotFoundException if the id is unknown
     * @throws com.apisentinel.core.alert.IllegalStateTransitionException if the alert is not open
     */
    public Alert acknowledge(String id) {
        return lifecycle.transition(id, AlertStatus.ACKNOWLEDGED);
    }

    /**
     * @throws com.apisentinel.core.alert.AlertNotFoundException if the id is unknown
     * @throws com.apisentinel.core.alert.IllegalStateTransitionException if the alert is already resolved
     */
    public Alert resolve(String id) {
        return lifecycle.transition(id, AlertStatus.RESOLVED);
    }

    /**
     * Wait for queued notifications to be delivered or given up.
     *
     * @param timeout maximum wait
     * @return {@code true} if the dispatcher went idle in time
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean awaitNotifications(Duration timeout) throws InterruptedException {
        return dispatcher.awaitIdle(timeout);
    }

    public Map<String, Long> counters() {
        return counters.snapshot();
    }

    public DegradedModeIndicator getDegradedModeIndicator() {
        return degraded;
    }

    public SentinelConfig getConfig() {
        return config;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private void countAlert(AlertNotification notification) {
        if (notification.getType() == AlertNotification.Type.CREATED) {
            counters.increment(PipelineCounters.ALERTS_OPENED);
        } else if (notification.getType() == AlertNotification.Type.RESOLVED) {
            counters.increment(PipelineCounters.ALERTS_RESOLVED);
        }
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger index = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + index.getAndIncrement());
            t.setDaemon(true);
            return t;
        };
    }
}
