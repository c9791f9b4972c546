package com.apisentinel.flink;

import com.apisentinel.core.aggregation.WindowAggregator;
import com.apisentinel.core.alert.AlertLifecycleManager;
import com.apisentinel.core.alert.InMemoryAlertStore;
import com.apisentinel.core.baseline.InMemoryBaselineStore;
import com.apisentinel.core.config.SentinelConfig;
import com.apisentinel.core.model.Alert;
import com.apisentinel.core.model.NormalizedRecord;
import com.apisentinel.core.model.WindowAggregate;
import com.apisentinel.core.pipeline.DegradedModeIndicator;
import com.apisentinel.core.pipeline.EndpointAnalyzer;
import com.apisentinel.core.pipeline.PipelineCounters;
import org.apache.flink.configuration.Configuration;
import org.apache.flink.streaming.api.functions.KeyedProcessFunction;
import org.apache.flink.util.Collector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Flink {@link KeyedProcessFunction}, keyed by endpoint, that runs the
 * aggregation → detection → correlation pipeline and emits every alert change.
 *
 * <h3>Windows</h3>
 * <p>
 * Records are folded into a {@link WindowAggregator}. An event-time timer is
 * kept at the endpoint's next due instant; when the watermark passes it, the
 * due windows are closed and analysed in window-end order and the next timer
 * is registered. Because the aggregator fills gaps after the first window, a
 * silent endpoint keeps producing (empty) windows as long as the watermark
 * advances.
 * </p>
 *
 * <h3>State Management</h3>
 * <p>
 * Aggregator, baselines and alerts are held per parallel subtask in the
 * in-memory stores and are not checkpointed; after a restart baselines warm
 * up again behind the cold-start guard.
 * </p>
 *
 * @since 1.0.0
 */
public class DegradationProcessFunction extends KeyedProcessFunction<String, NormalizedRecord, Alert> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(DegradationProcessFunction.class);

    private final SentinelConfig config;

    private transient WindowAggregator aggregator;
    private transient EndpointAnalyzer analyzer;
    private transient SentinelMetrics metrics;

    /**
     * @param config validated sentinel configuration; must not be {@code null}
     */
    public DegradationProcessFunction(SentinelConfig config) {
        this.config = Objects.requireNonNull(config, "Sentinel config must not be null");
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    @Override
    public void open(Configuration parameters) {
        aggregator = new WindowAggregator(config.windowSizes(), config.lateGracePeriod());
        AlertLifecycleManager lifecycle = new AlertLifecycleManager(
                new InMemoryAlertStore(config.getMaxAlerts()), Clock.systemUTC(), config.getMaxSignalsPerAlert());
        analyzer = EndpointAnalyzer.create(config, new InMemoryBaselineStore(), lifecycle,
                new PipelineCounters(), new DegradedModeIndicator());
        metrics = new SentinelMetrics(getRuntimeContext().getMetricGroup());
        LOG.info("DegradationProcessFunction opened: windows {}, grace {}, detector {}",
                config.getWindowSizes(), config.getLateGracePeriod(), config.getDetector().getType());
    }

    @Override
    public void close() {
        if (aggregator != null) {
            LOG.info("DegradationProcessFunction closing; {} open window(s) discarded", aggregator.openWindowCount());
        }
    }

    // ---------------------------------------------------------------
    // Processing
    // ---------------------------------------------------------------

    @Override
    public void processElement(NormalizedRecord record,
            KeyedProcessFunction<String, NormalizedRecord, Alert>.Context ctx,
            Collector<Alert> out) {
        if (aggregator.add(record)) {
            metrics.incrementRecordsProcessed();
        } else {
            metrics.incrementRecordsLate();
        }
        scheduleNext(ctx.getCurrentKey(), ctx.timerService()::registerEventTimeTimer);
    }

    @Override
    public void onTimer(long timestamp,
            KeyedProcessFunction<String, NormalizedRecord, Alert>.OnTimerContext ctx,
            Collector<Alert> out) {
        long startNanos = System.nanoTime();
        String endpoint = ctx.getCurrentKey();

        List<WindowAggregate> due = aggregator.closeDue(endpoint, Instant.ofEpochMilli(timestamp));
        for (WindowAggregate window : due) {
            Optional<Alert> alert = analyzer.analyze(window);
            if (alert.isPresent()) {
                out.collect(alert.get());
                metrics.incrementAlertsEmitted();
                LOG.info("Alert {} for {}: {} {}", alert.get().getId(), endpoint, alert.get().getStatus(),
                        alert.get().getSeverity());
            }
        }
        metrics.incrementWindowsClosed(due.size());
        scheduleNext(endpoint, ctx.timerService()::registerEventTimeTimer);
        metrics.recordLatency((System.nanoTime() - startNanos) / 1_000_000);
    }

    private void scheduleNext(String endpoint, TimerRegistration timers) {
        // timers on the same timestamp are deduplicated by Flink
        aggregator.nextDue(endpoint).ifPresent(due -> timers.register(due.toEpochMilli()));
    }

    @FunctionalInterface
    private interface TimerRegistration {
        void register(long timestamp);
    }
}
