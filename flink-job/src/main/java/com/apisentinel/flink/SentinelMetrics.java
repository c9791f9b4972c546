package com.apisentinel.flink;

import org.apache.flink.metrics.Counter;
import org.apache.flink.metrics.Histogram;
import org.apache.flink.metrics.MetricGroup;
import org.apache.flink.runtime.metrics.DescriptiveStatisticsHistogram;

/**
 * Flink metric definitions for API Sentinel.
 * <p>
 * Exposed through the cluster's metric reporters (configured in
 * {@code flink-conf.yaml}); the job only defines them.
 * </p>
 *
 * <h3>Exposed Metrics</h3>
 * <ul>
 *   <li>{@code records_processed_total}: records folded into windows</li>
 *   <li>{@code records_late_total}: records dropped because their window had closed</li>
 *   <li>{@code windows_closed_total}: aggregates analysed</li>
 *   <li>{@code alerts_emitted_total}: alert changes sent to Kafka</li>
 *   <li>{@code analysis_latency_ms}: histogram of per-timer analysis time</li>
 * </ul>
 */
public class SentinelMetrics {

    static final String GROUP = "api_sentinel";

    private final Counter recordsProcessed;
    private final Counter recordsLate;
    private final Counter windowsClosed;
    private final Counter alertsEmitted;
    private final Histogram analysisLatency;

    public SentinelMetrics(MetricGroup metricGroup) {
        MetricGroup sentinelGroup = metricGroup.addGroup(GROUP);

        this.recordsProcessed = sentinelGroup.counter("records_processed_total");
        this.recordsLate = sentinelGroup.counter("records_late_total");
        this.windowsClosed = sentinelGroup.counter("windows_closed_total");
        this.alertsEmitted = sentinelGroup.counter("alerts_emitted_total");

        // sliding window of the last 350 samples
        this.analysisLatency = sentinelGroup
                .histogram("analysis_latency_ms", new DescriptiveStatisticsHistogram(350));
    }

    public void incrementRecordsProcessed() {
        recordsProcessed.inc();
    }

    public void incrementRecordsLate() {
        recordsLate.inc();
    }

    public void incrementWindowsClosed(long count) {
        windowsClosed.inc(count);
    }

    public void incrementAlertsEmitted() {
        alertsEmitted.inc();
    }

    public void recordLatency(long milliseconds) {
        analysisLatency.update(milliseconds);
    }
}
