/**
 * Tumbling-window aggregation of normalized records.
 *
 * <p>
 * {@link com.apisentinel.core.aggregation.WindowAggregator} is the entry point;
 * {@link com.apisentinel.core.aggregation.LatencySketch} provides the
 * order-independent p95 estimate.
 * </p>
 */
package com.apisentinel.core.aggregation;
