/**
 * Glue between aggregation, detection and correlation, shared by the
 * standalone engine and the Flink job: per-window analysis, pipeline counters
 * and the degraded-mode indicator.
 */
package com.apisentinel.core.pipeline;
