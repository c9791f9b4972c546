/**
 * Baseline scoring of closed windows.
 *
 * <p>
 * {@link com.apisentinel.core.detection.WindowEvaluator} drives the per-metric
 * update; {@link com.apisentinel.core.detection.AnomalyDetector} strategies
 * (EWMA z-score, isolation score) decide what is unusual and are chosen by
 * {@link com.apisentinel.core.detection.DetectorFactory}.
 * </p>
 */
package com.apisentinel.core.detection;
