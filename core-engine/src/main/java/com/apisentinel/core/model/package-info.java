/**
 * Domain model of the detection pipeline: normalized records, closed windows,
 * baselines, anomaly signals and alerts.
 *
 * <p>
 * Pipeline-internal types are immutable. {@link com.apisentinel.core.model.Alert}
 * and its {@link com.apisentinel.core.model.Explanation} are mutable Jackson
 * POJOs; stores and the lifecycle manager hand out copies.
 * </p>
 */
package com.apisentinel.core.model;
