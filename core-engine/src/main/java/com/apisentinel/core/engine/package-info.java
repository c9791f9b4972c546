/**
 * Standalone runtime: bounded ingestion, the window ticker, keyed serial
 * analysis, aggregate history, and the HTTP query server.
 *
 * <p>
 * Entry point: {@link com.apisentinel.core.engine.SentinelServer}.
 * </p>
 */
package com.apisentinel.core.engine;
