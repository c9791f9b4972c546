package com.apisentinel.core.engine;

/**
 * Outcome of {@link SentinelEngine#ingest}.
 *
 * @since 1.0.0
 */
public enum IngestResult {

    /** Buffered for aggregation. */
    ACCEPTED,

    /** Failed boundary validation; see {@link RecordValidator}. */
    REJECTED_INVALID,

    /** The ingest buffer was full; the record was discarded. */
    DROPPED_BUFFER_FULL
}
