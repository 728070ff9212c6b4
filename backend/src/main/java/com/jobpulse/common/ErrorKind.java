package com.jobpulse.common;

/**
 * Error taxonomy of the ingestion pipeline. The name is what a FAILED tracking handle carries as reason.
 */
public enum ErrorKind {
    UNRECOGNIZED_EVENT_KIND,
    MALFORMED_EVENT,
    INVALID_EVENT_DATA,
    /** Informational: resolved by the idempotent merge, never surfaced as a failure. */
    DUPLICATE_EVENT,
    /** Transient; retried by the execution boundary before it is reported. */
    STORAGE_UNAVAILABLE,
    /** Two differing values with identical tie-break timestamps. Logged, never fatal. */
    CONFLICTING_MERGE_ANOMALY,
    /** Anything else the worker could not handle; logged with the stack trace. */
    UNEXPECTED_FAILURE
}
