package io.relay4j.core;

/**
 * What the result consumer did with one inbound event.
 */
public enum ResultDisposition {
    ACKNOWLEDGED,
    FAILED,
    REQUEUED,
    UNKNOWN_JOB,
    DUPLICATE,
    STALE
}
