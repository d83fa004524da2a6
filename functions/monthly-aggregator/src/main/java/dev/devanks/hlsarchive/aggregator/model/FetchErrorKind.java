package dev.devanks.hlsarchive.aggregator.model;

public enum FetchErrorKind {
    /**
     * Timeouts, connection failures, 429 and 5xx. Retried.
     */
    TRANSIENT,
    /**
     * Other 4xx, missing objects and malformed documents. Never retried.
     */
    PERMANENT
}
