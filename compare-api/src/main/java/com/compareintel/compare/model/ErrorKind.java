package com.compareintel.compare.model;

/**
 * Canonical per-model error classes. Every provider-specific failure resolves to one of these.
 */
public enum ErrorKind {
    TIMEOUT,
    AUTH_ERROR,
    RATE_LIMITED,
    SERVER_ERROR,
    MALFORMED_RESPONSE,
    NETWORK_ERROR,
    MODEL_UNAVAILABLE,
    REQUEST_REJECTED,
    UNKNOWN;

    public ResultStatus status() {
        return this == TIMEOUT ? ResultStatus.TIMED_OUT : ResultStatus.FAILED;
    }
}
