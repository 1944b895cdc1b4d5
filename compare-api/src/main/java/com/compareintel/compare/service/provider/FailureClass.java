package com.compareintel.compare.service.provider;

/**
 * Raw failure classes reported by adapters before normalization.
 */
public enum FailureClass {
    AUTH,
    RATE_LIMITED,
    SERVER,
    NOT_FOUND,
    REJECTED,
    MALFORMED,
    NETWORK,
    DEADLINE_EXCEEDED,
    UNEXPECTED;

    public static FailureClass fromHttpStatus(int status) {
        if (status == 401 || status == 403) {
            return AUTH;
        }
        if (status == 429) {
            return RATE_LIMITED;
        }
        if (status == 404) {
            return NOT_FOUND;
        }
        if (status >= 500) {
            return SERVER;
        }
        return REJECTED;
    }

    public boolean transientFailure() {
        return this == RATE_LIMITED || this == SERVER;
    }
}
