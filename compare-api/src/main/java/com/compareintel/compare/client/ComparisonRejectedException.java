package com.compareintel.compare.client;

/**
 * The API refused or failed the whole comparison; no per-model results exist.
 */
public class ComparisonRejectedException extends RuntimeException {

    private final int status;

    public ComparisonRejectedException(int status, String message) {
        super(message);
        this.status = status;
    }

    public int status() {
        return status;
    }
}
