package com.compareintel.compare.service;

import org.springframework.http.HttpStatus;

/**
 * A failure of the whole comparison request. Per-model provider errors never take this path.
 */
public class ComparisonException extends RuntimeException {

    private final HttpStatus status;

    public ComparisonException(HttpStatus status, String message) {
        super(message);
        this.status = status;
    }

    public HttpStatus status() {
        return status;
    }
}
