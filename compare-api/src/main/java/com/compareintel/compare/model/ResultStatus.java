package com.compareintel.compare.model;

public enum ResultStatus {
    SUCCEEDED,
    FAILED,
    TIMED_OUT;

    public boolean succeeded() {
        return this == SUCCEEDED;
    }
}
