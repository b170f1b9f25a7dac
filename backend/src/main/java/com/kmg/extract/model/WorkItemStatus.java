package com.kmg.extract.model;

public enum WorkItemStatus {
    PENDING,
    IN_PROGRESS,
    SUCCEEDED,
    FAILED_RETRYABLE,
    FAILED_PERMANENT;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED_RETRYABLE || this == FAILED_PERMANENT;
    }
}
