package com.kmg.extract.model;

/**
 * Outcome of one inference call, as reported back to the credential pool.
 */
public enum CallOutcome {
    SUCCESS,
    RATE_LIMITED,
    QUOTA_EXHAUSTED,
    TRANSIENT_FAILURE,
    PERMANENT_FAILURE,
    INVALID_CREDENTIAL;

    public static CallOutcome fromErrorKind(ErrorKind kind) {
        return switch (kind) {
            case RATE_LIMITED -> RATE_LIMITED;
            case QUOTA_EXHAUSTED -> QUOTA_EXHAUSTED;
            case INVALID_CREDENTIAL -> INVALID_CREDENTIAL;
            case PERMANENT_FAILURE, UNREADABLE -> PERMANENT_FAILURE;
            case TRANSIENT_FAILURE, NO_USABLE_CREDENTIAL -> TRANSIENT_FAILURE;
        };
    }
}
