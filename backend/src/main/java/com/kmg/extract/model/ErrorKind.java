package com.kmg.extract.model;

public enum ErrorKind {
    NO_USABLE_CREDENTIAL,
    RATE_LIMITED,
    QUOTA_EXHAUSTED,
    TRANSIENT_FAILURE,
    PERMANENT_FAILURE,
    INVALID_CREDENTIAL,
    UNREADABLE
}
