package com.kmg.extract.model;

public enum RunStatus {
    RUNNING,
    COMPLETED,
    STOPPED,
    PAUSED,
    FAILED
}
