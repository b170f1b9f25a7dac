package com.kmg.extract.model;

public enum BatchStatus {
    COMPLETED,
    STOPPED,
    PAUSED
}
