package com.kmg.extract.model;

public enum CredentialState {
    ACTIVE,
    COOLING_DOWN,
    EXHAUSTED,
    RETIRED
}
