package com.kmg.extract.service;

import com.kmg.extract.model.CredentialHandle;

/**
 * Calls the external inference service with one credential.
 * <p>
 * Failures are raised as {@link com.kmg.extract.model.ExtractionException} carrying one of
 * {@code RATE_LIMITED}, {@code QUOTA_EXHAUSTED}, {@code TRANSIENT_FAILURE}, {@code PERMANENT_FAILURE}
 * or {@code INVALID_CREDENTIAL}. Callers bound the call with their own deadline.
 */
public interface InferenceClient {

    String infer(String prompt, CredentialHandle credential);
}
