package com.kmg.extract.model;

import java.util.Map;

public record DispatchResult(
        Map<String, String> payload,
        ClassifiedError error,
        int attempts,
        String credentialId,
        boolean interrupted
) {
    public static DispatchResult success(Map<String, String> payload, int attempts, String credentialId) {
        return new DispatchResult(payload, null, attempts, credentialId, false);
    }

    public static DispatchResult failure(ClassifiedError error, int attempts, String credentialId) {
        return new DispatchResult(null, error, attempts, credentialId, false);
    }

    /**
     * The calling thread was interrupted before the item reached an outcome. Nothing was charged to
     * the credential in flight.
     */
    public static DispatchResult interrupted(int attempts, String credentialId) {
        return new DispatchResult(null, null, attempts, credentialId, true);
    }

    public boolean succeeded() {
        return error == null && !interrupted;
    }
}
