package com.kmg.extract.model;

public record CredentialSnapshot(
        String id,
        String fingerprint,
        CredentialState state,
        long cooldownRemainingMillis,
        int consecutiveFailures,
        long totalRequests,
        long totalSuccesses,
        long totalRateLimited,
        long totalFailures
) {
}
