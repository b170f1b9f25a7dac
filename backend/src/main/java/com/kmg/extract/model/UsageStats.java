package com.kmg.extract.model;

import java.util.List;
import java.util.Map;

public record UsageStats(
        List<CredentialSnapshot> credentials,
        Map<CredentialState, Integer> credentialsByState,
        long totalRequests,
        long totalSuccesses,
        long totalRateLimited,
        long totalFailures
) {
}
