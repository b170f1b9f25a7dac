package com.kmg.extract.service;

import com.kmg.extract.model.CredentialSnapshot;
import com.kmg.extract.model.CredentialState;
import com.kmg.extract.model.UsageStats;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only aggregation over the pool's counters.
 */
@Service
public class UsageStatsTracker {
    private final CredentialPool credentialPool;

    public UsageStatsTracker(CredentialPool credentialPool) {
        this.credentialPool = credentialPool;
    }

    public UsageStats snapshot() {
        List<CredentialSnapshot> credentials = credentialPool.snapshot();

        Map<CredentialState, Integer> byState = new EnumMap<>(CredentialState.class);
        for (CredentialState state : CredentialState.values()) {
            byState.put(state, 0);
        }

        long requests = 0;
        long successes = 0;
        long rateLimited = 0;
        long failures = 0;
        for (CredentialSnapshot credential : credentials) {
            byState.merge(credential.state(), 1, Integer::sum);
            requests += credential.totalRequests();
            successes += credential.totalSuccesses();
            rateLimited += credential.totalRateLimited();
            failures += credential.totalFailures();
        }

        return new UsageStats(credentials, byState, requests, successes, rateLimited, failures);
    }

    public int usableCount() {
        return (int) credentialPool.snapshot().stream()
                .filter(c -> c.state() == CredentialState.ACTIVE
                        || (c.state() == CredentialState.COOLING_DOWN && c.cooldownRemainingMillis() == 0))
                .count();
    }
}
