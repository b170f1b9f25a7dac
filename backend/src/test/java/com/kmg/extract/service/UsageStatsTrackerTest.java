package com.kmg.extract.service;

import com.kmg.extract.model.CallOutcome;
import com.kmg.extract.model.CredentialState;
import com.kmg.extract.model.UsageStats;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;

class UsageStatsTrackerTest {

    @Test
    void aggregatesCountersAcrossCredentials() {
        AtomicLong clock = new AtomicLong();
        CredentialPool pool = new CredentialPool(List.of("a", "b", "c"), Duration.ofSeconds(30), 3, clock::get);
        pool.report(pool.acquire(), CallOutcome.SUCCESS);
        pool.report(pool.acquire(), CallOutcome.RATE_LIMITED);
        pool.report(pool.acquire(), CallOutcome.QUOTA_EXHAUSTED);
        pool.report(pool.acquire(), CallOutcome.PERMANENT_FAILURE);

        UsageStatsTracker tracker = new UsageStatsTracker(pool);
        UsageStats stats = tracker.snapshot();

        assertThat(stats.credentials()).hasSize(3);
        assertThat(stats.totalRequests()).isEqualTo(4);
        assertThat(stats.totalSuccesses()).isEqualTo(1);
        assertThat(stats.totalRateLimited()).isEqualTo(1);
        assertThat(stats.totalFailures()).isEqualTo(2);
        assertThat(stats.credentialsByState())
                .containsEntry(CredentialState.ACTIVE, 1)
                .containsEntry(CredentialState.COOLING_DOWN, 1)
                .containsEntry(CredentialState.EXHAUSTED, 1)
                .containsEntry(CredentialState.RETIRED, 0);
        assertThat(tracker.usableCount()).isEqualTo(1);
    }
}
