package com.kmg.extract.service;

import com.kmg.extract.model.CallOutcome;
import com.kmg.extract.model.CredentialHandle;
import com.kmg.extract.model.CredentialSnapshot;
import com.kmg.extract.model.CredentialState;
import com.kmg.extract.model.NoUsableCredentialException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

/**
 * Round-robin pool of rate-limited credentials.
 * <p>
 * All credential state lives here and is only mutated through {@link #report(CredentialHandle, CallOutcome)}
 * and {@link #resetDailyQuotas()}. Every operation runs under a single lock and never blocks inside it;
 * callers perform the network call between {@link #acquire()} and {@link #report(CredentialHandle, CallOutcome)}.
 * Cooldowns are measured on a monotonic nanosecond clock.
 */
public class CredentialPool {
    private static final Logger log = LoggerFactory.getLogger(CredentialPool.class);

    private final List<PooledCredential> credentials;
    private final Map<String, PooledCredential> byId = new LinkedHashMap<>();
    private final long cooldownNanos;
    private final int transientFailureThreshold;
    private final LongSupplier nanoClock;
    private final ReentrantLock lock = new ReentrantLock();
    private int cursor;

    public CredentialPool(List<String> secrets, Duration cooldown, int transientFailureThreshold, LongSupplier nanoClock) {
        if (cooldown.isNegative()) {
            throw new IllegalArgumentException("Cooldown must not be negative.");
        }
        List<PooledCredential> created = new ArrayList<>();
        for (int i = 0; i < secrets.size(); i++) {
            String secret = secrets.get(i);
            if (secret == null || secret.isBlank()) {
                throw new IllegalArgumentException("Credential " + (i + 1) + " is blank.");
            }
            PooledCredential credential = new PooledCredential(new CredentialHandle(
                    "key-" + (i + 1),
                    Hashing.sha256Hex(secret.strip()).substring(0, 12),
                    secret.strip()
            ));
            created.add(credential);
            byId.put(credential.handle.id(), credential);
        }
        this.credentials = List.copyOf(created);
        this.cooldownNanos = cooldown.toNanos();
        this.transientFailureThreshold = transientFailureThreshold;
        this.nanoClock = nanoClock;
    }

    /**
     * Returns the next usable credential in round-robin order. Cooldowns that have elapsed are
     * reclaimed first.
     *
     * @throws NoUsableCredentialException if every credential is cooling down, exhausted or retired
     */
    public CredentialHandle acquire() {
        lock.lock();
        try {
            reclaimElapsedCooldowns(nanoClock.getAsLong());

            int size = credentials.size();
            for (int offset = 0; offset < size; offset++) {
                int index = Math.floorMod(cursor + offset, size);
                PooledCredential candidate = credentials.get(index);
                if (candidate.state == CredentialState.ACTIVE) {
                    cursor = index + 1;
                    return candidate.handle;
                }
            }
            throw new NoUsableCredentialException(describeUnusable());
        } finally {
            lock.unlock();
        }
    }

    public void report(CredentialHandle handle, CallOutcome outcome) {
        lock.lock();
        try {
            PooledCredential credential = byId.get(handle.id());
            if (credential == null) {
                throw new IllegalArgumentException("Unknown credential: " + handle.id());
            }
            long now = nanoClock.getAsLong();
            credential.totalRequests++;

            switch (outcome) {
                case SUCCESS -> {
                    credential.totalSuccesses++;
                    credential.consecutiveFailures = 0;
                }
                case RATE_LIMITED -> {
                    credential.totalRateLimited++;
                    startCooldown(credential, now, "rate limited");
                }
                case QUOTA_EXHAUSTED -> {
                    credential.totalFailures++;
                    if (credential.state != CredentialState.RETIRED) {
                        credential.state = CredentialState.EXHAUSTED;
                        log.warn("Credential {} ({}) exhausted its daily quota", handle.id(), handle.fingerprint());
                    }
                }
                case TRANSIENT_FAILURE -> {
                    credential.totalFailures++;
                    credential.consecutiveFailures++;
                    if (credential.consecutiveFailures > transientFailureThreshold) {
                        startCooldown(credential, now, credential.consecutiveFailures + " consecutive failures");
                    }
                }
                case PERMANENT_FAILURE -> credential.totalFailures++;
                case INVALID_CREDENTIAL -> {
                    credential.totalFailures++;
                    credential.state = CredentialState.RETIRED;
                    log.error("Credential {} ({}) was rejected as invalid and is retired", handle.id(), handle.fingerprint());
                }
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Restores every exhausted credential. Retired credentials stay retired.
     *
     * @return number of credentials restored
     */
    public int resetDailyQuotas() {
        lock.lock();
        try {
            int restored = 0;
            for (PooledCredential credential : credentials) {
                if (credential.state == CredentialState.EXHAUSTED) {
                    credential.state = CredentialState.ACTIVE;
                    credential.consecutiveFailures = 0;
                    restored++;
                }
            }
            if (restored > 0) {
                log.info("Daily quota reset restored {} credential(s)", restored);
            }
            return restored;
        } finally {
            lock.unlock();
        }
    }

    public List<CredentialSnapshot> snapshot() {
        lock.lock();
        try {
            long now = nanoClock.getAsLong();
            List<CredentialSnapshot> result = new ArrayList<>(credentials.size());
            for (PooledCredential credential : credentials) {
                result.add(credential.toSnapshot(now));
            }
            return result;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        return credentials.size();
    }

    private void startCooldown(PooledCredential credential, long now, String reason) {
        if (credential.state == CredentialState.RETIRED || credential.state == CredentialState.EXHAUSTED) {
            return;
        }
        credential.state = CredentialState.COOLING_DOWN;
        credential.cooldownUntil = now + cooldownNanos;
        log.info("Credential {} ({}) cooling down for {} ms: {}",
                credential.handle.id(), credential.handle.fingerprint(),
                TimeUnit.NANOSECONDS.toMillis(cooldownNanos), reason);
    }

    private void reclaimElapsedCooldowns(long now) {
        for (PooledCredential credential : credentials) {
            if (credential.state == CredentialState.COOLING_DOWN && now - credential.cooldownUntil >= 0) {
                credential.state = CredentialState.ACTIVE;
                credential.consecutiveFailures = 0;
                log.debug("Credential {} reclaimed after cooldown", credential.handle.id());
            }
        }
    }

    private String describeUnusable() {
        if (credentials.isEmpty()) {
            return "No credentials are configured.";
        }
        Map<CredentialState, Integer> counts = new LinkedHashMap<>();
        for (PooledCredential credential : credentials) {
            counts.merge(credential.state, 1, Integer::sum);
        }
        return "No usable credential: " + counts;
    }

    private static class PooledCredential {
        private final CredentialHandle handle;
        private CredentialState state = CredentialState.ACTIVE;
        private long cooldownUntil;
        private int consecutiveFailures;
        private long totalRequests;
        private long totalSuccesses;
        private long totalRateLimited;
        private long totalFailures;

        PooledCredential(CredentialHandle handle) {
            this.handle = handle;
        }

        CredentialSnapshot toSnapshot(long now) {
            long remaining = state == CredentialState.COOLING_DOWN
                    ? Math.max(0, TimeUnit.NANOSECONDS.toMillis(cooldownUntil - now))
                    : 0;
            return new CredentialSnapshot(
                    handle.id(),
                    handle.fingerprint(),
                    state,
                    remaining,
                    consecutiveFailures,
                    totalRequests,
                    totalSuccesses,
                    totalRateLimited,
                    totalFailures
            );
        }
    }
}
