package com.kmg.extract.service;

import com.kmg.extract.model.ErrorKind;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;

/**
 * Attempt budget, backoff and retryability for one dispatched item.
 */
public class RetryPolicy {
    private static final Set<ErrorKind> RETRYABLE = EnumSet.of(
            ErrorKind.RATE_LIMITED,
            ErrorKind.QUOTA_EXHAUSTED,
            ErrorKind.TRANSIENT_FAILURE,
            ErrorKind.INVALID_CREDENTIAL
    );
    private static final Set<ErrorKind> SWAPPED = EnumSet.of(
            ErrorKind.RATE_LIMITED,
            ErrorKind.QUOTA_EXHAUSTED,
            ErrorKind.INVALID_CREDENTIAL
    );

    private final int maxAttempts;
    private final Duration retryDelay;
    private final double backoffMultiplier;
    private final Duration maxDelay;

    public RetryPolicy(int maxAttempts, Duration retryDelay, double backoffMultiplier, Duration maxDelay) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("backoffMultiplier must be at least 1.0");
        }
        this.maxAttempts = maxAttempts;
        this.retryDelay = retryDelay;
        this.backoffMultiplier = backoffMultiplier;
        this.maxDelay = maxDelay;
    }

    public static RetryPolicy immediate(int maxAttempts) {
        return new RetryPolicy(maxAttempts, Duration.ZERO, 1.0, Duration.ZERO);
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public boolean isRetryable(ErrorKind kind) {
        return RETRYABLE.contains(kind);
    }

    /**
     * Errors that belong to the credential rather than the item. The caller moves on to another
     * credential without spending an attempt.
     */
    public boolean isCredentialSwap(ErrorKind kind) {
        return SWAPPED.contains(kind);
    }

    public boolean hasAttemptsLeft(int attemptsMade) {
        return attemptsMade < maxAttempts;
    }

    /**
     * Delay to wait before the given attempt (1-based). The first attempt never waits.
     * Credential swaps happen without waiting.
     */
    public Duration delayBefore(int attempt, ErrorKind previousError) {
        if (attempt <= 1 || isCredentialSwap(previousError)) {
            return Duration.ZERO;
        }
        double factor = Math.pow(backoffMultiplier, attempt - 2);
        long millis = (long) Math.min((double) maxDelay.toMillis(), retryDelay.toMillis() * factor);
        return Duration.ofMillis(Math.max(0, millis));
    }
}
