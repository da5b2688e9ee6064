package com.shortphrase.infrastructure.ai;

/**
 * Bounded exponential backoff for transient oracle failures.
 *
 * @param maxAttempts total attempts including the first one
 * @param baseDelayMs delay before the first retry
 * @param multiplier  growth factor between consecutive delays
 * @param maxDelayMs  cap applied before jitter
 * @param jitter      relative jitter, 0.2 means ±20 %
 */
public record RetryPolicy(
        int maxAttempts,
        long baseDelayMs,
        double multiplier,
        long maxDelayMs,
        double jitter
) {
    public static final RetryPolicy DEFAULT = new RetryPolicy(3, 1000, 2.0, 10_000, 0.2);

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (baseDelayMs < 0 || maxDelayMs < 0 || multiplier < 1 || jitter < 0 || jitter >= 1) {
            throw new IllegalArgumentException("invalid backoff settings");
        }
    }

    public boolean canRetry(int failedAttempt) {
        return failedAttempt < maxAttempts;
    }

    /**
     * @param failedAttempt attempt number that just failed, from 1
     * @param randomUnit    uniform random value in [0, 1)
     * @return milliseconds to wait before the next attempt
     */
    public long delayBeforeRetry(int failedAttempt, double randomUnit) {
        double raw = baseDelayMs * Math.pow(multiplier, failedAttempt - 1);
        double capped = Math.min(raw, maxDelayMs);
        double jittered = capped * (1 + jitter * (2 * randomUnit - 1));
        return Math.max(0, Math.round(jittered));
    }
}
