package com.liquidswap.common;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Bounded exponential backoff with symmetric jitter, capped at {@code maxDelayMs}.
 */
public final class RetryPolicy {

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double jitterFactor;
    private final int maxAttempts;

    public RetryPolicy(long baseDelayMs, long maxDelayMs, double jitterFactor, int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        this.baseDelayMs = Math.max(0L, baseDelayMs);
        this.maxDelayMs = Math.max(this.baseDelayMs, maxDelayMs);
        this.jitterFactor = Math.max(0.0, Math.min(1.0, jitterFactor));
        this.maxAttempts = maxAttempts;
    }

    /**
     * Delay before the retry that follows the given zero-based failed attempt:
     * {@code min(base * 2^attempt, max)}, then jittered.
     */
    public long delayMs(int attempt) {
        int shift = Math.max(0, Math.min(attempt, 30));
        long exponential = baseDelayMs << shift;
        if (exponential < 0 || exponential > maxDelayMs) {
            exponential = maxDelayMs;
        }
        if (jitterFactor == 0.0) {
            return exponential;
        }
        double factor = 1.0 + (ThreadLocalRandom.current().nextDouble() * 2.0 - 1.0) * jitterFactor;
        return Math.max(0L, (long) (exponential * factor));
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /** 500 ms base, 8 s cap, 20% jitter, 3 attempts. */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(500L, 8_000L, 0.2, 3);
    }
}
