package com.bridgestats.common;

/**
 * Fixed-delay retry budget for live chain reads.
 */
public final class RetryPolicy {

    private final long delayMs;
    private final int maxAttempts;

    private RetryPolicy(long delayMs, int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, got " + maxAttempts);
        }
        this.delayMs = Math.max(0L, delayMs);
        this.maxAttempts = maxAttempts;
    }

    /**
     * {@code retries} excludes the initial call, so a policy with 4 retries allows 5 attempts in total.
     */
    public static RetryPolicy fixed(long delayMs, int retries) {
        if (retries < 0) {
            throw new IllegalArgumentException("retries must be non-negative, got " + retries);
        }
        return new RetryPolicy(delayMs, retries + 1);
    }

    /** Delay in milliseconds before each retry. */
    public long getDelayMs() {
        return delayMs;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }
}
