package com.adforge.core.guard;

/**
 * Retry budget for one guarded call.
 *
 * @param retries     additional attempts after the first; total attempts are {@code retries + 1}
 * @param baseDelayMs delay before the second attempt, doubled for each further attempt
 * @param maxDelayMs  cap on the exponential part of the delay (jitter is added on top)
 */
public record RetryOptions(int retries, long baseDelayMs, long maxDelayMs) {

    public static final RetryOptions NONE = new RetryOptions(0, 0, 0);

    public RetryOptions {
        if (retries < 0) {
            throw new IllegalArgumentException("retries must be >= 0");
        }
        if (baseDelayMs < 0 || maxDelayMs < 0) {
            throw new IllegalArgumentException("delays must be >= 0");
        }
    }

    public int maxAttempts() {
        return retries + 1;
    }

    /**
     * Exponential delay after a failed attempt, before jitter: {@code min(max, base * 2^(attempt-1))}.
     */
    public long backoffAfter(int attempt) {
        int exponent = Math.min(Math.max(attempt - 1, 0), 30);
        long scaled = baseDelayMs > (Long.MAX_VALUE >> exponent) ? Long.MAX_VALUE : baseDelayMs << exponent;
        return Math.min(maxDelayMs, scaled);
    }
}
