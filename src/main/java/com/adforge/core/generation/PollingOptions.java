package com.adforge.core.generation;

/**
 * Fixed-interval polling within a wall-clock budget.
 */
public record PollingOptions(long intervalMs, long maxWaitMs) {

    public PollingOptions {
        if (intervalMs <= 0) {
            throw new IllegalArgumentException("intervalMs must be > 0");
        }
        if (maxWaitMs < 0) {
            throw new IllegalArgumentException("maxWaitMs must be >= 0");
        }
    }

    /** Number of status checks the budget allows; always at least one. */
    public int maxPolls() {
        return (int) Math.max(1, Math.min(Integer.MAX_VALUE, maxWaitMs / intervalMs));
    }
}
