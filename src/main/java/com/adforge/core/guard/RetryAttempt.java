package com.adforge.core.guard;

/**
 * One failed attempt inside a retry loop. Exists only for the duration of the call.
 *
 * @param attemptNumber     1-based attempt that just failed
 * @param delayBeforeNextMs sleep before the next attempt, or 0 when no further attempt follows
 * @param willRetry         whether another attempt follows
 */
public record RetryAttempt(int attemptNumber, long delayBeforeNextMs, boolean willRetry) {}
