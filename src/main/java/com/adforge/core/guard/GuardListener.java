package com.adforge.core.guard;

import java.time.Instant;

/**
 * Observer of guarded-call lifecycle events. All methods default to no-ops.
 */
public interface GuardListener {

    default void onRejected(String breakerKey) {}

    default void onAttemptFailed(String breakerKey, RetryAttempt attempt, Exception error) {}

    default void onBreakerOpened(String breakerKey, Instant openedUntil) {}

    default void onCompleted(String breakerKey, long durationNanos, boolean success) {}
}
