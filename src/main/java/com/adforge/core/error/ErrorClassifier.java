package com.adforge.core.error;

import java.io.IOException;

/**
 * Decides whether a failed attempt is worth retrying with the same configuration.
 */
@FunctionalInterface
public interface ErrorClassifier {

    boolean isRetryable(Throwable error);

    /**
     * Retries transient remote failures (rate limits, gateway errors, timeouts) and plain
     * network I/O failures. Everything else surfaces on the first attempt.
     */
    ErrorClassifier DEFAULT = error -> {
        Throwable cause = ErrorSummaries.unwrap(error);
        if (cause instanceof TransientRemoteException) {
            return true;
        }
        if (cause instanceof TaskCoreException) {
            return false;
        }
        return cause instanceof IOException;
    };

    ErrorClassifier NEVER = error -> false;

    /**
     * Whether a final failure should count towards opening the dependency's breaker.
     * Configuration, request-shape and breaker-open failures say nothing about the
     * dependency's health and are ignored.
     */
    static boolean countsTowardsBreaker(Throwable error) {
        Throwable cause = ErrorSummaries.unwrap(error);
        if (cause instanceof TaskCoreException tce) {
            return switch (tce.kind()) {
                case CONFIG, REQUEST_SHAPE, BREAKER_OPEN -> false;
                default -> true;
            };
        }
        return true;
    }
}
