package com.adforge.core.error;

import java.time.Instant;

/**
 * Raised without invoking the dependency while its circuit breaker is open.
 */
public class BreakerOpenException extends TaskCoreException {

    private final String breakerKey;
    private final Instant openedUntil;

    public BreakerOpenException(String label, String breakerKey, Instant openedUntil) {
        super(ErrorKind.BREAKER_OPEN, label + " blocked: circuit breaker open for "
                + breakerKey + " until " + openedUntil);
        this.breakerKey = breakerKey;
        this.openedUntil = openedUntil;
    }

    public String breakerKey() {
        return breakerKey;
    }

    public Instant openedUntil() {
        return openedUntil;
    }
}
