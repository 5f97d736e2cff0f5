package com.adforge.core.guard;

import java.time.Instant;

/**
 * Snapshot of one dependency's breaker.
 *
 * @param key                 dependency key, e.g. {@code "transcription:ad-transcripts"}
 * @param consecutiveFailures counted failures since the last success or reset
 * @param openedUntil         end of the current cooldown, or null while closed
 * @param probing             true after a cooldown elapsed and before the probe outcome is recorded
 */
public record BreakerState(String key, int consecutiveFailures, Instant openedUntil, boolean probing) {

    public enum Phase { CLOSED, OPEN, HALF_OPEN }

    static BreakerState closed(String key) {
        return new BreakerState(key, 0, null, false);
    }

    public boolean isOpenAt(Instant now) {
        return openedUntil != null && now.isBefore(openedUntil);
    }

    public Phase phaseAt(Instant now) {
        if (isOpenAt(now)) {
            return Phase.OPEN;
        }
        if (openedUntil != null || probing) {
            return Phase.HALF_OPEN;
        }
        return Phase.CLOSED;
    }
}
