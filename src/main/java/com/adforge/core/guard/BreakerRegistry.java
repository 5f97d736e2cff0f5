package com.adforge.core.guard;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Per-dependency circuit breaker state, keyed by string.
 * <p>
 * States are created lazily and kept for the life of the registry. Every read-modify-write on a
 * key runs inside {@link ConcurrentHashMap#compute}, so updates to one key are atomic while
 * different keys never contend. An expired cooldown is reset on the next check, not eagerly:
 * the check lets the caller through as a probe, and the probe's failure reopens the breaker
 * immediately while its success closes it.
 * <p>
 * The failure threshold does not apply to a probe: once a cooldown has elapsed, the next
 * failure on that key reopens the breaker.
 */
public class BreakerRegistry {

    private static final Logger log = LoggerFactory.getLogger(BreakerRegistry.class);

    private final ConcurrentHashMap<String, BreakerState> states = new ConcurrentHashMap<>();
    private final Clock clock;

    public BreakerRegistry() {
        this(Clock.systemUTC());
    }

    public BreakerRegistry(Clock clock) {
        this.clock = clock;
    }

    /**
     * @return true while the key's cooldown has not elapsed; an elapsed cooldown is reset here
     */
    public boolean isOpen(String key) {
        Instant now = clock.instant();
        AtomicBoolean open = new AtomicBoolean(false);
        states.compute(key, (k, current) -> {
            if (current == null) {
                return BreakerState.closed(k);
            }
            if (current.openedUntil() == null) {
                return current;
            }
            if (current.isOpenAt(now)) {
                open.set(true);
                return current;
            }
            log.info("Breaker {} cooldown elapsed; allowing probe call", k);
            return new BreakerState(k, 0, null, true);
        });
        return open.get();
    }

    public void recordSuccess(String key) {
        BreakerState previous = states.put(key, BreakerState.closed(key));
        if (previous != null && previous.probing()) {
            log.info("Breaker {} closed after successful probe", key);
        }
    }

    /**
     * Counts one failure against the key.
     *
     * @return true if this failure opened the breaker
     */
    public boolean recordFailure(String key, CircuitBreakerOptions options) {
        Instant now = clock.instant();
        AtomicReference<BreakerState> opened = new AtomicReference<>();
        states.compute(key, (k, current) -> {
            BreakerState state = current != null ? current : BreakerState.closed(k);
            if (state.isOpenAt(now)) {
                return state;
            }
            int failures = state.consecutiveFailures() + 1;
            if (state.probing() || failures >= options.failureThreshold()) {
                BreakerState next = new BreakerState(k, failures, now.plusMillis(options.cooldownMs()), false);
                opened.set(next);
                return next;
            }
            return new BreakerState(k, failures, null, state.probing());
        });
        BreakerState state = opened.get();
        if (state != null) {
            log.warn("Breaker {} opened after {} consecutive failure(s); cooling down until {}",
                    key, state.consecutiveFailures(), state.openedUntil());
            return true;
        }
        return false;
    }

    public Optional<BreakerState> state(String key) {
        return Optional.ofNullable(states.get(key));
    }

    public List<BreakerState> snapshot() {
        List<BreakerState> all = new ArrayList<>(states.values());
        all.sort(Comparator.comparing(BreakerState::key));
        return all;
    }

    public Instant now() {
        return clock.instant();
    }
}
