package com.adforge.core.guard;

import com.adforge.core.error.BreakerOpenException;
import com.adforge.core.error.ErrorClassifier;
import com.adforge.core.error.ErrorSummaries;
import com.adforge.core.error.TransientRemoteException;
import com.adforge.core.logging.MdcContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CancellationException;

/**
 * Wraps one remote call in breaker check, retries and a per-attempt timeout, then reports the
 * overall outcome back to the breaker.
 * <p>
 * Every remote call should pass through this layer exactly once. Breaker-open rejections never
 * invoke the call and are never counted; configuration and request-shape failures are rethrown
 * without touching the breaker.
 */
public class GuardedCall {

    private static final Logger log = LoggerFactory.getLogger(GuardedCall.class);

    private final BreakerRegistry breakers;
    private final RetryPolicy retryPolicy;
    private final TimeoutGuard timeoutGuard;
    private final List<GuardListener> listeners;

    public GuardedCall(BreakerRegistry breakers, RetryPolicy retryPolicy, TimeoutGuard timeoutGuard,
                       List<GuardListener> listeners) {
        this.breakers = breakers;
        this.retryPolicy = retryPolicy;
        this.timeoutGuard = timeoutGuard;
        this.listeners = List.copyOf(listeners);
    }

    public GuardedCall(BreakerRegistry breakers, RetryPolicy retryPolicy, TimeoutGuard timeoutGuard) {
        this(breakers, retryPolicy, timeoutGuard, List.of());
    }

    /**
     * Runs {@code fn} under the given options.
     *
     * @throws BreakerOpenException when the breaker for {@code options.breakerKey()} is open
     * @throws RuntimeException     the last attempt's failure; checked failures are wrapped as
     *                              {@link TransientRemoteException}
     */
    public <T> T execute(GuardOptions options, RemoteCall<T> fn) {
        String key = options.breakerKey();
        MdcContext.setBreakerKey(key);
        try {
            if (breakers.isOpen(key)) {
                Instant until = breakers.state(key).map(BreakerState::openedUntil).orElse(null);
                listeners.forEach(l -> l.onRejected(key));
                log.warn("{} rejected: breaker {} open until {}", options.label(), key, until);
                throw new BreakerOpenException(options.label(), key, until);
            }

            long start = System.nanoTime();
            try {
                T result = retryPolicy.withRetries(
                        () -> timeoutGuard.withTimeout(fn, options.timeoutMs(), options.label()),
                        options.retry(),
                        options.classifier(),
                        (attempt, error) -> listeners.forEach(l -> l.onAttemptFailed(key, attempt, error)));
                breakers.recordSuccess(key);
                long elapsed = System.nanoTime() - start;
                listeners.forEach(l -> l.onCompleted(key, elapsed, true));
                return result;
            } catch (Exception e) {
                if (ErrorClassifier.countsTowardsBreaker(e) && breakers.recordFailure(key, options.breaker())) {
                    Instant until = breakers.state(key).map(BreakerState::openedUntil).orElse(null);
                    listeners.forEach(l -> l.onBreakerOpened(key, until));
                }
                long elapsed = System.nanoTime() - start;
                listeners.forEach(l -> l.onCompleted(key, elapsed, false));
                throw unchecked(options.label(), e);
            }
        } finally {
            MdcContext.clearBreakerKey();
        }
    }

    private static RuntimeException unchecked(String label, Exception error) {
        if (error instanceof RuntimeException re) {
            return re;
        }
        if (error instanceof InterruptedException) {
            Thread.currentThread().interrupt();
            CancellationException cancelled = new CancellationException(label + " interrupted");
            cancelled.initCause(error);
            return cancelled;
        }
        return new TransientRemoteException(label, label + " failed: " + ErrorSummaries.message(error), error);
    }
}
