package com.adforge.core.guard;

import com.adforge.core.error.ErrorClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Random;
import java.util.concurrent.Callable;
import java.util.function.IntSupplier;

/**
 * Bounded retry with exponential backoff and jitter.
 * <p>
 * The classifier is consulted after every failed attempt, including the first; a
 * non-retryable error is rethrown immediately. When the budget runs out the error of the
 * last attempt is rethrown.
 */
public class RetryPolicy {

    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    /** Jitter is drawn uniformly from [0, JITTER_BOUND_MS). */
    public static final int JITTER_BOUND_MS = 250;

    private final Sleeper sleeper;
    private final IntSupplier jitter;

    public RetryPolicy() {
        this(Sleeper.SYSTEM, new Random());
    }

    public RetryPolicy(Sleeper sleeper, Random random) {
        this(sleeper, () -> random.nextInt(JITTER_BOUND_MS));
    }

    RetryPolicy(Sleeper sleeper, IntSupplier jitter) {
        this.sleeper = sleeper;
        this.jitter = jitter;
    }

    public <T> T withRetries(Callable<T> work, RetryOptions options, ErrorClassifier classifier) throws Exception {
        return withRetries(work, options, classifier, null);
    }

    public <T> T withRetries(Callable<T> work, RetryOptions options, ErrorClassifier classifier,
                             AttemptListener listener) throws Exception {
        Exception last = null;
        for (int attempt = 1; attempt <= options.maxAttempts(); attempt++) {
            try {
                return work.call();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw e;
            } catch (Exception e) {
                last = e;
                boolean willRetry = attempt < options.maxAttempts() && classifier.isRetryable(e);
                long delay = willRetry ? options.backoffAfter(attempt) + jitter.getAsInt() : 0;
                if (listener != null) {
                    listener.onAttemptFailed(new RetryAttempt(attempt, delay, willRetry), e);
                }
                if (!willRetry) {
                    break;
                }
                log.warn("Attempt {}/{} failed, retrying in {}ms: {}",
                        attempt, options.maxAttempts(), delay, e.getMessage());
                sleeper.sleep(delay);
            }
        }
        throw last;
    }

    /**
     * Observes failed attempts, for metrics and logging.
     */
    @FunctionalInterface
    public interface AttemptListener {
        void onAttemptFailed(RetryAttempt attempt, Exception error);
    }
}
