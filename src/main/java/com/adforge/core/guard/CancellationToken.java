package com.adforge.core.guard;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancellation signal shared between a timeout guard and the work it is waiting on.
 * <p>
 * Provider adapters register a callback that aborts their in-flight request, so a timeout
 * stops the underlying exchange instead of only giving up waiting for it.
 */
public final class CancellationToken {

    private static final Logger log = LoggerFactory.getLogger(CancellationToken.class);

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final CopyOnWriteArrayList<Runnable> callbacks = new CopyOnWriteArrayList<>();
    private volatile String reason;

    public static CancellationToken create() {
        return new CancellationToken();
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public String reason() {
        return reason;
    }

    /**
     * Cancels the token and runs every registered callback once. Later calls are no-ops.
     */
    public void cancel(String reason) {
        if (!cancelled.compareAndSet(false, true)) {
            return;
        }
        this.reason = reason;
        for (Runnable callback : callbacks) {
            try {
                callback.run();
            } catch (RuntimeException e) {
                log.warn("Cancellation callback failed: {}", e.getMessage(), e);
            }
        }
    }

    /**
     * Registers a callback run on cancellation, or immediately when already cancelled.
     *
     * @return handle that removes the callback once the guarded work has finished
     */
    public Registration onCancel(Runnable callback) {
        callbacks.add(callback);
        if (cancelled.get() && callbacks.remove(callback)) {
            callback.run();
        }
        return () -> callbacks.remove(callback);
    }

    public void throwIfCancelled() {
        if (cancelled.get()) {
            throw new CancellationException(reason != null ? reason : "cancelled");
        }
    }

    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }
}
