package com.adforge.core.guard;

import com.adforge.core.error.CallTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Races one unit of work against a deadline.
 * <p>
 * The work runs on a dedicated daemon thread while the caller waits at most {@code timeoutMs}.
 * When the deadline wins, the call's {@link CancellationToken} is cancelled and the worker
 * thread interrupted, then {@link CallTimeoutException} is thrown. No timer outlives a call
 * that settles in time.
 */
public class TimeoutGuard implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TimeoutGuard.class);

    private final ExecutorService executor;

    public TimeoutGuard() {
        this(Executors.newCachedThreadPool(daemonThreads()));
    }

    TimeoutGuard(ExecutorService executor) {
        this.executor = executor;
    }

    /**
     * @param work      the call to run
     * @param timeoutMs deadline in milliseconds; zero or negative disables the deadline
     * @param label     names the call in the timeout message
     * @return the work's result if it settles before the deadline
     * @throws CallTimeoutException if the deadline elapses first
     * @throws Exception            whatever the work itself threw
     */
    public <T> T withTimeout(RemoteCall<T> work, long timeoutMs, String label) throws Exception {
        CancellationToken token = CancellationToken.create();
        if (timeoutMs <= 0) {
            return work.call(token);
        }

        Map<String, String> mdc = MDC.getCopyOfContextMap();
        Future<T> future = executor.submit(() -> {
            if (mdc != null) {
                MDC.setContextMap(mdc);
            }
            try {
                return work.call(token);
            } finally {
                MDC.clear();
            }
        });

        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            token.cancel(label + " timed out after " + timeoutMs + "ms");
            future.cancel(true);
            log.warn("{} timed out after {}ms", label, timeoutMs);
            throw new CallTimeoutException(label, timeoutMs);
        } catch (InterruptedException e) {
            token.cancel(label + " interrupted");
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception ex) {
                throw ex;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw e;
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    private static ThreadFactory daemonThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "adforge-call-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
