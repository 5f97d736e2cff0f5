package com.adforge.core.metrics;

import com.adforge.core.error.CallTimeoutException;
import com.adforge.core.error.RequestShapeException;
import com.adforge.core.generation.FallbackChain;
import com.adforge.core.generation.ProviderConfig;
import com.adforge.core.guard.GuardListener;
import com.adforge.core.guard.RetryAttempt;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.concurrent.TimeUnit;

/**
 * Centralised Micrometer metrics for guarded calls, pipelines and jobs.
 */
@Service
public class TaskCoreMetrics implements GuardListener, FallbackChain.Listener {

    private final MeterRegistry registry;

    public TaskCoreMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    // --- Guarded calls ---

    @Override
    public void onCompleted(String breakerKey, long durationNanos, boolean success) {
        Timer.builder("adforge.call.duration")
                .description("Guarded external call duration including retries")
                .tag("breaker", breakerKey)
                .tag("outcome", success ? "success" : "failure")
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    @Override
    public void onAttemptFailed(String breakerKey, RetryAttempt attempt, Exception error) {
        if (attempt.willRetry()) {
            Counter.builder("adforge.call.retries")
                    .description("Failed attempts that were retried")
                    .tag("breaker", breakerKey)
                    .register(registry)
                    .increment();
        }
        if (error instanceof CallTimeoutException) {
            Counter.builder("adforge.call.timeouts")
                    .description("Attempts abandoned at their deadline")
                    .tag("breaker", breakerKey)
                    .register(registry)
                    .increment();
        }
    }

    @Override
    public void onBreakerOpened(String breakerKey, Instant openedUntil) {
        Counter.builder("adforge.breaker.openings")
                .tag("breaker", breakerKey)
                .register(registry)
                .increment();
    }

    @Override
    public void onRejected(String breakerKey) {
        Counter.builder("adforge.breaker.rejections")
                .description("Calls refused without being attempted because the breaker was open")
                .tag("breaker", breakerKey)
                .register(registry)
                .increment();
    }

    // --- Generation ---

    @Override
    public void onAdvance(ProviderConfig from, ProviderConfig to, RequestShapeException error) {
        Counter.builder("adforge.fallback.advances")
                .tag("from", from.name())
                .tag("to", to.name())
                .register(registry)
                .increment();
    }

    // --- Pipelines and jobs ---

    /**
     * @param outcome "succeeded", "skipped" or "failed"
     */
    public void recordItemOutcome(String pipeline, String outcome) {
        Counter.builder("adforge.items.total")
                .tag("pipeline", pipeline)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordJobResult(String jobType, String status, long ms) {
        Counter.builder("adforge.jobs.total")
                .tag("type", jobType)
                .tag("status", status)
                .register(registry)
                .increment();
        Timer.builder("adforge.job.duration")
                .tag("type", jobType)
                .register(registry)
                .record(ms, TimeUnit.MILLISECONDS);
    }
}
