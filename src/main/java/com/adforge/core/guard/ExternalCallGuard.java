package com.adforge.core.guard;

import com.adforge.core.config.TaskCoreProperties;
import com.adforge.core.error.ErrorClassifier;
import org.springframework.stereotype.Service;

/**
 * Entry point for guarded remote calls. Resolves the options for a breaker key from
 * {@code adforge.guard.*} defaults and {@code adforge.dependencies.<key>.*} overrides.
 */
@Service
public class ExternalCallGuard {

    private final GuardedCall guardedCall;
    private final TaskCoreProperties properties;

    public ExternalCallGuard(GuardedCall guardedCall, TaskCoreProperties properties) {
        this.guardedCall = guardedCall;
        this.properties = properties;
    }

    public <T> T call(String breakerKey, String label, RemoteCall<T> fn) {
        return guardedCall.execute(optionsFor(breakerKey).withLabel(label), fn);
    }

    public <T> T call(String breakerKey, String label, ErrorClassifier classifier, RemoteCall<T> fn) {
        return guardedCall.execute(optionsFor(breakerKey).withLabel(label).withClassifier(classifier), fn);
    }

    public GuardOptions optionsFor(String breakerKey) {
        TaskCoreProperties.Guard defaults = properties.getGuard();
        TaskCoreProperties.Dependency override = properties.getDependencies().get(breakerKey);
        if (override == null) {
            override = new TaskCoreProperties.Dependency();
        }
        long timeoutMs = pick(override.getTimeoutMs(), defaults.getTimeoutMs());
        int retries = pick(override.getRetries(), defaults.getRetries());
        long baseDelayMs = pick(override.getBaseDelayMs(), defaults.getBaseDelayMs());
        long maxDelayMs = pick(override.getMaxDelayMs(), defaults.getMaxDelayMs());
        int threshold = pick(override.getFailureThreshold(), defaults.getFailureThreshold());
        long cooldownMs = pick(override.getCooldownMs(), defaults.getCooldownMs());
        return new GuardOptions(
                breakerKey,
                breakerKey,
                timeoutMs,
                new RetryOptions(retries, baseDelayMs, maxDelayMs),
                new CircuitBreakerOptions(threshold, cooldownMs),
                ErrorClassifier.DEFAULT);
    }

    private static <N extends Number> N pick(N override, N fallback) {
        return override != null ? override : fallback;
    }
}
