package com.adforge.core.guard;

import com.adforge.core.error.ErrorClassifier;

import java.util.Objects;

/**
 * Everything one guarded call needs: which breaker to consult, how long to wait per attempt,
 * how often to retry and which errors are worth retrying.
 */
public record GuardOptions(
        String breakerKey,
        String label,
        long timeoutMs,
        RetryOptions retry,
        CircuitBreakerOptions breaker,
        ErrorClassifier classifier
) {

    public GuardOptions {
        Objects.requireNonNull(breakerKey, "breakerKey");
        Objects.requireNonNull(retry, "retry");
        Objects.requireNonNull(breaker, "breaker");
        if (label == null || label.isBlank()) {
            label = breakerKey;
        }
        if (classifier == null) {
            classifier = ErrorClassifier.DEFAULT;
        }
    }

    public GuardOptions withLabel(String newLabel) {
        return new GuardOptions(breakerKey, newLabel, timeoutMs, retry, breaker, classifier);
    }

    public GuardOptions withClassifier(ErrorClassifier newClassifier) {
        return new GuardOptions(breakerKey, label, timeoutMs, retry, breaker, newClassifier);
    }
}
