package com.adforge.core.error;

/**
 * Classification of failures raised while calling external dependencies.
 */
public enum ErrorKind {
    /** Required configuration or credential missing. Never retried, never counted by a breaker. */
    CONFIG,
    /** Timeout, rate limit, 5xx or network failure. Retryable and counted by the breaker. */
    TRANSIENT,
    /** The call did not settle before its deadline. A transient failure. */
    TIMEOUT,
    /** The provider rejected the request payload itself (4xx other than 429). */
    REQUEST_SHAPE,
    /** Synthetic rejection raised without invoking the dependency. */
    BREAKER_OPEN,
    /** A single work item failed inside a batch. */
    ITEM_PROCESSING,
    /** The provider explicitly reported that a job failed. */
    TERMINAL_PROVIDER,
    /** One or more items of a batch failed. */
    BATCH
}
