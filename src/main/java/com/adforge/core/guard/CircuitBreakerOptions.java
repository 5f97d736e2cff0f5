package com.adforge.core.guard;

/**
 * @param failureThreshold consecutive counted failures that open the breaker
 * @param cooldownMs       how long the breaker stays open before a probe call is let through
 */
public record CircuitBreakerOptions(int failureThreshold, long cooldownMs) {

    public CircuitBreakerOptions {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1");
        }
        if (cooldownMs < 0) {
            throw new IllegalArgumentException("cooldownMs must be >= 0");
        }
    }
}
