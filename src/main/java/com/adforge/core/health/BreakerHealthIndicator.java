package com.adforge.core.health;

import com.adforge.core.guard.BreakerRegistry;
import com.adforge.core.guard.BreakerState;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.actuate.health.Status;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Actuator view of the circuit breakers. Any open breaker makes the component DEGRADED;
 * the details list each open key with the end of its cooldown.
 */
@Component("breakers")
public class BreakerHealthIndicator implements HealthIndicator {

    public static final Status DEGRADED = new Status("DEGRADED", "One or more circuit breakers are open");

    private final BreakerRegistry breakers;

    public BreakerHealthIndicator(BreakerRegistry breakers) {
        this.breakers = breakers;
    }

    @Override
    public Health health() {
        Instant now = breakers.now();
        Health.Builder builder = Health.up();
        boolean anyOpen = false;
        for (BreakerState state : breakers.snapshot()) {
            if (state.isOpenAt(now)) {
                anyOpen = true;
                builder.withDetail(state.key(), "open until " + state.openedUntil());
            } else if (state.consecutiveFailures() > 0 || state.probing()) {
                builder.withDetail(state.key(), state.phaseAt(now) + " (" + state.consecutiveFailures() + " failure(s))");
            }
        }
        return anyOpen ? builder.status(DEGRADED).build() : builder.build();
    }
}
