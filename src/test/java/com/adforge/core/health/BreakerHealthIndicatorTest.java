package com.adforge.core.health;

import com.adforge.core.MutableClock;
import com.adforge.core.guard.BreakerRegistry;
import com.adforge.core.guard.CircuitBreakerOptions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class BreakerHealthIndicatorTest {

    private final MutableClock clock = new MutableClock();
    private final BreakerRegistry breakers = new BreakerRegistry(clock);
    private final BreakerHealthIndicator indicator = new BreakerHealthIndicator(breakers);

    @Test
    @DisplayName("UP when every breaker is closed")
    void upWhenClosed() {
        assertEquals(Status.UP, indicator.health().getStatus());
    }

    @Test
    @DisplayName("DEGRADED while a breaker is open, UP again after cooldown")
    void degradedWhileOpen() {
        var options = new CircuitBreakerOptions(2, 60_000);
        breakers.recordFailure("transcription:ad-transcripts", options);
        assertEquals(Status.UP, indicator.health().getStatus());

        breakers.recordFailure("transcription:ad-transcripts", options);
        Health health = indicator.health();
        assertEquals(BreakerHealthIndicator.DEGRADED, health.getStatus());
        assertTrue(health.getDetails().get("transcription:ad-transcripts").toString().startsWith("open until"));

        clock.advance(Duration.ofSeconds(61));
        assertEquals(Status.UP, indicator.health().getStatus());
    }
}
