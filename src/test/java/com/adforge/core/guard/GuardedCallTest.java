package com.adforge.core.guard;

import com.adforge.core.MutableClock;
import com.adforge.core.error.BreakerOpenException;
import com.adforge.core.error.CallTimeoutException;
import com.adforge.core.error.ConfigException;
import com.adforge.core.error.RequestShapeException;
import com.adforge.core.error.TransientRemoteException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class GuardedCallTest {

    private static final String KEY = "transcription:ad-transcripts";

    private MutableClock clock;
    private BreakerRegistry breakers;
    private TimeoutGuard timeoutGuard;
    private GuardedCall guardedCall;
    private final List<String> events = new ArrayList<>();

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        breakers = new BreakerRegistry(clock);
        timeoutGuard = new TimeoutGuard();
        GuardListener recorder = new GuardListener() {
            @Override
            public void onRejected(String breakerKey) {
                events.add("rejected " + breakerKey);
            }

            @Override
            public void onBreakerOpened(String breakerKey, Instant openedUntil) {
                events.add("opened " + breakerKey);
            }
        };
        guardedCall = new GuardedCall(breakers, new RetryPolicy(millis -> {}, () -> 0), timeoutGuard,
                List.of(recorder));
    }

    @AfterEach
    void tearDown() {
        timeoutGuard.close();
    }

    private static GuardOptions options(int retries, int threshold) {
        return new GuardOptions(KEY, "transcribe", 1_000, new RetryOptions(retries, 10, 100),
                new CircuitBreakerOptions(threshold, 60_000), null);
    }

    @Test
    @DisplayName("a retried call that eventually succeeds leaves the breaker closed")
    void retriesThenSucceeds() {
        AtomicInteger calls = new AtomicInteger();

        String result = guardedCall.execute(options(2, 3), token -> {
            if (calls.incrementAndGet() == 1) {
                throw new TransientRemoteException("kie", 502, "bad gateway");
            }
            return "transcript";
        });

        assertEquals("transcript", result);
        assertEquals(0, breakers.state(KEY).orElseThrow().consecutiveFailures());
    }

    @Test
    @DisplayName("an exhausted retry budget counts once against the breaker")
    void exhaustedBudgetCountsOnce() {
        assertThrows(TransientRemoteException.class, () -> guardedCall.execute(options(2, 3), token -> {
            throw new TransientRemoteException("kie", 503, "unavailable");
        }));

        assertEquals(1, breakers.state(KEY).orElseThrow().consecutiveFailures());
    }

    @Test
    @DisplayName("an open breaker rejects without invoking the call")
    void openBreakerRejects() {
        for (int i = 0; i < 3; i++) {
            assertThrows(TransientRemoteException.class, () -> guardedCall.execute(options(0, 3), token -> {
                throw new TransientRemoteException("kie", 500, "down");
            }));
        }
        assertTrue(events.contains("opened " + KEY));

        AtomicInteger calls = new AtomicInteger();
        var error = assertThrows(BreakerOpenException.class,
                () -> guardedCall.execute(options(0, 3), token -> calls.incrementAndGet()));

        assertEquals(0, calls.get());
        assertTrue(error.getMessage().contains("circuit breaker open for " + KEY));
        assertTrue(events.contains("rejected " + KEY));
    }

    @Test
    @DisplayName("after the cooldown one probe is let through and its success closes the breaker")
    void probeAfterCooldown() {
        for (int i = 0; i < 3; i++) {
            assertThrows(TransientRemoteException.class, () -> guardedCall.execute(options(0, 3), token -> {
                throw new TransientRemoteException("kie", 500, "down");
            }));
        }
        clock.advance(Duration.ofSeconds(61));

        assertEquals("ok", guardedCall.execute(options(0, 3), token -> "ok"));
        assertFalse(breakers.isOpen(KEY));
    }

    @Test
    @DisplayName("request-shape and config errors do not count against the breaker")
    void nonCountingErrors() {
        for (int i = 0; i < 5; i++) {
            assertThrows(RequestShapeException.class, () -> guardedCall.execute(options(0, 1), token -> {
                throw new RequestShapeException("kie", 422, "invalid model");
            }));
            assertThrows(ConfigException.class, () -> guardedCall.execute(options(0, 1), token -> {
                throw new ConfigException("KIE: KIE_API_KEY must be set");
            }));
        }

        assertFalse(breakers.isOpen(KEY));
    }

    @Test
    @DisplayName("a per-attempt timeout is retried and counted")
    void timeoutsAreTransient() {
        AtomicInteger calls = new AtomicInteger();
        var opts = new GuardOptions(KEY, "slow", 30, new RetryOptions(1, 1, 1),
                new CircuitBreakerOptions(3, 60_000), null);

        assertThrows(CallTimeoutException.class, () -> guardedCall.execute(opts, token -> {
            calls.incrementAndGet();
            Thread.sleep(2_000);
            return "late";
        }));

        assertEquals(2, calls.get());
        assertEquals(1, breakers.state(KEY).orElseThrow().consecutiveFailures());
    }

    @Test
    @DisplayName("checked failures surface as transient remote errors")
    void wrapsCheckedFailures() {
        var error = assertThrows(TransientRemoteException.class, () -> guardedCall.execute(options(0, 3), token -> {
            throw new IOException("connection refused");
        }));

        assertTrue(error.getMessage().contains("connection refused"));
        assertInstanceOf(IOException.class, error.getCause());
    }
}
