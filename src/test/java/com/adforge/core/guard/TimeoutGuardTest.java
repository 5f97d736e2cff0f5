package com.adforge.core.guard;

import com.adforge.core.error.CallTimeoutException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class TimeoutGuardTest {

    private final TimeoutGuard guard = new TimeoutGuard();

    @AfterEach
    void tearDown() {
        guard.close();
    }

    @Test
    @DisplayName("returns the result of work that settles before the deadline")
    void returnsInTime() throws Exception {
        assertEquals("done", guard.withTimeout(token -> "done", 1_000, "fast call"));
    }

    @Test
    @DisplayName("work slower than the deadline fails with a timeout and is cancelled")
    void timesOutSlowWork() throws Exception {
        CountDownLatch cancelled = new CountDownLatch(1);
        AtomicBoolean tokenCancelled = new AtomicBoolean();

        var error = assertThrows(CallTimeoutException.class, () -> guard.withTimeout(token -> {
            token.onCancel(() -> tokenCancelled.set(true));
            try {
                Thread.sleep(5_000);
            } catch (InterruptedException e) {
                cancelled.countDown();
                throw e;
            }
            return "late";
        }, 50, "slow call"));

        assertEquals("slow call timed out after 50ms", error.getMessage());
        assertTrue(cancelled.await(2, TimeUnit.SECONDS));
        assertTrue(tokenCancelled.get());
    }

    @Test
    @DisplayName("errors thrown by the work pass through unchanged")
    void propagatesWorkErrors() {
        var error = assertThrows(IllegalStateException.class,
                () -> guard.withTimeout(token -> { throw new IllegalStateException("boom"); }, 1_000, "x"));
        assertEquals("boom", error.getMessage());
    }

    @Test
    @DisplayName("a non-positive timeout runs without a deadline")
    void noDeadline() throws Exception {
        Integer result = guard.withTimeout(token -> 42, 0, "unbounded");
        assertEquals(42, result);
    }
}
