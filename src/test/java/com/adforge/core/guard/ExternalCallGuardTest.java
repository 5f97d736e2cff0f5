package com.adforge.core.guard;

import com.adforge.core.config.TaskCoreProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ExternalCallGuardTest {

    @Test
    @DisplayName("unconfigured keys use the guard defaults")
    void defaultsApply() {
        var properties = new TaskCoreProperties();
        var guard = new ExternalCallGuard(mock(GuardedCall.class), properties);

        GuardOptions options = guard.optionsFor("kie:video-generation");

        assertEquals(60_000, options.timeoutMs());
        assertEquals(new RetryOptions(2, 500, 5_000), options.retry());
        assertEquals(new CircuitBreakerOptions(3, 60_000), options.breaker());
        assertEquals("kie:video-generation", options.label());
    }

    @Test
    @DisplayName("per-dependency overrides replace only the fields they set")
    void overridesMerge() {
        var properties = new TaskCoreProperties();
        var override = new TaskCoreProperties.Dependency();
        override.setTimeoutMs(120_000L);
        override.setFailureThreshold(5);
        properties.getDependencies().put("kie:video-generation", override);
        var guard = new ExternalCallGuard(mock(GuardedCall.class), properties);

        GuardOptions options = guard.optionsFor("kie:video-generation");

        assertEquals(120_000, options.timeoutMs());
        assertEquals(5, options.breaker().failureThreshold());
        assertEquals(60_000, options.breaker().cooldownMs());
        assertEquals(2, options.retry().retries());
    }

    @Test
    @DisplayName("call passes the label through to the guarded call")
    @SuppressWarnings("unchecked")
    void callUsesLabel() {
        var guardedCall = mock(GuardedCall.class);
        when(guardedCall.execute(any(GuardOptions.class), any(RemoteCall.class))).thenReturn("task-1");
        var guard = new ExternalCallGuard(guardedCall, new TaskCoreProperties());

        String result = guard.call("kie:video-generation", "kie create", token -> "ignored");

        assertEquals("task-1", result);
        verify(guardedCall).execute(argThat(o -> o.label().equals("kie create")), any(RemoteCall.class));
    }
}
