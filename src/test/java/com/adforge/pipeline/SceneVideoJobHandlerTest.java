package com.adforge.pipeline;

import com.adforge.core.MutableClock;
import com.adforge.core.config.ConfigGuard;
import com.adforge.core.error.ConfigException;
import com.adforge.core.events.EventBus;
import com.adforge.core.events.JobEventPublisher;
import com.adforge.core.job.JobRecord;
import com.adforge.core.job.JobStatus;
import com.adforge.core.metrics.TaskCoreMetrics;
import com.adforge.core.scene.SceneRunSummary;
import com.adforge.core.scene.SceneSequenceRunner;
import com.adforge.core.scene.StoryboardDefaults;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class SceneVideoJobHandlerTest {

    private final SceneSequenceRunner runner = mock(SceneSequenceRunner.class);

    private SceneVideoJobHandler handler(MockEnvironment environment) {
        return new SceneVideoJobHandler(runner, new ConfigGuard(environment),
                new JobEventPublisher(new EventBus(), new MutableClock()), new TaskCoreMetrics(new SimpleMeterRegistry()));
    }

    private static JobRecord job(ObjectNode payload) {
        Instant now = Instant.parse("2026-03-01T10:00:00Z");
        return new JobRecord("job-1", SceneVideoJobHandler.TYPE, JobStatus.RUNNING, payload, null, null, now, now);
    }

    @Test
    @DisplayName("passes storyboard, force flag and default references to the runner")
    void delegates() {
        when(runner.run(eq("sb-1"), eq(true), any(), any()))
                .thenReturn(new SceneRunSummary(3, 2, 1, List.of("a", "b", "c"), List.of("t2", "t3")));

        var result = handler(new MockEnvironment().withProperty("adforge.provider.api-key", "key"))
                .handle(job(JsonNodeFactory.instance.objectNode()
                        .put("storyboardId", "sb-1")
                        .put("forceReprocess", true)
                        .put("characterAvatarImageUrl", "https://img/avatar.png")));

        assertEquals("2 scene(s) generated, 1 already had video (3 total)", result.summary());
        verify(runner).run(eq("sb-1"), eq(true),
                eq(new StoryboardDefaults("https://img/avatar.png", null)), any());
    }

    @Test
    @DisplayName("fails as configuration when the API key is missing")
    void needsApiKey() {
        var handler = handler(new MockEnvironment());

        assertThrows(ConfigException.class,
                () -> handler.handle(job(JsonNodeFactory.instance.objectNode().put("storyboardId", "sb-1"))));
        verifyNoInteractions(runner);
    }

    @Test
    @DisplayName("a payload without storyboardId is rejected")
    void needsStoryboard() {
        var handler = handler(new MockEnvironment().withProperty("adforge.provider.api-key", "key"));

        assertThrows(IllegalArgumentException.class, () -> handler.handle(job(JsonNodeFactory.instance.objectNode())));
    }
}
