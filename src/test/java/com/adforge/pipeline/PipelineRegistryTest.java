package com.adforge.pipeline;

import com.adforge.core.MutableClock;
import com.adforge.core.config.ConfigGuard;
import com.adforge.core.config.TaskCoreProperties;
import com.adforge.core.events.EventBus;
import com.adforge.core.events.JobEventPublisher;
import com.adforge.core.fanout.BoundedFanOut;
import com.adforge.core.generation.TaskPoller;
import com.adforge.core.guard.ExternalCallGuard;
import com.adforge.core.guard.GuardedCall;
import com.adforge.core.job.JobHandler;
import com.adforge.core.metrics.TaskCoreMetrics;
import com.adforge.core.provider.RemoteProviderAdapter;
import com.adforge.core.store.InMemoryItemStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class PipelineRegistryTest {

    private static TaskCoreProperties.Pipeline pipeline(String breakerKey, String resultField) {
        var settings = new TaskCoreProperties.Pipeline();
        settings.setBreakerKey(breakerKey);
        settings.setResultField(resultField);
        return settings;
    }

    private static PipelineRegistry registry(TaskCoreProperties properties) {
        return new PipelineRegistry(properties, new InMemoryItemStore(), mock(RemoteProviderAdapter.class),
                new ExternalCallGuard(mock(GuardedCall.class), properties), new BoundedFanOut(),
                new TaskPoller(ms -> {}), new ConfigGuard(new MockEnvironment()),
                new JobEventPublisher(new EventBus(), new MutableClock()), new TaskCoreMetrics(new SimpleMeterRegistry()));
    }

    @Test
    @DisplayName("builds one handler per configured pipeline, keyed by name")
    void onePerPipeline() {
        var properties = new TaskCoreProperties();
        properties.getPipelines().put("ad-transcripts", pipeline("transcription:ad-transcripts", "transcript"));
        properties.getPipelines().put("ad-quality-gate", pipeline("quality-gate:ad-quality-gate", "qualityGate"));

        List<String> types = registry(properties).handlers().stream().map(JobHandler::type).toList();

        assertEquals(List.of("ad-transcripts", "ad-quality-gate"), types);
    }

    @Test
    @DisplayName("no pipelines configured means no handlers")
    void empty() {
        assertTrue(registry(new TaskCoreProperties()).handlers().isEmpty());
    }
}
