package com.adforge.core.config;

import com.adforge.core.fanout.BoundedFanOut;
import com.adforge.core.generation.TaskPoller;
import com.adforge.core.guard.BreakerRegistry;
import com.adforge.core.guard.ExternalCallGuard;
import com.adforge.core.guard.GuardListener;
import com.adforge.core.guard.GuardedCall;
import com.adforge.core.guard.RetryPolicy;
import com.adforge.core.guard.Sleeper;
import com.adforge.core.guard.TimeoutGuard;
import com.adforge.core.metrics.TaskCoreMetrics;
import com.adforge.core.provider.HttpJsonProviderAdapter;
import com.adforge.core.provider.ProviderStateTable;
import com.adforge.core.provider.ProviderStatus;
import com.adforge.core.provider.RemoteProviderAdapter;
import com.adforge.core.scene.SceneSequenceRunner;
import com.adforge.core.scene.SceneTaskMapper;
import com.adforge.core.scene.SceneVideoGenerator;
import com.adforge.core.store.ItemStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Wires the execution core: one breaker registry per process, the retry and timeout
 * primitives, and the provider adapter built from {@code adforge.provider.*}.
 */
@Configuration
public class TaskCoreConfig {

    private static final Logger log = LoggerFactory.getLogger(TaskCoreConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.SYSTEM;
    }

    @Bean
    public BreakerRegistry breakerRegistry(Clock clock) {
        return new BreakerRegistry(clock);
    }

    @Bean
    public RetryPolicy retryPolicy() {
        return new RetryPolicy();
    }

    @Bean(destroyMethod = "close")
    public TimeoutGuard timeoutGuard() {
        return new TimeoutGuard();
    }

    @Bean
    public GuardedCall guardedCall(BreakerRegistry breakers, RetryPolicy retryPolicy, TimeoutGuard timeoutGuard,
                                   List<GuardListener> listeners) {
        log.info("Guarded calls report to {} listener(s)", listeners.size());
        return new GuardedCall(breakers, retryPolicy, timeoutGuard, listeners);
    }

    @Bean
    public BoundedFanOut boundedFanOut() {
        return new BoundedFanOut();
    }

    @Bean
    public TaskPoller taskPoller(Sleeper sleeper) {
        return new TaskPoller(sleeper);
    }

    @Bean
    public ProviderStateTable providerStateTable(TaskCoreProperties properties) {
        Map<String, ProviderStatus> extra = new LinkedHashMap<>();
        properties.getProvider().getStates().forEach((state, status) ->
                extra.put(state, ProviderStatus.valueOf(status.trim().toUpperCase(Locale.ROOT))));
        return ProviderStateTable.kie().with(extra);
    }

    @Bean
    public RemoteProviderAdapter remoteProviderAdapter(TaskCoreProperties properties, ObjectMapper objectMapper,
                                                       ProviderStateTable states) {
        log.info("Configuring HTTP provider '{}' at {}", properties.getProvider().getName(),
                properties.getProvider().getBaseUrl());
        return new HttpJsonProviderAdapter(properties.getProvider(), objectMapper, states);
    }

    @Bean
    public SceneVideoGenerator sceneVideoGenerator(RemoteProviderAdapter adapter, ExternalCallGuard guard,
                                                   TaskPoller poller, TaskCoreProperties properties,
                                                   TaskCoreMetrics metrics) {
        return new SceneVideoGenerator(adapter, guard, poller, properties, metrics);
    }

    @Bean
    public SceneSequenceRunner sceneSequenceRunner(ItemStore itemStore, SceneTaskMapper mapper,
                                                   SceneVideoGenerator generator) {
        return new SceneSequenceRunner(itemStore, mapper, generator);
    }
}
