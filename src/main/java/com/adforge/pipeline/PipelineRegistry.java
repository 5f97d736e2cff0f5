package com.adforge.pipeline;

import com.adforge.core.config.ConfigGuard;
import com.adforge.core.config.TaskCoreProperties;
import com.adforge.core.events.JobEventPublisher;
import com.adforge.core.fanout.BoundedFanOut;
import com.adforge.core.generation.PollingOptions;
import com.adforge.core.generation.TaskPoller;
import com.adforge.core.guard.ExternalCallGuard;
import com.adforge.core.job.JobHandler;
import com.adforge.core.job.JobHandlerSource;
import com.adforge.core.metrics.TaskCoreMetrics;
import com.adforge.core.provider.RemoteProviderAdapter;
import com.adforge.core.store.ItemStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Builds one {@link ItemBatchJobHandler} per entry under {@code adforge.pipelines}.
 */
@Component
public class PipelineRegistry implements JobHandlerSource {

    private static final Logger log = LoggerFactory.getLogger(PipelineRegistry.class);

    private final List<JobHandler> handlers;

    public PipelineRegistry(TaskCoreProperties properties, ItemStore store, RemoteProviderAdapter adapter,
                            ExternalCallGuard guard, BoundedFanOut fanOut, TaskPoller poller,
                            ConfigGuard configGuard, JobEventPublisher events, TaskCoreMetrics metrics) {
        var polling = new PollingOptions(properties.getPolling().getIntervalMs(), properties.getPolling().getMaxWaitMs());
        List<JobHandler> built = new ArrayList<>();
        for (Map.Entry<String, TaskCoreProperties.Pipeline> entry : properties.getPipelines().entrySet()) {
            String type = entry.getKey();
            TaskCoreProperties.Pipeline settings = entry.getValue();
            var operation = new SubmitAndPollOperation(type, settings, adapter, guard, poller, polling);
            built.add(new ItemBatchJobHandler(type, settings, properties.getFanout(), store, adapter, guard,
                    fanOut, configGuard, events, metrics, operation));
            log.info("Registered pipeline '{}' (breaker {}, result field {})", type, settings.getBreakerKey(),
                    settings.getResultField());
        }
        this.handlers = List.copyOf(built);
    }

    @Override
    public Collection<JobHandler> handlers() {
        return handlers;
    }
}
