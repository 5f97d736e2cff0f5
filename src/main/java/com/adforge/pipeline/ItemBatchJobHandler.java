package com.adforge.pipeline;

import com.adforge.core.config.ConfigGuard;
import com.adforge.core.config.TaskCoreProperties;
import com.adforge.core.error.ConfigException;
import com.adforge.core.events.JobEvent;
import com.adforge.core.events.JobEventPublisher;
import com.adforge.core.fanout.BatchOutcome;
import com.adforge.core.fanout.BoundedFanOut;
import com.adforge.core.fanout.PartialFailurePolicy;
import com.adforge.core.fanout.WorkItem;
import com.adforge.core.guard.ExternalCallGuard;
import com.adforge.core.job.JobHandler;
import com.adforge.core.job.JobRecord;
import com.adforge.core.job.JobResult;
import com.adforge.core.metrics.TaskCoreMetrics;
import com.adforge.core.provider.RemoteItem;
import com.adforge.core.provider.RemoteProviderAdapter;
import com.adforge.core.resume.ItemOperation;
import com.adforge.core.resume.ResumableItemProcessor;
import com.adforge.core.store.CompletionMarker;
import com.adforge.core.store.ItemRecord;
import com.adforge.core.store.ItemStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;

/**
 * Runs one configured item-batch pipeline (transcription, quality gate, ...).
 * <p>
 * Job payload: {@code {batchId, datasetId?, forceReprocess?, partialFailure?}}. When a dataset
 * is given its items are fetched and registered first; registration never touches existing
 * items, so completed work survives a re-fetch. Items then run through the resumable processor
 * inside a bounded fan-out.
 */
public class ItemBatchJobHandler implements JobHandler {

    private static final Logger log = LoggerFactory.getLogger(ItemBatchJobHandler.class);

    private final String type;
    private final TaskCoreProperties.Pipeline settings;
    private final TaskCoreProperties.Fanout fanoutDefaults;
    private final ItemStore store;
    private final RemoteProviderAdapter adapter;
    private final ExternalCallGuard guard;
    private final BoundedFanOut fanOut;
    private final ConfigGuard configGuard;
    private final JobEventPublisher events;
    private final TaskCoreMetrics metrics;
    private final ItemOperation operation;
    private final CompletionMarker marker;

    public ItemBatchJobHandler(String type, TaskCoreProperties.Pipeline settings, TaskCoreProperties.Fanout fanoutDefaults,
                               ItemStore store, RemoteProviderAdapter adapter, ExternalCallGuard guard,
                               BoundedFanOut fanOut, ConfigGuard configGuard, JobEventPublisher events,
                               TaskCoreMetrics metrics, ItemOperation operation) {
        if (settings.getBreakerKey() == null || settings.getBreakerKey().isBlank()) {
            throw new ConfigException("Pipeline '" + type + "' needs a breaker-key");
        }
        this.type = type;
        this.settings = settings;
        this.fanoutDefaults = fanoutDefaults;
        this.store = store;
        this.adapter = adapter;
        this.guard = guard;
        this.fanOut = fanOut;
        this.configGuard = configGuard;
        this.events = events;
        this.metrics = metrics;
        this.operation = operation;
        this.marker = new CompletionMarker(settings.getCompletionKind(), settings.getCompletionField());
    }

    @Override
    public String type() {
        return type;
    }

    @Override
    public JobResult handle(JobRecord job) throws Exception {
        configGuard.requireEnv(settings.getRequiredEnv(), type);

        String batchId = JobPayloads.requireText(job.payload(), "batchId", job.id());
        boolean force = JobPayloads.flag(job.payload(), "forceReprocess");
        PartialFailurePolicy policy = policy(job);

        String datasetId = JobPayloads.text(job.payload(), "datasetId");
        if (datasetId != null) {
            registerDataset(batchId, datasetId);
        }

        List<WorkItem<ItemRecord>> items = store.listByBatch(batchId).stream()
                .map(record -> new WorkItem<>(record.id(), record, marker.isPresent(record)))
                .toList();
        if (items.isEmpty()) {
            log.warn("{}: batch {} has no items", type, batchId);
        }

        var processor = new ResumableItemProcessor(store, marker,
                new ItemEvents(events, metrics, job.id(), type, JobEvent.ITEM_SUCCEEDED));
        BatchOutcome outcome = fanOut.runBounded(type, items, concurrency(), processor.asWorker(force, operation),
                policy, events.progressListener(job.id()));
        log.info("{}: {}", type, outcome.summary());
        return new JobResult(outcome.summary());
    }

    private int registerDataset(String batchId, String datasetId) {
        List<RemoteItem> remote = guard.call(settings.getBreakerKey(), adapter.name() + " dataset " + datasetId,
                token -> adapter.fetchBatch(datasetId, token));
        int created = 0;
        for (RemoteItem item : remote) {
            if (store.register(batchId, item.id(), item.payload())) {
                created++;
            }
        }
        log.info("{}: dataset {} returned {} item(s), {} new", type, datasetId, remote.size(), created);
        return created;
    }

    private PartialFailurePolicy policy(JobRecord job) {
        String requested = JobPayloads.text(job.payload(), "partialFailure");
        if (requested != null) {
            try {
                return PartialFailurePolicy.valueOf(requested.toUpperCase(Locale.ROOT).replace('-', '_'));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Job " + job.id() + ": unknown partialFailure '" + requested + "'", e);
            }
        }
        return settings.getPartialFailure() != null ? settings.getPartialFailure() : fanoutDefaults.getPartialFailure();
    }

    private int concurrency() {
        return settings.getConcurrency() != null ? settings.getConcurrency() : fanoutDefaults.getConcurrency();
    }
}
