package com.adforge.pipeline;

import com.adforge.core.events.JobEventPublisher;
import com.adforge.core.metrics.TaskCoreMetrics;
import com.adforge.core.resume.ItemOutcomeListener;

/**
 * Item listener that publishes job events and counts outcomes for one pipeline.
 */
final class ItemEvents implements ItemOutcomeListener {

    private final ItemOutcomeListener events;
    private final TaskCoreMetrics metrics;
    private final String pipeline;

    ItemEvents(JobEventPublisher publisher, TaskCoreMetrics metrics, String jobId, String pipeline,
               String succeededEvent) {
        this.events = publisher.itemListener(jobId, succeededEvent);
        this.metrics = metrics;
        this.pipeline = pipeline;
    }

    @Override
    public void onSkipped(String itemId) {
        metrics.recordItemOutcome(pipeline, "skipped");
        events.onSkipped(itemId);
    }

    @Override
    public void onSucceeded(String itemId) {
        metrics.recordItemOutcome(pipeline, "succeeded");
        events.onSucceeded(itemId);
    }

    @Override
    public void onFailed(String itemId, Exception error) {
        metrics.recordItemOutcome(pipeline, "failed");
        events.onFailed(itemId, error);
    }
}
