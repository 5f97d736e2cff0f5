package com.adforge.core.events;

import java.time.Instant;
import java.util.Map;

/**
 * An event emitted while a job runs, used for CLI output and progress tracking.
 *
 * @param eventType event type (e.g. "job.started", "item.failed", "breaker.opened")
 * @param jobId     the job this event belongs to (nullable for events raised outside a job)
 * @param itemId    the item or scene this event relates to (nullable for job-level events)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record JobEvent(
    String eventType,
    String jobId,
    String itemId,
    Map<String, Object> payload,
    Instant timestamp
) {

    public static final String JOB_STARTED = "job.started";
    public static final String JOB_PROGRESS = "job.progress";
    public static final String JOB_COMPLETED = "job.completed";
    public static final String JOB_FAILED = "job.failed";
    public static final String ITEM_SUCCEEDED = "item.succeeded";
    public static final String ITEM_FAILED = "item.failed";
    public static final String ITEM_SKIPPED = "item.skipped";
    public static final String SCENE_SUCCEEDED = "scene.succeeded";
    public static final String BREAKER_OPENED = "breaker.opened";
}
