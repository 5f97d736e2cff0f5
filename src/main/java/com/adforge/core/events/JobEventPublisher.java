package com.adforge.core.events;

import com.adforge.core.error.ErrorSummaries;
import com.adforge.core.fanout.ProgressListener;
import com.adforge.core.guard.GuardListener;
import com.adforge.core.logging.MdcContext;
import com.adforge.core.resume.ItemOutcomeListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Translates guard, item and progress callbacks into {@link JobEvent}s on the {@link EventBus}.
 * The job id is taken from the MDC of the calling thread.
 */
@Component
public class JobEventPublisher implements GuardListener {

    private final EventBus eventBus;
    private final Clock clock;

    public JobEventPublisher(EventBus eventBus, Clock clock) {
        this.eventBus = eventBus;
        this.clock = clock;
    }

    public void publish(String eventType, String jobId, String itemId, Map<String, Object> payload) {
        eventBus.publish(new JobEvent(eventType, jobId, itemId, payload, clock.instant()));
    }

    @Override
    public void onBreakerOpened(String breakerKey, Instant openedUntil) {
        publish(JobEvent.BREAKER_OPENED, MdcContext.currentJobId(), null,
                Map.of("breakerKey", breakerKey, "openedUntil", openedUntil.toString()));
    }

    /**
     * Item listener for one job. {@code succeededEvent} lets scene runs report
     * {@code scene.succeeded} instead of {@code item.succeeded}.
     */
    public ItemOutcomeListener itemListener(String jobId, String succeededEvent) {
        return new ItemOutcomeListener() {
            @Override
            public void onSkipped(String itemId) {
                publish(JobEvent.ITEM_SKIPPED, jobId, itemId, Map.of());
            }

            @Override
            public void onSucceeded(String itemId) {
                publish(succeededEvent, jobId, itemId, Map.of());
            }

            @Override
            public void onFailed(String itemId, Exception error) {
                publish(JobEvent.ITEM_FAILED, jobId, itemId, Map.of("error", ErrorSummaries.message(error)));
            }
        };
    }

    public ProgressListener progressListener(String jobId) {
        return (settled, total) -> {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("completed", settled);
            payload.put("total", total);
            payload.put("percent", total == 0 ? 100 : (settled * 100) / total);
            publish(JobEvent.JOB_PROGRESS, jobId, null, payload);
        };
    }
}
