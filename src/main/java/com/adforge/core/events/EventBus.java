package com.adforge.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Process-local delivery of {@link JobEvent}s.
 * <p>
 * {@code adforge run} prints one job through a per-job subscription; a global
 * subscription sees every job. Fan-out workers publish from pool threads, so both subscriber lists are
 * copy-on-write. Events carrying no job id reach global subscribers only.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<JobEvent>>> jobSubscribers =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<JobEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    public void publish(JobEvent event) {
        log.debug("Job {} event {}", event.jobId(), event.eventType());

        if (event.jobId() != null) {
            List<Consumer<JobEvent>> jobSubs = jobSubscribers.get(event.jobId());
            if (jobSubs != null) {
                for (Consumer<JobEvent> subscriber : jobSubs) {
                    deliverSafely(subscriber, event);
                }
            }
        }

        for (Consumer<JobEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Receives the events of one job until unsubscribed. The job's list is dropped once its
     * last subscriber leaves.
     */
    public Subscription subscribe(String jobId, Consumer<JobEvent> consumer) {
        jobSubscribers.computeIfAbsent(jobId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        log.debug("Following job {}", jobId);
        return () -> {
            CopyOnWriteArrayList<Consumer<JobEvent>> subs = jobSubscribers.get(jobId);
            if (subs != null) {
                subs.remove(consumer);
                if (subs.isEmpty()) {
                    jobSubscribers.remove(jobId, subs);
                }
            }
        };
    }

    public Subscription subscribeAll(Consumer<JobEvent> consumer) {
        globalSubscribers.add(consumer);
        log.debug("Listening to events of every job");
        return () -> globalSubscribers.remove(consumer);
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<JobEvent> subscriber, JobEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
