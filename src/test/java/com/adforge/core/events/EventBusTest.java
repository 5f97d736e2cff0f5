package com.adforge.core.events;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link EventBus}.
 */
class EventBusTest {

    private EventBus eventBus;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
    }

    private static JobEvent event(String type, String jobId) {
        return new JobEvent(type, jobId, null, Map.of(), Instant.now());
    }

    @Nested
    @DisplayName("Per-job subscriptions")
    class PerJob {

        @Test
        @DisplayName("receives only events for its job")
        void receivesOwnJob() {
            List<JobEvent> received = new CopyOnWriteArrayList<>();
            eventBus.subscribe("job-1", received::add);

            eventBus.publish(event(JobEvent.JOB_STARTED, "job-1"));
            eventBus.publish(event(JobEvent.JOB_STARTED, "job-2"));

            assertEquals(1, received.size());
            assertEquals("job-1", received.get(0).jobId());
        }

        @Test
        @DisplayName("unsubscribe stops delivery")
        void unsubscribe() {
            List<JobEvent> received = new CopyOnWriteArrayList<>();
            EventBus.Subscription subscription = eventBus.subscribe("job-1", received::add);

            subscription.unsubscribe();
            eventBus.publish(event(JobEvent.JOB_COMPLETED, "job-1"));

            assertTrue(received.isEmpty());
        }
    }

    @Nested
    @DisplayName("Global subscriptions")
    class Global {

        @Test
        @DisplayName("receive events with and without a job id")
        void receivesAll() {
            List<JobEvent> received = new CopyOnWriteArrayList<>();
            eventBus.subscribeAll(received::add);

            eventBus.publish(event(JobEvent.JOB_STARTED, "job-1"));
            eventBus.publish(event(JobEvent.BREAKER_OPENED, null));

            assertEquals(2, received.size());
        }

        @Test
        @DisplayName("a throwing subscriber does not stop the others")
        void throwingSubscriberIsolated() {
            List<JobEvent> received = new CopyOnWriteArrayList<>();
            eventBus.subscribeAll(e -> {
                throw new IllegalStateException("boom");
            });
            eventBus.subscribeAll(received::add);

            eventBus.publish(event(JobEvent.JOB_FAILED, "job-1"));

            assertEquals(1, received.size());
        }
    }

    @Test
    @DisplayName("concurrent publishers deliver every event")
    void concurrentPublish() throws Exception {
        int threads = 8;
        var latch = new CountDownLatch(threads);
        List<JobEvent> received = new CopyOnWriteArrayList<>();
        eventBus.subscribe("job-1", received::add);

        for (int i = 0; i < threads; i++) {
            new Thread(() -> {
                for (int j = 0; j < 25; j++) {
                    eventBus.publish(event(JobEvent.ITEM_SUCCEEDED, "job-1"));
                }
                latch.countDown();
            }).start();
        }

        assertTrue(latch.await(5, TimeUnit.SECONDS));
        assertEquals(threads * 25, received.size());
    }
}
