package com.adforge.core.fanout;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class BoundedFanOutTest {

    private final BoundedFanOut fanOut = new BoundedFanOut();

    private static List<WorkItem<Integer>> items(int count) {
        return IntStream.rangeClosed(1, count)
                .mapToObj(i -> WorkItem.of("item-" + i, i))
                .toList();
    }

    /** Fails items 3 and 9, records peak concurrency. */
    private static ItemWorker<Integer> worker(AtomicInteger inFlight, AtomicInteger peak, List<String> processed) {
        return item -> {
            int now = inFlight.incrementAndGet();
            peak.accumulateAndGet(now, Math::max);
            try {
                Thread.sleep(20);
                processed.add(item.id());
                if (item.payload() == 3 || item.payload() == 9) {
                    throw new IllegalStateException("transcription failed for " + item.id());
                }
                return ItemDisposition.SUCCEEDED;
            } finally {
                inFlight.decrementAndGet();
            }
        };
    }

    @Nested
    @DisplayName("aggregate-and-throw")
    class AggregateAndThrow {

        @Test
        @DisplayName("processes every item, never exceeds K in flight and reports both failures")
        void aggregatesFailures() {
            AtomicInteger inFlight = new AtomicInteger();
            AtomicInteger peak = new AtomicInteger();
            List<String> processed = new CopyOnWriteArrayList<>();

            var error = assertThrows(BatchFailedException.class, () -> fanOut.runBounded("ad-transcripts",
                    items(12), 5, worker(inFlight, peak, processed),
                    PartialFailurePolicy.AGGREGATE_AND_THROW, ProgressListener.NONE));

            assertEquals(12, processed.size());
            assertTrue(peak.get() <= 5, "peak " + peak.get());
            assertTrue(peak.get() > 1, "work should overlap");

            BatchOutcome outcome = error.outcome();
            assertEquals(12, outcome.total());
            assertEquals(10, outcome.succeededCount());
            assertEquals(List.of("item-3", "item-9"),
                    outcome.failures().stream().map(ItemFailure::itemId).toList());
            assertTrue(error.getMessage().startsWith("ad-transcripts failed for 2/12 items (first item-3:"));
        }
    }

    @Nested
    @DisplayName("best-effort")
    class BestEffort {

        @Test
        @DisplayName("returns the outcome with counts instead of throwing")
        void returnsOutcome() {
            var outcome = fanOut.runBounded("quality-gate", items(12), 5,
                    worker(new AtomicInteger(), new AtomicInteger(), new CopyOnWriteArrayList<>()),
                    PartialFailurePolicy.BEST_EFFORT, ProgressListener.NONE);

            assertTrue(outcome.hasFailures());
            assertEquals(12, outcome.processedCount());
            assertTrue(outcome.summary().startsWith("10/12 items completed, 2 failed (first item-3:"));
        }

        @Test
        @DisplayName("skipped items count as completed but not processed")
        void skippedItems() {
            ItemWorker<Integer> worker = item -> item.payload() % 2 == 0
                    ? ItemDisposition.SKIPPED : ItemDisposition.SUCCEEDED;

            var outcome = fanOut.runBounded("batch", items(4), 2, worker,
                    PartialFailurePolicy.BEST_EFFORT, ProgressListener.NONE);

            assertEquals(2, outcome.skippedCount());
            assertEquals(2, outcome.processedCount());
            assertEquals("4/4 items completed (2 already done)", outcome.summary());
        }
    }

    @Test
    @DisplayName("progress reaches total once every item settled")
    void reportsProgress() {
        List<Integer> settled = new CopyOnWriteArrayList<>();

        fanOut.runBounded("batch", items(6), 3, item -> ItemDisposition.SUCCEEDED,
                PartialFailurePolicy.AGGREGATE_AND_THROW, (done, total) -> settled.add(done));

        var sorted = new ArrayList<>(settled);
        sorted.sort(Integer::compareTo);
        assertEquals(List.of(1, 2, 3, 4, 5, 6), sorted);
    }

    @Test
    @DisplayName("an empty batch completes immediately")
    void emptyBatch() {
        var outcome = fanOut.runBounded(List.<WorkItem<Integer>>of(), 5, item -> ItemDisposition.SUCCEEDED);
        assertEquals(0, outcome.total());
        assertFalse(outcome.hasFailures());
    }

    @Test
    @DisplayName("concurrency below one is rejected")
    void rejectsZeroConcurrency() {
        assertThrows(IllegalArgumentException.class,
                () -> fanOut.runBounded(items(1), 0, item -> ItemDisposition.SUCCEEDED));
    }
}
