package com.adforge.core.fanout;

import com.adforge.core.error.ErrorSummaries;
import com.adforge.core.error.ItemProcessingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a worker over independent items with at most K invocations in flight.
 * <p>
 * Each batch gets its own pool of {@code min(K, items)} threads, so a queued item starts as soon
 * as any running one settles. A failing item is recorded and never cancels its siblings. Once
 * every item has settled the {@link PartialFailurePolicy} decides whether failures are raised.
 * Completion order is not submission order.
 */
public class BoundedFanOut {

    private static final Logger log = LoggerFactory.getLogger(BoundedFanOut.class);

    public <T> BatchOutcome runBounded(List<WorkItem<T>> items, int concurrency, ItemWorker<T> worker) {
        return runBounded("batch", items, concurrency, worker, PartialFailurePolicy.AGGREGATE_AND_THROW,
                ProgressListener.NONE);
    }

    /**
     * @param label       names the batch in logs and in the aggregate error
     * @param items       items to process
     * @param concurrency maximum number of concurrent worker invocations, at least 1
     * @param worker      per-item work
     * @param policy      what to do when some items failed
     * @param progress    notified after each item settles
     * @throws BatchFailedException under {@link PartialFailurePolicy#AGGREGATE_AND_THROW} when any item failed
     */
    public <T> BatchOutcome runBounded(String label, List<WorkItem<T>> items, int concurrency,
                                       ItemWorker<T> worker, PartialFailurePolicy policy,
                                       ProgressListener progress) {
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be >= 1");
        }
        int total = items.size();
        if (total == 0) {
            return new BatchOutcome(0, 0, 0, 0, List.of());
        }

        int poolSize = Math.min(concurrency, total);
        log.info("{}: processing {} item(s) with concurrency {}", label, total, poolSize);

        AtomicInteger settled = new AtomicInteger();
        AtomicInteger succeeded = new AtomicInteger();
        AtomicInteger skipped = new AtomicInteger();
        ConcurrentLinkedQueue<IndexedFailure> failures = new ConcurrentLinkedQueue<>();
        Map<String, String> mdc = MDC.getCopyOfContextMap();

        ExecutorService executor = Executors.newFixedThreadPool(poolSize, runnable -> {
            Thread thread = new Thread(runnable, "adforge-fanout-" + label);
            thread.setDaemon(true);
            return thread;
        });
        try {
            List<CompletableFuture<Void>> futures = new ArrayList<>(total);
            for (int i = 0; i < total; i++) {
                int index = i;
                WorkItem<T> item = items.get(i);
                futures.add(CompletableFuture.runAsync(() -> {
                    if (mdc != null) {
                        MDC.setContextMap(mdc);
                    }
                    try {
                        ItemDisposition disposition = worker.process(item);
                        if (disposition == ItemDisposition.SKIPPED) {
                            skipped.incrementAndGet();
                        } else {
                            succeeded.incrementAndGet();
                        }
                    } catch (Exception e) {
                        if (e instanceof InterruptedException) {
                            Thread.currentThread().interrupt();
                        }
                        ItemProcessingException failure = e instanceof ItemProcessingException ipe
                                ? ipe : new ItemProcessingException(item.id(), e);
                        failures.add(new IndexedFailure(index, new ItemFailure(item.id(), failure)));
                        log.warn("{}: item {} failed: {}", label, item.id(), ErrorSummaries.message(e));
                    } finally {
                        progress.onProgress(settled.incrementAndGet(), total);
                        MDC.clear();
                    }
                }, executor));
            }
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get();
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
            throw new CancellationException(label + " interrupted after " + settled.get() + "/" + total + " items");
        } catch (ExecutionException e) {
            // item bodies catch Exception; only an Error can get here
            throw new IllegalStateException(label + " worker crashed", e.getCause());
        } finally {
            executor.shutdown();
        }

        List<ItemFailure> ordered = failures.stream()
                .sorted(Comparator.comparingInt(IndexedFailure::index))
                .map(IndexedFailure::failure)
                .toList();
        BatchOutcome outcome = new BatchOutcome(total, total - skipped.get(), succeeded.get(), skipped.get(), ordered);
        log.info("{}: {}", label, outcome.summary());

        if (outcome.hasFailures() && policy == PartialFailurePolicy.AGGREGATE_AND_THROW) {
            throw new BatchFailedException(label, outcome);
        }
        return outcome;
    }

    private record IndexedFailure(int index, ItemFailure failure) {}
}
