package com.adforge.core.resume;

import com.adforge.core.error.ErrorSummaries;
import com.adforge.core.fanout.ItemDisposition;
import com.adforge.core.fanout.ItemWorker;
import com.adforge.core.fanout.WorkItem;
import com.adforge.core.logging.MdcContext;
import com.adforge.core.store.CompletionMarker;
import com.adforge.core.store.ItemOutcome;
import com.adforge.core.store.ItemRecord;
import com.adforge.core.store.ItemStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Makes item processing idempotent and crash-safe.
 * <p>
 * The "already done" test reads the item's durable completion marker from the {@link ItemStore}
 * right before the work would start, never an in-memory set, so reruns after a restart skip
 * finished items. Each outcome is saved as soon as it is known. A failure is recorded without
 * clearing an existing marker, even when reprocessing was forced.
 */
public class ResumableItemProcessor {

    private static final Logger log = LoggerFactory.getLogger(ResumableItemProcessor.class);

    private final ItemStore store;
    private final CompletionMarker marker;
    private final ItemOutcomeListener listener;

    public ResumableItemProcessor(ItemStore store, CompletionMarker marker, ItemOutcomeListener listener) {
        this.store = store;
        this.marker = marker;
        this.listener = listener != null ? listener : ItemOutcomeListener.NONE;
    }

    public ResumableItemProcessor(ItemStore store, CompletionMarker marker) {
        this(store, marker, ItemOutcomeListener.NONE);
    }

    /**
     * Processes one item unless it is already complete.
     *
     * @param itemId         item to process
     * @param forceReprocess run the operation even when the completion marker is present
     * @param operation      the remote work; its result is merged into the stored payload
     * @return {@link ItemDisposition#SKIPPED} or {@link ItemDisposition#SUCCEEDED}
     * @throws Exception the operation's failure, after it has been recorded on the item
     */
    public ItemDisposition process(String itemId, boolean forceReprocess, ItemOperation operation) throws Exception {
        MdcContext.setItem(MdcContext.currentJobId(), itemId);
        try {
            ItemRecord record = store.load(itemId)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown item " + itemId));

            if (marker.isPresent(record) && !forceReprocess) {
                log.debug("Item {} already complete; skipping", itemId);
                listener.onSkipped(itemId);
                return ItemDisposition.SKIPPED;
            }

            try {
                var patch = operation.apply(record);
                store.save(itemId, ItemOutcome.succeeded(patch));
            } catch (Exception e) {
                recordFailure(itemId, e);
                listener.onFailed(itemId, e);
                throw e;
            }
            listener.onSucceeded(itemId);
            return ItemDisposition.SUCCEEDED;
        } finally {
            MdcContext.clearItem();
        }
    }

    /**
     * Adapts this processor to a fan-out worker over items of the store.
     */
    public <T> ItemWorker<T> asWorker(boolean forceReprocess, ItemOperation operation) {
        return (WorkItem<T> item) -> process(item.id(), forceReprocess, operation);
    }

    private void recordFailure(String itemId, Exception error) {
        try {
            store.save(itemId, ItemOutcome.failed(ErrorSummaries.message(error)));
        } catch (RuntimeException saveError) {
            log.error("Could not record failure for item {}: {}", itemId, saveError.getMessage(), saveError);
            error.addSuppressed(saveError);
        }
    }
}
