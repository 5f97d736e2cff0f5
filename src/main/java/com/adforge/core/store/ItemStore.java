package com.adforge.core.store;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;
import java.util.Optional;

/**
 * Durable per-item state. Every outcome is written immediately, one item at a time, so a crash
 * mid-batch loses at most the items still in flight.
 */
public interface ItemStore {

    Optional<ItemRecord> load(String itemId);

    /**
     * Persists one outcome. A success merges the patch into the payload and stamps
     * {@code completedAt}; a failure records the error and leaves payload and markers untouched.
     *
     * @throws IllegalArgumentException if the item is unknown
     */
    ItemRecord save(String itemId, ItemOutcome outcome);

    /**
     * Adds an item to a batch if it does not exist yet. Existing items are left as they are,
     * so re-registering never clears a completion marker.
     *
     * @return true if the item was created
     */
    boolean register(String batchId, String itemId, ObjectNode payload);

    /** Items of a batch in registration order. */
    List<ItemRecord> listByBatch(String batchId);
}
