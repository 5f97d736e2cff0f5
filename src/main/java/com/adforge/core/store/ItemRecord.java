package com.adforge.core.store;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;

/**
 * Persisted state of one work item.
 *
 * @param id          item id
 * @param batchId     batch (dataset, storyboard, ...) the item belongs to
 * @param payload     item data; completion markers such as a transcript or quality-gate object live here
 * @param completedAt when the last successful outcome was saved, null if never
 * @param lastError   message of the last failed outcome, null after a success
 * @param updatedAt   last write
 */
public record ItemRecord(
        String id,
        String batchId,
        ObjectNode payload,
        Instant completedAt,
        String lastError,
        Instant updatedAt
) {}
