package com.adforge.core.store;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Process-local {@link ItemStore}. State is lost on restart; used when no DataSource is configured.
 */
public class InMemoryItemStore implements ItemStore {

    private final Map<String, ItemRecord> items = new LinkedHashMap<>();
    private final Clock clock;

    public InMemoryItemStore() {
        this(Clock.systemUTC());
    }

    public InMemoryItemStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized Optional<ItemRecord> load(String itemId) {
        return Optional.ofNullable(items.get(itemId)).map(InMemoryItemStore::copy);
    }

    @Override
    public synchronized ItemRecord save(String itemId, ItemOutcome outcome) {
        ItemRecord current = items.get(itemId);
        if (current == null) {
            throw new IllegalArgumentException("Unknown item " + itemId);
        }
        Instant now = clock.instant();
        ItemRecord next;
        if (outcome.succeeded()) {
            ObjectNode merged = current.payload().deepCopy();
            merged.setAll(outcome.patch().deepCopy());
            next = new ItemRecord(itemId, current.batchId(), merged, now, null, now);
        } else {
            next = new ItemRecord(itemId, current.batchId(), current.payload(), current.completedAt(),
                    outcome.error(), now);
        }
        items.put(itemId, next);
        return copy(next);
    }

    @Override
    public synchronized boolean register(String batchId, String itemId, ObjectNode payload) {
        if (items.containsKey(itemId)) {
            return false;
        }
        ObjectNode stored = payload != null ? payload.deepCopy() : JsonNodeFactory.instance.objectNode();
        items.put(itemId, new ItemRecord(itemId, batchId, stored, null, null, clock.instant()));
        return true;
    }

    @Override
    public synchronized List<ItemRecord> listByBatch(String batchId) {
        return items.values().stream()
                .filter(record -> batchId.equals(record.batchId()))
                .map(InMemoryItemStore::copy)
                .toList();
    }

    private static ItemRecord copy(ItemRecord record) {
        return new ItemRecord(record.id(), record.batchId(), record.payload().deepCopy(),
                record.completedAt(), record.lastError(), record.updatedAt());
    }
}
