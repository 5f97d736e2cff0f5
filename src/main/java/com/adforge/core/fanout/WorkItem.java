package com.adforge.core.fanout;

import java.util.Objects;

/**
 * One independent unit of batch work.
 *
 * @param id            stable item id, used for persistence and failure reporting
 * @param payload       caller-owned item data
 * @param alreadyDone   derived from the item's durable completion marker when it was loaded
 */
public record WorkItem<T>(String id, T payload, boolean alreadyDone) {

    public WorkItem {
        Objects.requireNonNull(id, "id");
    }

    public static <T> WorkItem<T> of(String id, T payload) {
        return new WorkItem<>(id, payload, false);
    }
}
