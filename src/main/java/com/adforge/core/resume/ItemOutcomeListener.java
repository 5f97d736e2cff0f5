package com.adforge.core.resume;

/**
 * Notified once per item after its outcome has been persisted.
 */
public interface ItemOutcomeListener {

    ItemOutcomeListener NONE = new ItemOutcomeListener() {};

    default void onSkipped(String itemId) {}

    default void onSucceeded(String itemId) {}

    default void onFailed(String itemId, Exception error) {}
}
