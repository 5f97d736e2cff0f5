package com.adforge.core.error;

/**
 * Failure of one work item. Collected by the fan-out, never propagated to sibling items.
 */
public class ItemProcessingException extends TaskCoreException {

    private final String itemId;

    public ItemProcessingException(String itemId, Throwable cause) {
        super(ErrorKind.ITEM_PROCESSING, "Item " + itemId + " failed: " + ErrorSummaries.message(cause), cause);
        this.itemId = itemId;
    }

    public String itemId() {
        return itemId;
    }
}
