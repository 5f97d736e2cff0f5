package com.adforge.core.resume;

import com.adforge.core.store.ItemRecord;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * The remote work for one item. Returns the fields to merge into the item's payload.
 */
@FunctionalInterface
public interface ItemOperation {

    ObjectNode apply(ItemRecord item) throws Exception;
}
