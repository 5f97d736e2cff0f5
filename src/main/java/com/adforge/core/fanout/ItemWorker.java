package com.adforge.core.fanout;

@FunctionalInterface
public interface ItemWorker<T> {

    ItemDisposition process(WorkItem<T> item) throws Exception;
}
