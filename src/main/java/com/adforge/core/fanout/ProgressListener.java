package com.adforge.core.fanout;

@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = (settled, total) -> {};

    void onProgress(int settled, int total);
}
