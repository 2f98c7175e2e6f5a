package com.tvlradar.aggregation;

/**
 * Notified after each chunk of a dispatch completes. {@code completed} only grows within one dispatch.
 */
@FunctionalInterface
public interface ProgressObserver {

    ProgressObserver NOOP = (operation, completed, total) -> { };

    void onChunkCompleted(String operation, int completed, int total);
}
