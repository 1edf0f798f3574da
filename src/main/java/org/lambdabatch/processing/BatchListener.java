package org.lambdabatch.processing;

/**
 * One-way callbacks from the batch worker to the presentation layer. Invoked on the worker thread.
 */
public interface BatchListener {

    BatchListener NONE = new BatchListener() {
    };

    default void onProgress(int current, int total, String message) {
    }

    default void onSetComplete(SetStatistics statistics) {
    }

    /**
     * A whole file set was aborted. Per-image failures are reported through the statistics instead.
     */
    default void onError(String message) {
    }
}
