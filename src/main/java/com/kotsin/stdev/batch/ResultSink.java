package com.kotsin.stdev.batch;

import com.kotsin.stdev.model.StdevResult;

/**
 * Receives the results of a batch in emission order.
 */
public interface ResultSink {

    void accept(StdevResult result);

    /**
     * Called once after the last result and before state is persisted.
     * Throwing here fails the batch and leaves the previous state in place.
     */
    default void complete() {
    }
}
