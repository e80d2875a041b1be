package com.priceplatform.price.engine;

/**
 * Receives progress from a running batch refresh. Callbacks arrive sequentially
 * from whichever scheduler thread is driving the run.
 */
public interface RefreshProgressListener {

    RefreshProgressListener NONE = new RefreshProgressListener() {};

    /** Called before each symbol's outcome is resolved. */
    default void onSymbol(String symbol) {}

    /** Called after each batch with running totals for the whole run. */
    default void onBatchComplete(int succeeded, int failed) {}
}
