package com.priceplatform.price.engine;

import java.time.Duration;

/**
 * Tuning knobs shared by the batch engine, the orchestrator and the lookup path.
 *
 * @param batchSize       symbols per upstream call unless a request overrides it
 * @param batchTimeout    bound on one batch's retried upstream call chain
 * @param interBatchDelay pause between consecutive batches of one run
 * @param maxAttempts     upstream attempts per batch, first call included
 * @param retryDelay      fixed pause between attempts
 * @param startDelay      gap between registering a run and starting it
 * @param pollInterval    status poll period for blocking callers
 * @param maxPollAttempts polls before a blocking caller gives up
 * @param statusRetention how long finished run statuses stay queryable
 */
public record RefreshEngineSettings(
    int batchSize,
    Duration batchTimeout,
    Duration interBatchDelay,
    int maxAttempts,
    Duration retryDelay,
    Duration startDelay,
    Duration pollInterval,
    int maxPollAttempts,
    Duration statusRetention
) {

    public static final int MAX_BATCH_SIZE = 50;

    public RefreshEngineSettings {
        if (batchSize < 1 || batchSize > MAX_BATCH_SIZE) {
            throw new IllegalArgumentException("batchSize must be within 1.." + MAX_BATCH_SIZE + ": " + batchSize);
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be positive: " + maxAttempts);
        }
    }

    public static RefreshEngineSettings defaults() {
        return new RefreshEngineSettings(
            10,
            Duration.ofSeconds(30),
            Duration.ofSeconds(1),
            3,
            Duration.ofSeconds(1),
            Duration.ofMillis(10),
            Duration.ofMillis(500),
            600,
            Duration.ofHours(1));
    }
}
