package com.priceplatform.price.dto;

/**
 * @param refreshing    the last scheduled run is still pending or in progress
 * @param lastRequestId request id of the last run the scheduler started, null before the first
 */
public record SchedulerStatus(
    boolean running,
    boolean refreshing,
    long intervalMs,
    String lastRequestId
) {}
