package com.priceplatform.price.dto;

import java.time.Instant;

public record CacheStats(
    long totalEntries,
    long freshEntries,
    long staleEntries,
    long expiredEntries,
    Instant oldestEntry,
    Instant newestEntry,
    HistoryStats history,
    SchedulerStatus scheduler
) {}
