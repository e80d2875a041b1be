package com.priceplatform.price.dto;

import java.time.LocalDateTime;

public record HistoryStats(
    long totalRecords,
    long uniqueSymbols,
    LocalDateTime oldestRecord,
    LocalDateTime newestRecord
) {}
