package com.priceplatform.price.dto;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * @param status          {@code healthy} when {@code issues} is empty, otherwise {@code unhealthy}
 * @param refreshesByState tracked refresh runs per state wire name
 */
public record RefreshHealthReport(
    String status,
    boolean schedulerRunning,
    boolean databaseReachable,
    long cachedPrices,
    long freshPrices,
    String lastRequestId,
    Map<String, Long> refreshesByState,
    List<String> issues,
    Instant checkedAt
) {

    public boolean healthy() {
        return issues.isEmpty();
    }
}
