package com.priceplatform.common.model;

import java.util.List;

/**
 * Aggregate outcome of a batch or a full refresh run. Outcomes keep request order.
 */
public record RefreshResult(
    int success,
    int failed,
    long duration,
    List<SymbolRefreshOutcome> results
) {

    public RefreshResult {
        results = results == null ? List.of() : List.copyOf(results);
    }

    public static RefreshResult empty() {
        return new RefreshResult(0, 0, 0L, List.of());
    }

    public static RefreshResult of(List<SymbolRefreshOutcome> outcomes, long durationMs) {
        int ok = (int) outcomes.stream().filter(SymbolRefreshOutcome::success).count();
        return new RefreshResult(ok, outcomes.size() - ok, durationMs, outcomes);
    }

    public int total() {
        return success + failed;
    }
}
