package com.priceplatform.common.model;

import java.util.List;

/**
 * Caller-supplied options for a refresh run. Every field is optional; {@code null}
 * means "use the configured default". A {@code null} symbol list selects the tracked
 * symbol set, an empty list is rejected.
 */
public record RefreshOptions(
    List<String> symbols,
    Boolean forceRefresh,
    Integer batchSize,
    Long timeout,
    Boolean includeStocks,
    Boolean includeMutualFunds
) {

    public static RefreshOptions defaults() {
        return new RefreshOptions(null, null, null, null, null, null);
    }

    public static RefreshOptions forced(List<String> symbols) {
        return new RefreshOptions(symbols, Boolean.TRUE, null, null, null, null);
    }

    public boolean stocksIncluded() {
        return !Boolean.FALSE.equals(includeStocks);
    }

    public boolean mutualFundsIncluded() {
        return !Boolean.FALSE.equals(includeMutualFunds);
    }
}
