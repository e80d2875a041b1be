package com.priceplatform.common.model;

/**
 * Immutable progress snapshot. A refresh replaces its snapshot wholesale so that
 * readers never observe counts and percentage from different moments.
 */
public record RefreshProgress(
    int total,
    int completed,
    int failed,
    int percentage,
    String currentSymbol
) {

    public static RefreshProgress initial(int total) {
        return new RefreshProgress(total, 0, 0, 0, null);
    }

    public RefreshProgress withCurrentSymbol(String symbol) {
        return new RefreshProgress(total, completed, failed, percentage, symbol);
    }

    /**
     * @param succeeded symbols priced so far
     * @param failed    symbols failed so far; {@code completed} counts both
     */
    public RefreshProgress withCounts(int succeeded, int failed) {
        int done = succeeded + failed;
        int pct = total > 0 ? Math.round((float) done / total * 100) : 100;
        return new RefreshProgress(total, done, failed, pct, currentSymbol);
    }
}
