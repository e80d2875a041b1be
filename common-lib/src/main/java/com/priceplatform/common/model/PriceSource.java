package com.priceplatform.common.model;

/**
 * Origin tags written to the {@code source} column of cached and historical prices.
 *
 * <p>Degraded reads never rewrite the stored tag; they derive a display tag by
 * appending {@link #STALE_SUFFIX} or {@link #HISTORY_SUFFIX}.
 */
public enum PriceSource {
    /** Unified bulk quote service (equities and funds in one call). */
    GOOGLE_SCRIPT,
    /** Mutual fund NAV feed published by AMFI. */
    AMFI;

    public static final String STALE_SUFFIX   = "_STALE";
    public static final String HISTORY_SUFFIX = "_HISTORY";

    public static String staleTag(String source) {
        return source + STALE_SUFFIX;
    }

    public static String historyTag(String source) {
        return source + HISTORY_SUFFIX;
    }
}
