package com.priceplatform.common.policy;

import java.time.Duration;
import java.time.Instant;

/**
 * Stateless freshness classification for cached prices.
 *
 * <pre>
 *   age &lt; 1h        → FRESH    served directly, no fetch
 *   1h ≤ age &lt; 24h  → STALE    served only after a fresh fetch failed
 *   age ≥ 24h        → EXPIRED  never served
 * </pre>
 *
 * <p>A {@code lastUpdated} in the future (clock skew between writers) counts as age zero.
 */
public final class CachePolicy {

    public static final Duration FRESH_WINDOW = Duration.ofHours(1);
    public static final Duration STALE_WINDOW = Duration.ofHours(24);

    private CachePolicy() {}

    public static FreshnessTier classify(Duration age) {
        if (age == null || age.isNegative()) return FreshnessTier.FRESH;
        if (age.compareTo(FRESH_WINDOW) < 0)  return FreshnessTier.FRESH;
        if (age.compareTo(STALE_WINDOW) < 0)  return FreshnessTier.STALE;
        return FreshnessTier.EXPIRED;
    }

    public static FreshnessTier classify(Instant lastUpdated, Instant now) {
        return classify(Duration.between(lastUpdated, now));
    }

    public static boolean isFresh(Instant lastUpdated, Instant now) {
        return classify(lastUpdated, now) == FreshnessTier.FRESH;
    }

    /** True for entries that may be served as a degraded answer (anything not expired). */
    public static boolean isServableAsFallback(Instant lastUpdated, Instant now) {
        return classify(lastUpdated, now) != FreshnessTier.EXPIRED;
    }
}
