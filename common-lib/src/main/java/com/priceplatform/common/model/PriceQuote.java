package com.priceplatform.common.model;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A price served to a consumer.
 *
 * @param source       stored origin tag, or a {@code _STALE} / {@code _HISTORY} derived tag
 * @param cached       served from the cache without contacting the upstream
 * @param fallbackUsed a fresh fetch was attempted and failed
 */
public record PriceQuote(
    String symbol,
    BigDecimal price,
    String source,
    Instant lastUpdated,
    boolean cached,
    boolean fallbackUsed
) {}
