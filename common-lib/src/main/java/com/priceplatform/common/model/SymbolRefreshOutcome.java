package com.priceplatform.common.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Per-symbol result of a refresh. {@code success=true} with a non-null {@code error}
 * means the price was obtained but the cache write failed.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SymbolRefreshOutcome(
    String symbol,
    boolean success,
    BigDecimal price,
    String source,
    String error,
    Instant timestamp
) {

    public static SymbolRefreshOutcome succeeded(String symbol, BigDecimal price, String source, Instant at) {
        return new SymbolRefreshOutcome(symbol, true, price, source, null, at);
    }

    public static SymbolRefreshOutcome succeededWithWarning(String symbol, BigDecimal price, String source,
                                                            String warning, Instant at) {
        return new SymbolRefreshOutcome(symbol, true, price, source, warning, at);
    }

    public static SymbolRefreshOutcome failed(String symbol, String error, Instant at) {
        return new SymbolRefreshOutcome(symbol, false, null, null, error, at);
    }
}
