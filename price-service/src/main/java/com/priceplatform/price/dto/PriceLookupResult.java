package com.priceplatform.price.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.priceplatform.common.model.PriceQuote;

import java.math.BigDecimal;
import java.time.Instant;

/** One entry of a batch lookup answer: either a quote or the reason there is none. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PriceLookupResult(
    String symbol,
    boolean success,
    BigDecimal price,
    String source,
    Instant lastUpdated,
    Boolean cached,
    Boolean fallbackUsed,
    String error
) {

    public static PriceLookupResult found(PriceQuote quote) {
        return new PriceLookupResult(quote.symbol(), true, quote.price(), quote.source(), quote.lastUpdated(),
                                     quote.cached(), quote.fallbackUsed(), null);
    }

    public static PriceLookupResult unavailable(String symbol, String error) {
        return new PriceLookupResult(symbol, false, null, null, null, null, null, error);
    }
}
