package com.priceplatform.price.provider;

import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Bulk price source. Implementations fail only on transport-level problems;
 * symbols the upstream does not know are simply missing from the returned map.
 */
public interface PriceSourceAdapter {

    /** Origin tag written alongside every price this adapter produced. */
    String sourceTag();

    /**
     * @param symbols caller identifiers, exactly as they should appear as keys in the result
     * @return price per caller identifier, only for symbols with a positive numeric price
     */
    Mono<Map<String, BigDecimal>> fetchMany(List<String> symbols);
}
