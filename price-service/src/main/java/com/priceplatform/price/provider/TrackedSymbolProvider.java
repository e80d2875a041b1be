package com.priceplatform.price.provider;

import reactor.core.publisher.Flux;

/**
 * Supplies the symbols held by investments. Refreshes that do not name their
 * symbols explicitly cover this set.
 */
public interface TrackedSymbolProvider {
    Flux<String> trackedSymbols();
}
