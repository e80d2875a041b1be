package com.priceplatform.price.provider;

import com.priceplatform.price.model.PriceCacheEntry;
import com.priceplatform.price.store.PriceStore;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

import java.util.List;

/**
 * Default tracked set: symbols listed under {@code pricing.tracked-symbols} plus every
 * symbol already present in the price cache. An investment service that owns the
 * real holdings replaces this bean.
 */
@Component
public class ConfiguredTrackedSymbolProvider implements TrackedSymbolProvider {

    private final PriceStore   store;
    private final List<String> configured;

    public ConfiguredTrackedSymbolProvider(PriceStore store,
                                           @Value("${pricing.tracked-symbols:}") List<String> configured) {
        this.store      = store;
        this.configured = configured == null ? List.of() : List.copyOf(configured);
    }

    @Override
    public Flux<String> trackedSymbols() {
        return Flux.concat(
                Flux.fromIterable(configured),
                store.listAll().map(PriceCacheEntry::getSymbol))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .distinct();
    }
}
