package com.priceplatform.price.repository;

import com.priceplatform.price.model.PriceCacheEntry;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Collection;

@Repository
public interface PriceCacheRepository extends ReactiveCrudRepository<PriceCacheEntry, Long> {

    Mono<PriceCacheEntry> findBySymbol(String symbol);

    Flux<PriceCacheEntry> findAllByOrderBySymbolAsc();

    /**
     * Overwrites the row for {@code symbol} if one exists.
     *
     * @return number of rows touched (0 when the symbol is not cached yet)
     */
    @Modifying
    @Query("""
        UPDATE price_cache
        SET price = :price, source = :source, last_updated = :lastUpdated
        WHERE symbol = :symbol
        """)
    Mono<Integer> updatePrice(String symbol, BigDecimal price, String source, LocalDateTime lastUpdated);

    @Modifying
    @Query("DELETE FROM price_cache WHERE symbol IN (:symbols)")
    Mono<Integer> deleteBySymbols(Collection<String> symbols);

    @Modifying
    @Query("DELETE FROM price_cache")
    Mono<Integer> deleteEverything();
}
