package com.priceplatform.price.repository;

import com.priceplatform.price.model.PriceHistoryEntry;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

@Repository
public interface PriceHistoryRepository extends ReactiveCrudRepository<PriceHistoryEntry, Long> {

    Mono<PriceHistoryEntry> findFirstBySymbolOrderByTimestampDesc(String symbol);

    @Query("""
        SELECT * FROM price_history
        WHERE symbol = :symbol
          AND recorded_at >= :from
          AND recorded_at <= :to
        ORDER BY recorded_at DESC
        LIMIT :limit
        """)
    Flux<PriceHistoryEntry> findRange(String symbol, LocalDateTime from, LocalDateTime to, int limit);

    @Query("SELECT COUNT(DISTINCT symbol) FROM price_history")
    Mono<Long> countDistinctSymbols();

    Mono<PriceHistoryEntry> findFirstByOrderByTimestampAsc();

    Mono<PriceHistoryEntry> findFirstByOrderByTimestampDesc();

    @Modifying
    @Query("DELETE FROM price_history WHERE recorded_at < :cutoff")
    Mono<Integer> deleteOlderThan(LocalDateTime cutoff);
}
