package com.priceplatform.price.store;

import com.priceplatform.common.exception.PersistenceException;
import com.priceplatform.common.policy.CachePolicy;
import com.priceplatform.price.dto.HistoryStats;
import com.priceplatform.price.model.PriceCacheEntry;
import com.priceplatform.price.model.PriceHistoryEntry;
import com.priceplatform.price.repository.PriceCacheRepository;
import com.priceplatform.price.repository.PriceHistoryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;

/**
 * Durable keyed price cache plus its append-only history.
 *
 * <p>Cache writes are uncoordinated: concurrent refreshes of the same symbol
 * leave whichever write landed last. Timestamps are stored as UTC
 * {@link LocalDateTime}; callers exchange {@link Instant}s.
 */
@Component
public class PriceStore {

    private static final Logger log = LoggerFactory.getLogger(PriceStore.class);

    private final PriceCacheRepository   cacheRepository;
    private final PriceHistoryRepository historyRepository;
    private final Clock                  clock;

    public PriceStore(PriceCacheRepository cacheRepository,
                      PriceHistoryRepository historyRepository,
                      Clock clock) {
        this.cacheRepository   = cacheRepository;
        this.historyRepository = historyRepository;
        this.clock             = clock;
    }

    // ── cache ──────────────────────────────────────────────────────────────

    public Mono<PriceCacheEntry> get(String symbol) {
        return cacheRepository.findBySymbol(symbol);
    }

    /**
     * Creates or overwrites the entry for {@code symbol} with {@code lastUpdated = now}.
     *
     * <p>UPDATE first; INSERT when no row matched; if a concurrent writer inserted
     * the same symbol in between, the unique constraint rejects the INSERT and the
     * UPDATE is replayed.
     */
    public Mono<PriceCacheEntry> upsert(String symbol, BigDecimal price, String source) {
        LocalDateTime now = LocalDateTime.now(clock);
        return cacheRepository.updatePrice(symbol, price, source, now)
            .flatMap(rows -> rows > 0
                ? cacheRepository.findBySymbol(symbol)
                : insert(symbol, price, source, now))
            .doOnSuccess(e -> log.debug("CACHE_WRITE symbol={} price={} source={}", symbol, price, source))
            .onErrorMap(e -> !(e instanceof PersistenceException),
                        e -> new PersistenceException(e.getMessage(), e));
    }

    private Mono<PriceCacheEntry> insert(String symbol, BigDecimal price, String source, LocalDateTime now) {
        PriceCacheEntry entry = new PriceCacheEntry();
        entry.setSymbol(symbol);
        entry.setPrice(price);
        entry.setSource(source);
        entry.setLastUpdated(now);
        return cacheRepository.save(entry)
            .onErrorResume(DataIntegrityViolationException.class, e -> {
                log.debug("CACHE_INSERT_RACE symbol={} retrying as update", symbol);
                return cacheRepository.updatePrice(symbol, price, source, now)
                    .then(cacheRepository.findBySymbol(symbol));
            });
    }

    /**
     * Cache entries among {@code symbols} that are still fresh. Read failures yield an
     * empty map so callers fall through to an upstream fetch.
     */
    public Mono<Map<String, PriceCacheEntry>> freshEntries(Collection<String> symbols) {
        Instant now = clock.instant();
        return Flux.fromIterable(symbols)
            .concatMap(this::get)
            .filter(e -> CachePolicy.isFresh(toInstant(e.getLastUpdated()), now))
            .collectMap(PriceCacheEntry::getSymbol)
            .onErrorResume(e -> {
                log.warn("CACHE_READ_FAILED symbols={} err={}", symbols.size(), e.getMessage());
                return Mono.just(Map.of());
            });
    }

    public Flux<PriceCacheEntry> listAll() {
        return cacheRepository.findAllByOrderBySymbolAsc();
    }

    public Mono<Long> deleteAll() {
        return cacheRepository.deleteEverything()
            .map(Integer::longValue)
            .doOnSuccess(n -> log.info("CACHE_CLEARED entries={}", n));
    }

    public Mono<Long> deleteWhere(Collection<String> symbols) {
        if (symbols == null || symbols.isEmpty()) return Mono.just(0L);
        return cacheRepository.deleteBySymbols(symbols)
            .map(Integer::longValue)
            .doOnSuccess(n -> log.info("CACHE_ENTRIES_DELETED requested={} deleted={}", symbols.size(), n));
    }

    // ── history ────────────────────────────────────────────────────────────

    /**
     * Appends one history row. Never errors: a failed write is logged and dropped
     * because the cache entry, not the history, is the source of truth for reads.
     */
    public Mono<Void> appendHistory(String symbol, BigDecimal price, String source, Instant timestamp) {
        PriceHistoryEntry entry = new PriceHistoryEntry();
        entry.setSymbol(symbol);
        entry.setPrice(price);
        entry.setSource(source);
        entry.setTimestamp(LocalDateTime.ofInstant(timestamp, ZoneOffset.UTC));
        return historyRepository.save(entry)
            .then()
            .onErrorResume(e -> {
                log.warn("HISTORY_WRITE_FAILED symbol={} err={}", symbol, e.getMessage());
                return Mono.empty();
            });
    }

    public Mono<PriceHistoryEntry> latestHistory(String symbol) {
        return historyRepository.findFirstBySymbolOrderByTimestampDesc(symbol);
    }

    /** History rows for {@code symbol} in {@code [from, to]}, newest first, at most {@code limit}. */
    public Flux<PriceHistoryEntry> history(String symbol, Instant from, Instant to, int limit) {
        return historyRepository.findRange(symbol,
            LocalDateTime.ofInstant(from, ZoneOffset.UTC),
            LocalDateTime.ofInstant(to, ZoneOffset.UTC),
            limit);
    }

    public Mono<HistoryStats> historyStats() {
        return Mono.zip(
                historyRepository.count(),
                historyRepository.countDistinctSymbols().defaultIfEmpty(0L),
                timestampOf(historyRepository.findFirstByOrderByTimestampAsc()),
                timestampOf(historyRepository.findFirstByOrderByTimestampDesc()))
            .map(t -> new HistoryStats(t.getT1(), t.getT2(),
                                       t.getT3().orElse(null), t.getT4().orElse(null)));
    }

    private static Mono<Optional<LocalDateTime>> timestampOf(Mono<PriceHistoryEntry> row) {
        return row.map(e -> Optional.of(e.getTimestamp())).defaultIfEmpty(Optional.empty());
    }

    public Mono<Long> purgeHistoryBefore(Instant cutoff) {
        return historyRepository.deleteOlderThan(LocalDateTime.ofInstant(cutoff, ZoneOffset.UTC))
            .map(Integer::longValue)
            .doOnSuccess(n -> log.info("HISTORY_PURGED cutoff={} deleted={}", cutoff, n));
    }

    public static Instant toInstant(LocalDateTime utc) {
        return utc.toInstant(ZoneOffset.UTC);
    }
}
