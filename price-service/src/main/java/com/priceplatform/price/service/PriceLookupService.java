package com.priceplatform.price.service;

import com.priceplatform.common.exception.BatchTimeoutException;
import com.priceplatform.common.exception.RefreshValidationException;
import com.priceplatform.common.model.PriceQuote;
import com.priceplatform.common.model.PriceSource;
import com.priceplatform.common.policy.CachePolicy;
import com.priceplatform.common.policy.FreshnessTier;
import com.priceplatform.price.dto.CacheStats;
import com.priceplatform.price.dto.PriceLookupResult;
import com.priceplatform.price.dto.PricePoint;
import com.priceplatform.price.dto.PriceTrend;
import com.priceplatform.price.engine.BatchRefreshEngine;
import com.priceplatform.price.engine.PriceRecorder;
import com.priceplatform.price.engine.RefreshEngineSettings;
import com.priceplatform.price.model.PriceCacheEntry;
import com.priceplatform.price.model.PriceHistoryEntry;
import com.priceplatform.price.provider.PriceSourceAdapter;
import com.priceplatform.price.scheduler.PriceRefreshScheduler;
import com.priceplatform.price.store.PriceStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Read path for consumers that need a price now.
 *
 * <p><strong>Flow:</strong>
 * <ol>
 *   <li>Fresh cache entry (under 1h) → returned as-is, no upstream call.</li>
 *   <li>Otherwise fetch from the bulk source (with retry); success → cache + history,
 *       returned as a fresh quote.</li>
 *   <li>Fetch failed or symbol unknown upstream → stale cache entry (under 24h) tagged
 *       {@code _STALE}; else the latest history row under 24h tagged {@code _HISTORY};
 *       else no price.</li>
 * </ol>
 *
 * <p>Expired data is never served. A stale answer does not schedule a background
 * refresh; the next scheduled cycle covers it.
 */
@Service
public class PriceLookupService {

    private static final Logger log = LoggerFactory.getLogger(PriceLookupService.class);

    public static final int DEFAULT_HISTORY_RETENTION_DAYS = 365;

    /** History points considered by a trend, newest first. */
    static final int TREND_POINT_LIMIT = 100;

    /** Moves smaller than this percentage count as stable. */
    static final BigDecimal STABLE_BAND_PERCENT = new BigDecimal("0.1");

    private final PriceSourceAdapter    adapter;
    private final PriceRecorder         recorder;
    private final PriceStore            store;
    private final PriceRefreshScheduler scheduler;
    private final RefreshEngineSettings settings;
    private final Clock                 clock;

    public PriceLookupService(PriceSourceAdapter adapter, PriceRecorder recorder, PriceStore store,
                              PriceRefreshScheduler scheduler, RefreshEngineSettings settings, Clock clock) {
        this.adapter   = adapter;
        this.recorder  = recorder;
        this.store     = store;
        this.scheduler = scheduler;
        this.settings  = settings;
        this.clock     = clock;
    }

    // ── single lookup ─────────────────────────────────────────────────────────

    /**
     * @param forceRefresh bypass a fresh cache entry and go to the upstream first
     * @return the best available quote, or empty when nothing servable exists
     */
    public Mono<PriceQuote> getPrice(String symbol, boolean forceRefresh) {
        if (symbol == null || symbol.isBlank()) {
            return Mono.error(new RefreshValidationException("symbol must not be blank"));
        }
        String key = symbol.trim();

        return readCache(key).flatMap(cached -> {
            if (!forceRefresh && cached.isPresent() && tierOf(cached.get()) == FreshnessTier.FRESH) {
                PriceCacheEntry hit = cached.get();
                log.info("CACHE_HIT symbol={} source={} lastUpdated={}", key, hit.getSource(), hit.getLastUpdated());
                return Mono.just(toQuote(hit, hit.getSource(), false));
            }

            log.info("CACHE_MISS symbol={} forceRefresh={} cached={}", key, forceRefresh, cached.isPresent());
            return fetch(List.of(key))
                .flatMap(prices -> Mono.justOrEmpty(prices.get(key)))
                .flatMap(price -> recorder.record(key, price, adapter.sourceTag())
                    .map(outcome -> new PriceQuote(key, price, adapter.sourceTag(), outcome.timestamp(), false, false)))
                .onErrorResume(e -> {
                    log.warn("PRICE_FETCH_FAILED symbol={} err={}", key, e.getMessage());
                    return Mono.empty();
                })
                .switchIfEmpty(Mono.defer(() -> fallback(key, cached.orElse(null))));
        });
    }

    // ── batch lookup ──────────────────────────────────────────────────────────

    /**
     * Answers every requested symbol in request order. Fresh cache hits cost nothing;
     * all other symbols share one upstream call and fall back per symbol.
     */
    public Mono<List<PriceLookupResult>> batchGetPrices(List<String> symbols) {
        List<String> keys;
        try {
            keys = SymbolLists.requireSymbols(symbols, "symbols");
        } catch (RefreshValidationException e) {
            return Mono.error(e);
        }

        return Flux.fromIterable(keys)
            .concatMap(k -> readCache(k).map(c -> Map.entry(k, c)))
            .collectMap(Map.Entry::getKey, Map.Entry::getValue)
            .flatMap(cached -> {
                List<String> misses = keys.stream()
                    .filter(k -> cached.get(k).map(e -> tierOf(e) != FreshnessTier.FRESH).orElse(true))
                    .collect(Collectors.toList());
                log.info("BATCH_LOOKUP symbols={} cacheHits={} misses={}",
                         keys.size(), keys.size() - misses.size(), misses.size());

                Mono<BatchPrices> fetched = misses.isEmpty()
                    ? Mono.just(new BatchPrices(Map.of(), null))
                    : fetch(misses)
                        .map(prices -> new BatchPrices(prices, null))
                        .onErrorResume(e -> {
                            log.warn("BATCH_LOOKUP_FETCH_FAILED symbols={} err={}", misses.size(), e.getMessage());
                            return Mono.just(new BatchPrices(Map.of(), e.getMessage()));
                        });

                return fetched.flatMap(batch -> Flux.fromIterable(keys)
                    .concatMap(k -> resolve(k, cached.get(k).orElse(null), batch))
                    .collectList());
            });
    }

    private Mono<PriceLookupResult> resolve(String key, PriceCacheEntry cached, BatchPrices batch) {
        if (cached != null && tierOf(cached) == FreshnessTier.FRESH) {
            return Mono.just(PriceLookupResult.found(toQuote(cached, cached.getSource(), false)));
        }
        BigDecimal price = batch.prices().get(key);
        if (price != null) {
            return recorder.record(key, price, adapter.sourceTag())
                .map(o -> PriceLookupResult.found(
                    new PriceQuote(key, price, adapter.sourceTag(), o.timestamp(), false, false)));
        }
        String reason = batch.error() != null ? batch.error() : BatchRefreshEngine.PRICE_NOT_AVAILABLE;
        return fallback(key, cached)
            .map(PriceLookupResult::found)
            .defaultIfEmpty(PriceLookupResult.unavailable(key, reason));
    }

    // ── fallback chain ────────────────────────────────────────────────────────

    private Mono<PriceQuote> fallback(String key, PriceCacheEntry cached) {
        if (cached != null) {
            // FRESH here means a forced refresh failed
            if (tierOf(cached) != FreshnessTier.EXPIRED) {
                log.info("STALE_SERVED symbol={} lastUpdated={}", key, cached.getLastUpdated());
                return Mono.just(toQuote(cached, PriceSource.staleTag(cached.getSource()), true));
            }
        }

        Instant now = clock.instant();
        return store.latestHistory(key)
            .onErrorResume(e -> {
                log.warn("HISTORY_READ_FAILED symbol={} err={}", key, e.getMessage());
                return Mono.empty();
            })
            .filter(h -> CachePolicy.isServableAsFallback(PriceStore.toInstant(h.getTimestamp()), now))
            .map(h -> new PriceQuote(key, h.getPrice(), PriceSource.historyTag(h.getSource()),
                                     PriceStore.toInstant(h.getTimestamp()), true, true))
            .doOnNext(q -> log.info("HISTORY_SERVED symbol={} recordedAt={}", key, q.lastUpdated()))
            .switchIfEmpty(Mono.<PriceQuote>fromRunnable(() -> log.warn("PRICE_UNAVAILABLE symbol={}", key)));
    }

    // ── cache administration ──────────────────────────────────────────────────

    public Mono<CacheStats> getCacheStats() {
        return Mono.zip(store.listAll().collectList(), store.historyStats())
            .map(t -> {
                List<PriceCacheEntry> entries = t.getT1();
                Instant now = clock.instant();
                Map<FreshnessTier, Long> tiers = entries.stream()
                    .collect(Collectors.groupingBy(
                        e -> CachePolicy.classify(PriceStore.toInstant(e.getLastUpdated()), now),
                        Collectors.counting()));
                Optional<Instant> oldest = entries.stream()
                    .map(e -> PriceStore.toInstant(e.getLastUpdated())).min(Instant::compareTo);
                Optional<Instant> newest = entries.stream()
                    .map(e -> PriceStore.toInstant(e.getLastUpdated())).max(Instant::compareTo);
                return new CacheStats(
                    entries.size(),
                    tiers.getOrDefault(FreshnessTier.FRESH, 0L),
                    tiers.getOrDefault(FreshnessTier.STALE, 0L),
                    tiers.getOrDefault(FreshnessTier.EXPIRED, 0L),
                    oldest.orElse(null),
                    newest.orElse(null),
                    t.getT2(),
                    scheduler.status());
            });
    }

    /** Deletes every cache entry. History is kept. */
    public Mono<Long> clearAllCaches() {
        return store.deleteAll();
    }

    /** Deletes cache entries whose symbol is not in {@code trackedSymbols}. */
    public Mono<Long> removeOrphans(Collection<String> trackedSymbols) {
        if (trackedSymbols == null) {
            return Mono.error(new RefreshValidationException("trackedSymbols must be provided"));
        }
        Set<String> tracked = new HashSet<>();
        trackedSymbols.stream().filter(s -> s != null && !s.isBlank()).forEach(s -> tracked.add(s.trim()));

        return store.listAll()
            .map(PriceCacheEntry::getSymbol)
            .filter(s -> !tracked.contains(s))
            .collectList()
            .flatMap(orphans -> {
                log.info("ORPHAN_CLEANUP tracked={} orphans={}", tracked.size(), orphans.size());
                return store.deleteWhere(orphans);
            });
    }

    public Mono<Long> cleanupHistory(int daysToKeep) {
        if (daysToKeep < 1) {
            return Mono.error(new RefreshValidationException("daysToKeep must be positive"));
        }
        return store.purgeHistoryBefore(clock.instant().minus(Duration.ofDays(daysToKeep)));
    }

    public Flux<PricePoint> getPriceHistory(String symbol, Instant from, Instant to, int limit) {
        if (symbol == null || symbol.isBlank()) {
            return Flux.error(new RefreshValidationException("symbol must not be blank"));
        }
        if (limit < 1 || from.isAfter(to)) {
            return Flux.error(new RefreshValidationException("invalid history range"));
        }
        return store.history(symbol.trim(), from, to, limit).map(this::toPoint);
    }

    /**
     * Compares the newest history point in the last {@code days} days with the oldest
     * of the newest {@value #TREND_POINT_LIMIT} points in that window.
     */
    public Mono<PriceTrend> getPriceTrend(String symbol, int days) {
        if (symbol == null || symbol.isBlank()) {
            return Mono.error(new RefreshValidationException("symbol must not be blank"));
        }
        if (days < 1) {
            return Mono.error(new RefreshValidationException("days must be positive"));
        }
        String key = symbol.trim();
        Instant to = clock.instant();

        return store.history(key, to.minus(Duration.ofDays(days)), to, TREND_POINT_LIMIT)
            .map(PriceHistoryEntry::getPrice)
            .collectList()
            .map(prices -> trendOf(key, days, prices));
    }

    private static PriceTrend trendOf(String symbol, int days, List<BigDecimal> newestFirst) {
        if (newestFirst.isEmpty()) {
            return PriceTrend.unknown(symbol, days, null, 0);
        }
        BigDecimal current = newestFirst.get(0);
        if (newestFirst.size() == 1) {
            return PriceTrend.unknown(symbol, days, current, 1);
        }
        BigDecimal previous = newestFirst.get(newestFirst.size() - 1);
        if (previous.signum() == 0) {
            return PriceTrend.unknown(symbol, days, current, newestFirst.size());
        }
        BigDecimal change = current.subtract(previous);
        BigDecimal percent = change.multiply(BigDecimal.valueOf(100))
            .divide(previous, 4, RoundingMode.HALF_UP);

        PriceTrend.Direction direction;
        if (percent.abs().compareTo(STABLE_BAND_PERCENT) < 0) {
            direction = PriceTrend.Direction.STABLE;
        } else {
            direction = change.signum() > 0 ? PriceTrend.Direction.UP : PriceTrend.Direction.DOWN;
        }
        return new PriceTrend(symbol, days, current, previous, change, percent, direction, newestFirst.size());
    }

    // ── helpers ───────────────────────────────────────────────────────────────

    private Mono<Map<String, BigDecimal>> fetch(List<String> symbols) {
        return Mono.defer(() -> adapter.fetchMany(symbols))
            .retryWhen(Retry.fixedDelay(settings.maxAttempts() - 1L, settings.retryDelay())
                .onRetryExhaustedThrow((retry, signal) -> signal.failure()))
            .timeout(settings.batchTimeout(), Mono.error(BatchTimeoutException::new))
            .defaultIfEmpty(Map.of());
    }

    private Mono<Optional<PriceCacheEntry>> readCache(String key) {
        return store.get(key)
            .map(Optional::of)
            .defaultIfEmpty(Optional.empty())
            .onErrorResume(e -> {
                log.warn("CACHE_READ_FAILED symbol={} err={}", key, e.getMessage());
                return Mono.just(Optional.empty());
            });
    }

    private FreshnessTier tierOf(PriceCacheEntry entry) {
        return CachePolicy.classify(PriceStore.toInstant(entry.getLastUpdated()), clock.instant());
    }

    private PriceQuote toQuote(PriceCacheEntry entry, String source, boolean fallbackUsed) {
        return new PriceQuote(entry.getSymbol(), entry.getPrice(), source,
                              PriceStore.toInstant(entry.getLastUpdated()), true, fallbackUsed);
    }

    private PricePoint toPoint(PriceHistoryEntry e) {
        return new PricePoint(e.getSymbol(), e.getPrice(), e.getSource(), PriceStore.toInstant(e.getTimestamp()));
    }

    private record BatchPrices(Map<String, BigDecimal> prices, String error) {}
}
