package com.priceplatform.price.controller;

import com.priceplatform.common.model.PriceQuote;
import com.priceplatform.common.model.RefreshResult;
import com.priceplatform.price.dto.CacheStats;
import com.priceplatform.price.dto.FundNavRefreshRequest;
import com.priceplatform.price.dto.OrphanCleanupRequest;
import com.priceplatform.price.dto.PriceLookupResult;
import com.priceplatform.price.dto.PricePoint;
import com.priceplatform.price.dto.PriceTrend;
import com.priceplatform.price.dto.SymbolsRequest;
import com.priceplatform.price.service.MutualFundNavService;
import com.priceplatform.price.service.PriceLookupService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Price lookup and cache administration.
 *
 * <pre>
 *   GET    /api/v1/prices/{symbol}?forceRefresh=   single quote (404 when nothing servable)
 *   POST   /api/v1/prices/batch                    {symbols}, 1..50
 *   GET    /api/v1/prices/{symbol}/history         from, to (ISO instants), limit
 *   GET    /api/v1/prices/{symbol}/trend?days=     change over the window (default 30 days)
 *   GET    /api/v1/prices/cache/stats
 *   DELETE /api/v1/prices/cache
 *   POST   /api/v1/prices/cache/orphans            {trackedSymbols}
 *   POST   /api/v1/prices/mutual-funds/refresh     {schemeCodes}
 * </pre>
 */
@RestController
@RequestMapping("/api/v1/prices")
public class PriceController {

    private static final Logger log = LoggerFactory.getLogger(PriceController.class);

    private static final int DEFAULT_HISTORY_LIMIT = 100;

    private final PriceLookupService   lookupService;
    private final MutualFundNavService navService;
    private final Clock                clock;

    public PriceController(PriceLookupService lookupService, MutualFundNavService navService, Clock clock) {
        this.lookupService = lookupService;
        this.navService    = navService;
        this.clock         = clock;
    }

    @GetMapping("/{symbol}")
    public Mono<ResponseEntity<PriceQuote>> getPrice(@PathVariable String symbol,
                                                     @RequestParam(defaultValue = "false") boolean forceRefresh) {
        log.info("Price request received. symbol={} forceRefresh={}", symbol, forceRefresh);
        return lookupService.getPrice(symbol, forceRefresh)
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @PostMapping("/batch")
    public Mono<ResponseEntity<List<PriceLookupResult>>> batch(@RequestBody SymbolsRequest request) {
        return lookupService.batchGetPrices(request.symbols())
            .map(ResponseEntity::ok);
    }

    @GetMapping("/{symbol}/history")
    public Mono<ResponseEntity<List<PricePoint>>> history(@PathVariable String symbol,
                                                          @RequestParam(required = false) Instant from,
                                                          @RequestParam(required = false) Instant to,
                                                          @RequestParam(defaultValue = "" + DEFAULT_HISTORY_LIMIT) int limit) {
        Instant end   = to != null ? to : clock.instant();
        Instant start = from != null ? from : end.minus(Duration.ofDays(30));
        return lookupService.getPriceHistory(symbol, start, end, limit)
            .collectList()
            .map(ResponseEntity::ok);
    }

    @GetMapping("/{symbol}/trend")
    public Mono<ResponseEntity<PriceTrend>> trend(@PathVariable String symbol,
                                                  @RequestParam(defaultValue = "30") int days) {
        return lookupService.getPriceTrend(symbol, days).map(ResponseEntity::ok);
    }

    @GetMapping("/cache/stats")
    public Mono<ResponseEntity<CacheStats>> cacheStats() {
        return lookupService.getCacheStats().map(ResponseEntity::ok);
    }

    @DeleteMapping("/cache")
    public Mono<ResponseEntity<Map<String, Object>>> clearCache() {
        log.info("Cache clear requested");
        return lookupService.clearAllCaches()
            .map(n -> ResponseEntity.ok(Map.<String, Object>of("deleted", n)));
    }

    @PostMapping("/cache/orphans")
    public Mono<ResponseEntity<Map<String, Object>>> removeOrphans(@RequestBody OrphanCleanupRequest request) {
        return lookupService.removeOrphans(request.trackedSymbols())
            .map(n -> ResponseEntity.ok(Map.<String, Object>of("deleted", n)));
    }

    @PostMapping("/mutual-funds/refresh")
    public Mono<ResponseEntity<RefreshResult>> refreshNavs(@RequestBody FundNavRefreshRequest request) {
        log.info("NAV refresh requested. schemes={}", request.schemeCodes());
        return navService.refreshNavs(request.schemeCodes())
            .map(ResponseEntity::ok);
    }
}
