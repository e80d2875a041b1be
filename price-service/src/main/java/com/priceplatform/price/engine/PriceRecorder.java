package com.priceplatform.price.engine;

import com.priceplatform.common.model.SymbolRefreshOutcome;
import com.priceplatform.price.store.PriceStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Persists a freshly fetched price: cache upsert, then history append.
 *
 * <p>The price was obtained either way, so a failed cache write still yields a
 * successful outcome, carrying the failure as a warning. History writes never fail
 * the outcome.
 */
@Component
public class PriceRecorder {

    private static final Logger log = LoggerFactory.getLogger(PriceRecorder.class);

    static final String CACHE_WARNING_PREFIX = "Cache update failed: ";

    private final PriceStore store;
    private final Clock      clock;

    public PriceRecorder(PriceStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    public Mono<SymbolRefreshOutcome> record(String symbol, BigDecimal price, String source) {
        Instant at = clock.instant();
        Mono<Optional<String>> cacheWrite = store.upsert(symbol, price, source)
            .thenReturn(Optional.<String>empty())
            .onErrorResume(e -> {
                log.warn("CACHE_WRITE_FAILED symbol={} err={}", symbol, e.getMessage());
                return Mono.just(Optional.of(CACHE_WARNING_PREFIX + e.getMessage()));
            });

        return cacheWrite.flatMap(warning -> store.appendHistory(symbol, price, source, at)
            .thenReturn(warning
                .map(w -> SymbolRefreshOutcome.succeededWithWarning(symbol, price, source, w, at))
                .orElseGet(() -> SymbolRefreshOutcome.succeeded(symbol, price, source, at))));
    }
}
