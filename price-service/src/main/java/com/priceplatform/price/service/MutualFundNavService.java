package com.priceplatform.price.service;

import com.priceplatform.common.exception.RefreshValidationException;
import com.priceplatform.common.exception.SourceUnavailableException;
import com.priceplatform.common.model.PriceSource;
import com.priceplatform.common.model.RefreshResult;
import com.priceplatform.common.model.SymbolRefreshOutcome;
import com.priceplatform.price.client.AmfiNavClient;
import com.priceplatform.price.client.FundNav;
import com.priceplatform.price.engine.PriceRecorder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Refreshes mutual fund NAVs straight from the AMFI feed, for funds the bulk quote
 * service does not cover. Prices land in the same cache under source {@code AMFI}.
 */
@Service
public class MutualFundNavService {

    private static final Logger log = LoggerFactory.getLogger(MutualFundNavService.class);

    static final String NAV_NOT_AVAILABLE = "NAV not available";

    private final AmfiNavClient client;
    private final PriceRecorder recorder;
    private final Clock         clock;

    public MutualFundNavService(AmfiNavClient client, PriceRecorder recorder, Clock clock) {
        this.client   = client;
        this.recorder = recorder;
        this.clock    = clock;
    }

    /**
     * @param identifiers scheme codes or ISINs, 1..50
     */
    public Mono<RefreshResult> refreshNavs(List<String> identifiers) {
        List<String> ids;
        try {
            ids = SymbolLists.requireSymbols(identifiers, "schemeCodes");
        } catch (RefreshValidationException e) {
            return Mono.error(e);
        }
        long started = clock.millis();
        String source = PriceSource.AMFI.name();

        return client.fetchNavs(ids)
            .flatMap(navs -> Flux.fromIterable(ids)
                .concatMap(id -> {
                    FundNav nav = navs.get(id);
                    return nav == null
                        ? Mono.just(SymbolRefreshOutcome.failed(id, NAV_NOT_AVAILABLE, clock.instant()))
                        : recorder.record(id, nav.nav(), source);
                })
                .collectList())
            .onErrorResume(SourceUnavailableException.class, e -> Mono.just(failAll(ids, e.getMessage())))
            .map(outcomes -> RefreshResult.of(outcomes, clock.millis() - started))
            .doOnSuccess(r -> log.info("NAV_REFRESH_DONE requested={} success={} failed={}",
                                       ids.size(), r.success(), r.failed()));
    }

    private List<SymbolRefreshOutcome> failAll(List<String> ids, String error) {
        Instant now = clock.instant();
        return ids.stream()
            .map(id -> SymbolRefreshOutcome.failed(id, error, now))
            .collect(Collectors.toList());
    }
}
