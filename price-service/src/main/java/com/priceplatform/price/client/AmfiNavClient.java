package com.priceplatform.price.client;

import com.priceplatform.common.exception.SourceUnavailableException;
import com.priceplatform.common.model.PriceSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.util.Collection;
import java.util.Map;

/**
 * Downloads the full AMFI NAV file and picks out the requested schemes.
 * The file is a few MB, so the backing {@link WebClient} needs a raised in-memory limit.
 */
public class AmfiNavClient {

    private static final Logger log = LoggerFactory.getLogger(AmfiNavClient.class);

    static final String SOURCE = PriceSource.AMFI.name();

    private final WebClient webClient;
    private final String    navUrl;

    public AmfiNavClient(WebClient amfiWebClient, String navUrl) {
        this.webClient = amfiWebClient;
        this.navUrl    = navUrl;
    }

    public Mono<Map<String, FundNav>> fetchNavs(Collection<String> identifiers) {
        if (identifiers == null || identifiers.isEmpty()) return Mono.just(Map.of());

        log.info("NAV_FETCH schemes={}", identifiers.size());
        return webClient.get()
            .uri(navUrl)
            .accept(MediaType.TEXT_PLAIN, MediaType.ALL)
            .retrieve()
            .bodyToMono(String.class)
            .switchIfEmpty(Mono.error(() -> new SourceUnavailableException(SOURCE, "Empty NAV feed")))
            .map(body -> AmfiNavParser.parse(body, identifiers))
            .onErrorMap(e -> !(e instanceof SourceUnavailableException),
                        e -> new SourceUnavailableException(SOURCE, describe(e), e))
            .doOnSuccess(navs -> log.info("NAV_FETCHED requested={} found={}", identifiers.size(), navs.size()))
            .doOnError(e -> log.error("NAV_FETCH_FAILED err={}", e.getMessage()));
    }

    private static String describe(Throwable e) {
        if (e instanceof WebClientResponseException w) {
            return "NAV feed returned HTTP " + w.getStatusCode().value();
        }
        return "NAV feed unavailable: " + e.getMessage();
    }
}
