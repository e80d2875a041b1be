package com.priceplatform.price.client;

import com.priceplatform.common.exception.SourceUnavailableException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class AmfiNavClientTest {

    private static final String FEED = String.join("\n",
        "Scheme Code;ISIN Div Payout/ ISIN Growth;ISIN Div Reinvestment;Scheme Name;Net Asset Value;Date",
        "Open Ended Schemes(Equity Scheme - Flexi Cap Fund)",
        "120503;INF179K01BB8;INF179K01BC6;HDFC Flexi Cap Fund - Direct Plan - Growth;1789.33;14-Mar-2024");

    private final AtomicInteger calls = new AtomicInteger();

    private AmfiNavClient clientAnswering(HttpStatus status, String body) {
        WebClient webClient = WebClient.builder()
            .exchangeFunction(request -> {
                calls.incrementAndGet();
                return Mono.just(ClientResponse.create(status)
                    .header(HttpHeaders.CONTENT_TYPE, MediaType.TEXT_PLAIN_VALUE)
                    .body(body)
                    .build());
            })
            .build();
        return new AmfiNavClient(webClient, "http://amfi.test/NAVAll.txt");
    }

    @Test
    @DisplayName("parses the downloaded feed for the requested schemes")
    void fetchesNavs() {
        StepVerifier.create(clientAnswering(HttpStatus.OK, FEED).fetchNavs(List.of("120503", "999999")))
            .assertNext(navs -> {
                assertThat(navs).containsOnlyKeys("120503");
                assertThat(navs.get("120503").nav()).isEqualByComparingTo("1789.33");
            })
            .verifyComplete();
    }

    @Test
    @DisplayName("HTTP failure → SourceUnavailableException")
    void httpFailure() {
        StepVerifier.create(clientAnswering(HttpStatus.BAD_GATEWAY, "").fetchNavs(List.of("120503")))
            .expectErrorSatisfies(e -> {
                assertThat(e).isInstanceOf(SourceUnavailableException.class);
                assertThat(e.getMessage()).isEqualTo("NAV feed returned HTTP 502");
            })
            .verify();
    }

    @Test
    @DisplayName("no identifiers → no download")
    void noIdentifiers() {
        StepVerifier.create(clientAnswering(HttpStatus.OK, FEED).fetchNavs(List.of()))
            .assertNext(navs -> assertThat(navs).isEmpty())
            .verifyComplete();
        assertThat(calls).hasValue(0);
    }
}
