package com.priceplatform.price.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.priceplatform.common.exception.SourceUnavailableException;
import com.priceplatform.common.model.PriceSource;
import com.priceplatform.price.client.AmfiNavClient;
import com.priceplatform.price.client.SymbolNormalizer;
import com.priceplatform.price.client.UnifiedQuoteClient;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

@Configuration
public class WebClientConfig {

    private static final int NAV_FEED_MAX_BYTES = 16 * 1024 * 1024;

    // ── bulk quote service ────────────────────────────────────────────────────
    @Value("${pricing.quote.url:}")
    private String quoteUrl;

    @Value("${pricing.quote.auth-token:}")
    private String quoteAuthToken;

    @Value("${pricing.quote.default-exchange:NSE}")
    private String defaultExchange;

    @Value("${pricing.quote.connect-timeout-ms:10000}")
    private int connectTimeoutMs;

    @Value("${pricing.quote.response-timeout-seconds:15}")
    private int responseTimeoutSeconds;

    // ── AMFI NAV feed ─────────────────────────────────────────────────────────
    @Value("${pricing.amfi.url:https://www.amfiindia.com/spages/NAVAll.txt}")
    private String amfiUrl;

    @Bean
    public WebClient quoteWebClient(WebClient.Builder builder) {
        return builder.clone()
            .clientConnector(new ReactorClientHttpConnector(httpClient()))
            .filter(serverErrorFilter(PriceSource.GOOGLE_SCRIPT.name()))
            .filter(loggingFilter())
            .build();
    }

    @Bean
    public WebClient amfiWebClient(WebClient.Builder builder) {
        return builder.clone()
            .clientConnector(new ReactorClientHttpConnector(httpClient()))
            .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(NAV_FEED_MAX_BYTES))
            .filter(serverErrorFilter(PriceSource.AMFI.name()))
            .filter(loggingFilter())
            .build();
    }

    @Bean
    public SymbolNormalizer symbolNormalizer() {
        return new SymbolNormalizer(defaultExchange);
    }

    @Bean
    public UnifiedQuoteClient unifiedQuoteClient(WebClient quoteWebClient, ObjectMapper objectMapper,
                                                 SymbolNormalizer symbolNormalizer) {
        return new UnifiedQuoteClient(quoteWebClient, objectMapper, symbolNormalizer, quoteUrl, quoteAuthToken);
    }

    @Bean
    public AmfiNavClient amfiNavClient(WebClient amfiWebClient) {
        return new AmfiNavClient(amfiWebClient, amfiUrl);
    }

    private HttpClient httpClient() {
        return HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeoutMs)
            .responseTimeout(Duration.ofSeconds(responseTimeoutSeconds))
            .doOnConnected(conn ->
                conn.addHandlerLast(new ReadTimeoutHandler(responseTimeoutSeconds, TimeUnit.SECONDS))
            );
    }

    private ExchangeFilterFunction serverErrorFilter(String source) {
        return ExchangeFilterFunction.ofResponseProcessor(clientResponse -> {
            if (clientResponse.statusCode().is5xxServerError()) {
                return clientResponse.releaseBody()
                    .then(Mono.<ClientResponse>error(new SourceUnavailableException(source,
                        source + " server error: HTTP " + clientResponse.statusCode().value())));
            }
            return Mono.just(clientResponse);
        });
    }

    private ExchangeFilterFunction loggingFilter() {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            String sanitized = clientRequest.url().toString().replaceAll("(?i)(token|key)=[^&]+", "$1=***");
            LoggerFactory.getLogger(WebClientConfig.class)
                .debug("Outbound request: {} {}", clientRequest.method(), sanitized);
            return Mono.just(clientRequest);
        });
    }
}
