package com.priceplatform.price.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.priceplatform.common.exception.SourceUnavailableException;
import com.priceplatform.common.model.PriceSource;
import com.priceplatform.price.provider.PriceSourceAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Client for the unified bulk quote service: one POST carries equities and fund
 * scheme codes together and answers with a flat {@code upstreamSymbol → price} object.
 */
public class UnifiedQuoteClient implements PriceSourceAdapter {

    private static final Logger log = LoggerFactory.getLogger(UnifiedQuoteClient.class);

    static final String SOURCE = PriceSource.GOOGLE_SCRIPT.name();

    private final WebClient        webClient;
    private final ObjectMapper     objectMapper;
    private final SymbolNormalizer normalizer;
    private final String           quoteUrl;
    private final String           authToken;

    public UnifiedQuoteClient(WebClient quoteWebClient, ObjectMapper objectMapper,
                              SymbolNormalizer normalizer, String quoteUrl, String authToken) {
        this.webClient    = quoteWebClient;
        this.objectMapper = objectMapper;
        this.normalizer   = normalizer;
        this.quoteUrl     = quoteUrl;
        this.authToken    = authToken;
    }

    @Override
    public String sourceTag() {
        return SOURCE;
    }

    @Override
    public Mono<Map<String, BigDecimal>> fetchMany(List<String> symbols) {
        if (symbols == null || symbols.isEmpty()) return Mono.just(Map.of());

        Map<String, List<String>> byUpstream = normalizer.groupByUpstream(symbols);
        log.info("QUOTE_FETCH symbols={} upstreamKeys={}", symbols.size(), byUpstream.size());

        return webClient.post()
            .uri(quoteUrl)
            .contentType(MediaType.APPLICATION_JSON)
            .header("authorization", authToken)
            .bodyValue(Map.of("symbols", List.copyOf(byUpstream.keySet())))
            .retrieve()
            .bodyToMono(String.class)
            .switchIfEmpty(Mono.error(() ->
                new SourceUnavailableException(SOURCE, "Empty response from quote service")))
            .map(json -> toPrices(json, byUpstream))
            .onErrorMap(e -> !(e instanceof SourceUnavailableException),
                        e -> new SourceUnavailableException(SOURCE, describe(e), e))
            .doOnSuccess(prices -> log.info("QUOTE_FETCHED requested={} priced={}",
                                            symbols.size(), prices.size()))
            .doOnError(e -> log.error("QUOTE_FETCH_FAILED symbols={} err={}", symbols.size(), e.getMessage()));
    }

    private Map<String, BigDecimal> toPrices(String json, Map<String, List<String>> byUpstream) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new SourceUnavailableException(SOURCE, "Unparsable response from quote service", e);
        }
        if (root == null || !root.isObject()) {
            throw new SourceUnavailableException(SOURCE, "Unexpected response shape from quote service");
        }

        Map<String, JsonNode> byKey = new HashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> f = fields.next();
            byKey.putIfAbsent(f.getKey().trim().toUpperCase(Locale.ROOT), f.getValue());
        }

        Map<String, BigDecimal> prices = new LinkedHashMap<>();
        byUpstream.forEach((upstream, originals) -> {
            JsonNode value = byKey.get(upstream);
            if (value == null || !value.isNumber()) return;
            BigDecimal price = value.decimalValue();
            if (price.signum() <= 0) return;
            originals.forEach(original -> prices.put(original, price));
        });
        return prices;
    }

    private static String describe(Throwable e) {
        if (e instanceof WebClientResponseException w) {
            return "Quote service returned HTTP " + w.getStatusCode().value();
        }
        return "Quote service unavailable: " + e.getMessage();
    }
}
