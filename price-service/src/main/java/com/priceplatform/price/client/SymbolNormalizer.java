package com.priceplatform.price.client;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Maps caller identifiers to the namespaced form the bulk quote service expects
 * ({@code RELIANCE → NSE:RELIANCE}, {@code BSE:500325} unchanged).
 */
public final class SymbolNormalizer {

    private static final Pattern FUND_SCHEME_CODE = Pattern.compile("\\d+");

    private final String exchange;

    public SymbolNormalizer(String defaultExchange) {
        String ex = defaultExchange.trim().toUpperCase(Locale.ROOT);
        this.exchange = ex.endsWith(":") ? ex.substring(0, ex.length() - 1) : ex;
    }

    public String toUpstream(String symbol) {
        String s = symbol.trim().toUpperCase(Locale.ROOT);
        return s.contains(":") ? s : exchange + ":" + s;
    }

    /**
     * Groups caller identifiers by upstream key, preserving first-seen order.
     * {@code "infy"} and {@code "INFY "} both land under {@code NSE:INFY}.
     */
    public Map<String, List<String>> groupByUpstream(Collection<String> symbols) {
        Map<String, List<String>> grouped = new LinkedHashMap<>();
        for (String symbol : symbols) {
            grouped.computeIfAbsent(toUpstream(symbol), k -> new ArrayList<>()).add(symbol);
        }
        return grouped;
    }

    /** Numeric identifiers are AMFI scheme codes; everything else is an exchange ticker. */
    public static boolean isFundSchemeCode(String symbol) {
        return symbol != null && FUND_SCHEME_CODE.matcher(symbol.trim()).matches();
    }
}
