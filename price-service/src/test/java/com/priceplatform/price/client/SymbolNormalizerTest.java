package com.priceplatform.price.client;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SymbolNormalizerTest {

    private final SymbolNormalizer normalizer = new SymbolNormalizer("nse:");

    @Test
    @DisplayName("bare ticker gets the default exchange prefix, upper-cased")
    void bareTicker() {
        assertEquals("NSE:RELIANCE", normalizer.toUpstream(" reliance "));
    }

    @Test
    @DisplayName("namespaced identifier is only upper-cased")
    void namespaced() {
        assertEquals("BSE:500325", normalizer.toUpstream("bse:500325"));
    }

    @Test
    @DisplayName("grouping keeps first-seen order and collects aliases")
    void grouping() {
        Map<String, List<String>> grouped = normalizer.groupByUpstream(List.of("TCS", "infy", "INFY"));
        assertEquals(List.of("NSE:TCS", "NSE:INFY"), List.copyOf(grouped.keySet()));
        assertEquals(List.of("infy", "INFY"), grouped.get("NSE:INFY"));
    }

    @Test
    @DisplayName("numeric identifiers are fund scheme codes")
    void fundCodes() {
        assertTrue(SymbolNormalizer.isFundSchemeCode("120503"));
        assertTrue(SymbolNormalizer.isFundSchemeCode(" 120503 "));
        assertFalse(SymbolNormalizer.isFundSchemeCode("RELIANCE"));
        assertFalse(SymbolNormalizer.isFundSchemeCode("NSE:120503"));
        assertFalse(SymbolNormalizer.isFundSchemeCode(null));
    }
}
