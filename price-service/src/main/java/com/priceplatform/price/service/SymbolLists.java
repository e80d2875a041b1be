package com.priceplatform.price.service;

import com.priceplatform.common.exception.RefreshValidationException;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

final class SymbolLists {

    static final int MAX_SYMBOLS = 50;

    private SymbolLists() {}

    /**
     * Trims and de-duplicates {@code symbols}, keeping first-seen order.
     *
     * @throws RefreshValidationException on a missing or empty list, blank entries,
     *                                    or more than {@link #MAX_SYMBOLS} entries
     */
    static List<String> requireSymbols(List<String> symbols, String field) {
        if (symbols == null || symbols.isEmpty()) {
            throw new RefreshValidationException(field + " must contain at least one entry");
        }
        if (symbols.size() > MAX_SYMBOLS) {
            throw new RefreshValidationException(field + " must contain at most " + MAX_SYMBOLS + " entries");
        }
        Set<String> unique = new LinkedHashSet<>();
        for (String s : symbols) {
            if (s == null || s.isBlank()) {
                throw new RefreshValidationException(field + " must not contain blank entries");
            }
            unique.add(s.trim());
        }
        return new ArrayList<>(unique);
    }
}
