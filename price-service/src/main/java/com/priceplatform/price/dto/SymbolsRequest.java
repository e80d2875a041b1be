package com.priceplatform.price.dto;

import java.util.List;

/** Request body carrying a plain symbol list. */
public record SymbolsRequest(List<String> symbols) {}
