package com.priceplatform.price.dto;

import java.math.BigDecimal;
import java.time.Instant;

public record PricePoint(
    String symbol,
    BigDecimal price,
    String source,
    Instant timestamp
) {}
