package com.priceplatform.price.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Latest known price for one symbol, stored in {@code price_cache}.
 * At most one row per symbol; {@code lastUpdated} is UTC wall time.
 */
@Data
@NoArgsConstructor
@Table("price_cache")
public class PriceCacheEntry {

    @Id
    private Long id;

    private String        symbol;
    private BigDecimal    price;
    private String        source;
    private LocalDateTime lastUpdated;
}
