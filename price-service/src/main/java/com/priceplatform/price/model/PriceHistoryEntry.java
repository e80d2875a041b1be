package com.priceplatform.price.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Append-only record of one successful fetch, stored in {@code price_history}.
 */
@Data
@NoArgsConstructor
@Table("price_history")
public class PriceHistoryEntry {

    @Id
    private Long id;

    private String     symbol;
    private BigDecimal price;
    private String     source;

    @Column("recorded_at")
    private LocalDateTime timestamp;
}
