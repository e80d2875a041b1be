package com.priceplatform.price.dto;

import com.fasterxml.jackson.annotation.JsonValue;

import java.math.BigDecimal;

/**
 * Movement between the oldest and newest history points of a look-back window.
 * Price fields are {@code null} when the window has too few points to compare.
 */
public record PriceTrend(
    String symbol,
    int days,
    BigDecimal currentPrice,
    BigDecimal previousPrice,
    BigDecimal change,
    BigDecimal changePercent,
    Direction trend,
    int dataPoints
) {

    public enum Direction {
        UP, DOWN, STABLE, UNKNOWN;

        @JsonValue
        public String wireName() {
            return name().toLowerCase();
        }
    }

    public static PriceTrend unknown(String symbol, int days, BigDecimal current, int dataPoints) {
        return new PriceTrend(symbol, days, current, null, null, null, Direction.UNKNOWN, dataPoints);
    }
}
