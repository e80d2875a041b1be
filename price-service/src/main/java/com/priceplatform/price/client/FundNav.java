package com.priceplatform.price.client;

import java.math.BigDecimal;

/** One row of the AMFI NAV feed. */
public record FundNav(
    String schemeCode,
    String isinGrowth,
    String isinReinvestment,
    String schemeName,
    BigDecimal nav,
    String navDate
) {}
