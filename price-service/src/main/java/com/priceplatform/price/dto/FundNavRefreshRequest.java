package com.priceplatform.price.dto;

import java.util.List;

/** Scheme codes or ISINs to refresh from the AMFI feed. */
public record FundNavRefreshRequest(List<String> schemeCodes) {}
