package com.priceplatform.common.policy;

public enum FreshnessTier {
    FRESH,
    STALE,
    EXPIRED
}
