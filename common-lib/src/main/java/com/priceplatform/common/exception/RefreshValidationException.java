package com.priceplatform.common.exception;

/** Malformed caller input, rejected before any network activity. */
public class RefreshValidationException extends PricingException {

    public RefreshValidationException(String message) {
        super("validation", message);
    }
}
