package com.priceplatform.common.exception;

/**
 * Root of the pricing exception hierarchy. Carries the component that raised it;
 * the message is left untouched because it surfaces verbatim in refresh outcomes.
 */
public class PricingException extends RuntimeException {
    private final String component;

    public PricingException(String component, String message) {
        super(message);
        this.component = component;
    }

    public PricingException(String component, String message, Throwable cause) {
        super(message, cause);
        this.component = component;
    }

    public String getComponent() {
        return component;
    }
}
