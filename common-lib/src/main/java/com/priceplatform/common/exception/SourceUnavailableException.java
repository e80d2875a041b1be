package com.priceplatform.common.exception;

/** Upstream price source failed at transport or HTTP level. */
public class SourceUnavailableException extends PricingException {

    public SourceUnavailableException(String source, String message) {
        super(source, message);
    }

    public SourceUnavailableException(String source, String message, Throwable cause) {
        super(source, message, cause);
    }
}
