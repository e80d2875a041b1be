package com.priceplatform.common.exception;

/** Price store write failed. */
public class PersistenceException extends PricingException {

    public PersistenceException(String message, Throwable cause) {
        super("price-store", message, cause);
    }
}
