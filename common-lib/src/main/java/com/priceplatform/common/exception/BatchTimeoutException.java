package com.priceplatform.common.exception;

public class BatchTimeoutException extends PricingException {

    public static final String MESSAGE = "Batch timeout";

    public BatchTimeoutException() {
        super("batch-refresh", MESSAGE);
    }
}
