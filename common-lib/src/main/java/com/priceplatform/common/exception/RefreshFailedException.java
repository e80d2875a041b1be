package com.priceplatform.common.exception;

/**
 * Raised to a caller waiting on a refresh that did not complete: the run failed,
 * was cancelled, disappeared, or outlived the caller's patience.
 */
public class RefreshFailedException extends PricingException {
    private final String requestId;

    public RefreshFailedException(String requestId, String message) {
        super("refresh-orchestrator", message);
        this.requestId = requestId;
    }

    public String getRequestId() {
        return requestId;
    }
}
