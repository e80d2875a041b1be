package com.priceplatform.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle of one refresh operation.
 *
 * <pre>
 *   PENDING → IN_PROGRESS → { COMPLETED | FAILED | CANCELLED }
 * </pre>
 */
public enum RefreshState {
    PENDING("pending"),
    IN_PROGRESS("in-progress"),
    COMPLETED("completed"),
    FAILED("failed"),
    CANCELLED("cancelled");

    private final String wireName;

    RefreshState(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean isActive() {
        return this == PENDING || this == IN_PROGRESS;
    }

    public boolean isTerminal() {
        return !isActive();
    }
}
