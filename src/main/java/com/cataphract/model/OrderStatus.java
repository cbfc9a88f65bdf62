package com.cataphract.model;

/**
 * Order lifecycle: PENDING, EXECUTING, then one of the terminal statuses.
 */
public enum OrderStatus {
    PENDING,
    EXECUTING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
