package com.cataphract.order;

/**
 * Raised when an order's parameters cannot be turned into its payload.
 * The dispatcher reports the message as the order's failure detail.
 */
public class OrderValidationException extends RuntimeException {

    public OrderValidationException(String message) {
        super(message);
    }

    public OrderValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
