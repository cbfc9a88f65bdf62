package com.cataphract.model;

import java.util.List;

/**
 * Detail and events recorded on an order once it has been resolved.
 */
public record OrderResult(String detail, List<OrderEvent> events) {

    public OrderResult {
        events = events == null ? List.of() : List.copyOf(events);
    }
}
