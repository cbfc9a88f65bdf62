package com.cataphract.order;

import com.cataphract.model.OrderEvent;
import com.cataphract.model.OrderStatus;

import java.util.List;

/**
 * Status, detail and events produced by executing one order.
 */
public record OrderOutcome(OrderStatus status, String detail, List<OrderEvent> events) {

    public OrderOutcome {
        events = events == null ? List.of() : List.copyOf(events);
    }

    public static OrderOutcome completed(String detail) {
        return new OrderOutcome(OrderStatus.COMPLETED, detail, List.of());
    }

    public static OrderOutcome completed(String detail, List<OrderEvent> events) {
        return new OrderOutcome(OrderStatus.COMPLETED, detail, events);
    }

    public static OrderOutcome failed(String detail) {
        return new OrderOutcome(OrderStatus.FAILED, detail, List.of());
    }

    public static OrderOutcome executing(String detail, List<OrderEvent> events) {
        return new OrderOutcome(OrderStatus.EXECUTING, detail, events);
    }

    public boolean hasResult() {
        return (detail != null && !detail.isEmpty()) || !events.isEmpty();
    }
}
