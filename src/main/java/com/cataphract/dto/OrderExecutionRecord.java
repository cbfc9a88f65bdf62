package com.cataphract.dto;

import com.cataphract.model.DayPart;
import com.cataphract.model.OrderEvent;
import com.cataphract.model.OrderStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * One order outcome as reported by a tick.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OrderExecutionRecord {
    private int orderId;
    private Integer armyId;
    private String orderType;
    private DayPart dayPart;
    private OrderStatus status;
    private String detail;
    @Builder.Default
    private List<OrderEvent> events = new ArrayList<>();
}
