package com.cataphract.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An order issued by a commander, optionally against one of its armies.
 * <p>
 * {@code orderType} keeps the persisted tag so that unknown tags survive
 * loading and fail at dispatch. {@code scheduledProjectId} carries the
 * recruitment project between the two phases of a {@code raise_army} order.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class Order {

    private int id;
    private Integer armyId;
    private int commanderId;
    private String orderType;

    @Builder.Default
    private Map<String, Object> parameters = new LinkedHashMap<>();

    private LocalDateTime issuedAt;
    private Integer executeDay;
    private DayPart executePart;
    private int priority;

    @Builder.Default
    private OrderStatus status = OrderStatus.PENDING;

    private OrderResult result;
    private Integer scheduledProjectId;

    /**
     * Detached copy for handing out of the campaign lock.
     */
    public Order copy() {
        return toBuilder()
                .parameters(parameters != null ? new LinkedHashMap<>(parameters) : null)
                .build();
    }
}
