package com.cataphract.dto;

import com.cataphract.model.DayPart;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * DTO for submitting an order. Parameters keep their snake_case keys and
 * are only interpreted when the order executes.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OrderRequest {

    @NotBlank(message = "Order type is required")
    private String orderType;

    @NotNull(message = "Commander id is required")
    private Integer commanderId;

    private Integer armyId;

    private Map<String, Object> parameters;

    @PositiveOrZero(message = "Execute day must not be negative")
    private Integer executeDay;

    private DayPart executePart;

    private Integer priority;

    public Map<String, Object> getParameters() {
        return parameters != null ? new LinkedHashMap<>(parameters) : new LinkedHashMap<>();
    }

    public int getPriority() {
        return priority != null ? priority : 0;
    }
}
