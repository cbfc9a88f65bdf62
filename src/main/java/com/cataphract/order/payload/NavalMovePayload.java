package com.cataphract.order.payload;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import java.util.List;

public record NavalMovePayload(
        @JsonProperty("ship_id")
        @NotNull(message = "naval move requires ship_id")
        Integer shipId,

        @JsonProperty("route")
        @NotEmpty(message = "naval move requires route")
        List<@NotNull(message = "invalid hex id in route") Integer> route
) implements OrderPayload {
}
