package com.cataphract.order.payload;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;

public record SupplyTransferPayload(
        @JsonProperty("target_army_id")
        @NotNull(message = "supply transfer requires target_army_id and amount")
        Integer targetArmyId,

        @JsonProperty("amount")
        @NotNull(message = "supply transfer requires target_army_id and amount")
        Integer amount
) implements OrderPayload {
}
