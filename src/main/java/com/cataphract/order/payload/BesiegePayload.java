package com.cataphract.order.payload;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;

public record BesiegePayload(
        @JsonProperty("stronghold_id")
        @NotNull(message = "besiege order missing stronghold_id")
        Integer strongholdId,

        @JsonProperty("siege_engines")
        Integer siegeEngines
) implements OrderPayload {

    public BesiegePayload {
        siegeEngines = siegeEngines != null ? siegeEngines : 0;
    }
}
