package com.cataphract.order.payload;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import java.util.List;

public record MovePayload(
        @JsonProperty("movement_type")
        String movementType,

        @JsonProperty("legs")
        @NotEmpty(message = "movement order missing legs")
        List<@NotNull(message = "movement leg must not be null") @Valid MoveLeg> legs,

        @JsonProperty("weather_modifier")
        Integer weatherModifier
) implements OrderPayload {

    public MovePayload {
        movementType = movementType != null ? movementType : "standard";
        weatherModifier = weatherModifier != null ? weatherModifier : 0;
    }
}
