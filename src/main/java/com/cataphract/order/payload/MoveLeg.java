package com.cataphract.order.payload;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;

/**
 * One leg of a march. Legs are on-road by default.
 */
public record MoveLeg(
        @JsonProperty("to_hex_id")
        @NotNull(message = "movement leg missing to_hex_id")
        Integer toHexId,

        @JsonProperty("distance_miles")
        Double distanceMiles,

        @JsonProperty("on_road")
        Boolean onRoad,

        @JsonProperty("has_river_ford")
        Boolean hasRiverFord,

        @JsonProperty("is_night")
        Boolean isNight,

        @JsonProperty("has_fork")
        Boolean hasFork,

        @JsonProperty("alternate_hex_id")
        Integer alternateHexId
) {

    public MoveLeg {
        distanceMiles = distanceMiles != null ? distanceMiles : 0.0;
        onRoad = onRoad != null ? onRoad : Boolean.TRUE;
        hasRiverFord = Boolean.TRUE.equals(hasRiverFord);
        isNight = Boolean.TRUE.equals(isNight);
        hasFork = Boolean.TRUE.equals(hasFork);
    }
}
