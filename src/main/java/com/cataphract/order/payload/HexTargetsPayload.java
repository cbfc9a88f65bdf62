package com.cataphract.order.payload;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Target hexes of a forage or torch order. Null entries are dropped.
 */
public record HexTargetsPayload(
        @JsonProperty("hex_ids")
        List<Integer> hexIds,

        @JsonProperty("weather")
        String weather
) implements OrderPayload {

    public HexTargetsPayload {
        hexIds = hexIds == null ? List.of() : hexIds.stream().filter(Objects::nonNull).toList();
        weather = weather != null ? weather : "clear";
    }
}
