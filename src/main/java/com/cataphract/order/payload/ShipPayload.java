package com.cataphract.order.payload;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Ship reference for embark and disembark orders.
 */
public record ShipPayload(
        @JsonProperty("ship_id")
        Integer shipId
) implements OrderPayload {
}
