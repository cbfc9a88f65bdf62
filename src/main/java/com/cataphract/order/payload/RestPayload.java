package com.cataphract.order.payload;

import com.fasterxml.jackson.annotation.JsonProperty;

public record RestPayload(
        @JsonProperty("duration_days")
        Integer durationDays
) implements OrderPayload {

    public RestPayload {
        durationDays = durationDays != null ? durationDays : 1;
    }
}
