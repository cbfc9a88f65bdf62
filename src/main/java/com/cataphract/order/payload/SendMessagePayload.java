package com.cataphract.order.payload;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;

public record SendMessagePayload(
        @JsonProperty("recipient_id")
        @NotNull(message = "send_message requires recipient_id")
        Integer recipientId,

        @JsonProperty("content")
        String content,

        @JsonProperty("territory_type")
        String territoryType
) implements OrderPayload {

    public SendMessagePayload {
        content = content != null ? content : "";
        territoryType = territoryType != null ? territoryType : "friendly";
    }
}
