package com.cataphract.order.payload;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import java.util.List;

public record HarryPayload(
        @JsonProperty("detachment_ids")
        @NotEmpty(message = "harry order requires detachment_ids")
        List<Integer> detachmentIds,

        @JsonProperty("target_army_id")
        @NotNull(message = "harry order requires target_army_id")
        Integer targetArmyId,

        @JsonProperty("objective")
        String objective
) implements OrderPayload {

    public HarryPayload {
        objective = objective != null ? objective.toLowerCase() : "kill";
    }
}
