package com.cataphract.order.payload;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Either references an existing operation or describes a new one.
 */
public record LaunchOperationPayload(
        @JsonProperty("operation_id")
        Integer operationId,

        @JsonProperty("operation_type")
        String operationType,

        @JsonProperty("target_descriptor")
        Map<String, Object> targetDescriptor,

        @JsonProperty("territory_type")
        String territoryType,

        @JsonProperty("difficulty_modifier")
        Integer difficultyModifier,

        @JsonProperty("loot_cost")
        Integer lootCost,

        @JsonProperty("complexity")
        String complexity
) implements OrderPayload {

    public LaunchOperationPayload {
        targetDescriptor = targetDescriptor != null ? new LinkedHashMap<>(targetDescriptor) : new LinkedHashMap<>();
        territoryType = territoryType != null ? territoryType : "friendly";
        difficultyModifier = difficultyModifier != null ? difficultyModifier : 0;
        complexity = complexity != null ? complexity : "standard";
    }
}
