package com.cataphract.order.payload;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;

/**
 * Muster parameters. The rally hex defaults to the stronghold id and the
 * army name to the new commander's name.
 */
public record RaiseArmyPayload(
        @JsonProperty("stronghold_id")
        @NotNull(message = "stronghold not found")
        Integer strongholdId,

        @JsonProperty("new_commander_id")
        @NotNull(message = "commander not found")
        Integer newCommanderId,

        @JsonProperty("infantry_unit_type_id")
        @NotNull(message = "unit type not found")
        Integer infantryUnitTypeId,

        @JsonProperty("cavalry_unit_type_id")
        Integer cavalryUnitTypeId,

        @JsonProperty("rally_hex_id")
        Integer rallyHexId,

        @JsonProperty("army_name")
        String armyName
) implements OrderPayload {
}
