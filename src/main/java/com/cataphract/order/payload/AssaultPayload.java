package com.cataphract.order.payload;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;

import java.util.Locale;
import java.util.Set;

/**
 * Assault on a stronghold's garrison. Fixed rolls replace the 2d6 of the
 * respective side. {@code pillage} accepts a boolean, a non-zero number or
 * one of {@code true/yes/y/1/on}.
 */
public record AssaultPayload(
        @JsonProperty("stronghold_id")
        @NotNull(message = "assault order missing stronghold_id")
        Integer strongholdId,

        @JsonProperty("attacker_fixed_roll")
        Integer attackerFixedRoll,

        @JsonProperty("defender_fixed_roll")
        Integer defenderFixedRoll,

        @JsonProperty("attacker_modifier")
        Integer attackerModifier,

        @JsonProperty("defender_modifier")
        Integer defenderModifier,

        @JsonProperty("pillage")
        Object pillage
) implements OrderPayload {

    private static final Set<String> TRUTHY = Set.of("true", "yes", "y", "1", "on");

    public AssaultPayload {
        attackerModifier = attackerModifier != null ? attackerModifier : 0;
        defenderModifier = defenderModifier != null ? defenderModifier : 0;
        pillage = isTruthy(pillage);
    }

    public boolean pillageAuthorised() {
        return Boolean.TRUE.equals(pillage);
    }

    private static boolean isTruthy(Object value) {
        if (value instanceof Boolean flag) {
            return flag;
        }
        if (value instanceof String text) {
            return TRUTHY.contains(text.strip().toLowerCase(Locale.ROOT));
        }
        if (value instanceof Number number) {
            return number.doubleValue() != 0;
        }
        return false;
    }
}
