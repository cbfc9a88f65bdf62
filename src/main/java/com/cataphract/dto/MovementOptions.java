package com.cataphract.dto;

import java.util.List;

/**
 * Leg conditions for a daily movement allowance. {@code weatherModifier} is
 * zero or negative; {@code traits} are the commander's.
 */
public record MovementOptions(boolean onRoad, List<String> traits, int weatherModifier, double columnLengthMiles) {

    public MovementOptions {
        traits = traits == null ? List.of() : List.copyOf(traits);
    }

    public boolean hasTrait(String trait) {
        return traits.stream().anyMatch(t -> t.equalsIgnoreCase(trait));
    }
}
