package com.cataphract.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashSet;
import java.util.Set;

/**
 * Catalog entry describing a kind of detachment.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class UnitType {

    public static final String CAVALRY = "cavalry";
    public static final String INFANTRY = "infantry";

    private int id;
    private String name;

    @Builder.Default
    private String category = INFANTRY;

    @Builder.Default
    private double battleMultiplier = 1.0;

    private int supplyCostPerDay;

    @Builder.Default
    private boolean canTravelOffroad = true;

    /** Ability flags such as "skirmisher" or "acts_as_cavalry_for_foraging". */
    @Builder.Default
    private Set<String> specialAbilities = new HashSet<>();

    @JsonIgnore
    public boolean isCavalry() {
        return CAVALRY.equalsIgnoreCase(category);
    }

    public boolean hasAbility(String ability) {
        return specialAbilities != null && specialAbilities.contains(ability);
    }
}
