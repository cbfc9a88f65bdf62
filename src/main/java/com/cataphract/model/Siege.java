package com.cataphract.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * An ongoing or concluded siege of a stronghold.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Siege {

    public static final String MODIFIER_DISEASE = "disease";
    public static final String MODIFIER_RESUPPLY = "resupply";
    public static final String MODIFIER_ATTACKED = "attacked";

    private int id;
    private int strongholdId;

    @Builder.Default
    private List<Integer> attackerArmyIds = new ArrayList<>();

    private Integer defenderArmyId;
    private int startedOnDay;
    private int weeksElapsed;
    private int currentThreshold;

    /** Named weekly threshold modifiers: "disease", "resupply" or "attacked". */
    @Builder.Default
    private List<String> thresholdModifiers = new ArrayList<>();

    private int siegeEnginesCount;

    @Builder.Default
    private SiegeStatus status = SiegeStatus.ONGOING;
}
