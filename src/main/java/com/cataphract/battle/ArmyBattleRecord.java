package com.cataphract.battle;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Roll, modifiers and consequences for a single army in a battle.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ArmyBattleRecord {

    private int roll;

    /** Non-zero modifiers only: numeric, morale, exhaustion, order, side. */
    @Builder.Default
    private Map<String, Integer> modifiers = new LinkedHashMap<>();

    private double casualtyPct;
    private int moraleDelta;
    private boolean routed;
    private Integer retreatHexes;
    private boolean commanderCaptured;
}
