package com.cataphract.battle;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/**
 * Modifiers, fixed rolls and seeds for one battle. Per-army maps are keyed
 * by army id.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BattleOptions {

    private int attackerModifier;
    private int defenderModifier;

    @Builder.Default
    private Map<Integer, Integer> attackerModifiers = new HashMap<>();

    @Builder.Default
    private Map<Integer, Integer> defenderModifiers = new HashMap<>();

    @Builder.Default
    private Map<Integer, Integer> attackerFixedRolls = new HashMap<>();

    @Builder.Default
    private Map<Integer, Integer> defenderFixedRolls = new HashMap<>();

    @Builder.Default
    private String attackerSeed = "attacker-battle";

    @Builder.Default
    private String defenderSeed = "defender-battle";
}
