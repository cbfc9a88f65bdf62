package com.cataphract.battle;

import java.util.List;
import java.util.Map;

/**
 * Summary of a resolved battle. {@code rollDifference} is the margin of the
 * winning side's best roll over the losing side's best roll.
 */
public record BattleResult(
        BattleSide winner,
        Map<Integer, ArmyBattleRecord> attackerRecords,
        Map<Integer, ArmyBattleRecord> defenderRecords,
        int rollDifference,
        List<Integer> capturedCommanders
) {

    public ArmyBattleRecord recordFor(int armyId) {
        ArmyBattleRecord record = attackerRecords.get(armyId);
        return record != null ? record : defenderRecords.get(armyId);
    }
}
