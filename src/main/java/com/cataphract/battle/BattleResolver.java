package com.cataphract.battle;

import com.cataphract.config.RulesConfig;
import com.cataphract.model.Army;
import com.cataphract.model.ArmyStatus;
import com.cataphract.model.Detachment;
import com.cataphract.model.UnitType;
import com.cataphract.rng.SeededRng;
import com.cataphract.service.MoraleService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Service responsible for resolving a battle between two sides of one or
 * more armies. Casualties, morale shifts, routs and retreat supply losses are
 * applied to the armies in place.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BattleResolver {

    private static final int MAJOR_CAPTURE_DIFF = 6;
    private static final int MINOR_CAPTURE_DIFF = 4;

    private final SeededRng rng;
    private final MoraleService moraleService;

    public BattleResult resolveBattle(List<Army> attackers, List<Army> defenders,
                                      Map<Integer, UnitType> unitTypes, BattleOptions options,
                                      RulesConfig rules) {
        if (attackers == null || attackers.isEmpty() || defenders == null || defenders.isEmpty()) {
            throw new IllegalArgumentException("both sides need at least one army");
        }
        BattleOptions opts = options != null ? options : new BattleOptions();

        double attackerStrength = sideStrength(attackers, unitTypes);
        double defenderStrength = sideStrength(defenders, unitTypes);

        Map<Integer, ArmyBattleRecord> attackerRecords = new LinkedHashMap<>();
        for (Army army : attackers) {
            attackerRecords.put(army.getId(), rollFor(army, opts.getAttackerSeed(), opts.getAttackerFixedRolls(),
                    opts.getAttackerModifiers(), opts.getAttackerModifier(), attackerStrength, defenderStrength, rules));
        }
        Map<Integer, ArmyBattleRecord> defenderRecords = new LinkedHashMap<>();
        for (Army army : defenders) {
            defenderRecords.put(army.getId(), rollFor(army, opts.getDefenderSeed(), opts.getDefenderFixedRolls(),
                    opts.getDefenderModifiers(), opts.getDefenderModifier(), defenderStrength, attackerStrength, rules));
        }

        int attackerBest = bestRoll(attackerRecords);
        int defenderBest = bestRoll(defenderRecords);
        int raw = attackerBest - defenderBest;
        // ties go to the defender
        BattleSide winner = raw > 0 ? BattleSide.ATTACKER : BattleSide.DEFENDER;
        int rollDifference = Math.abs(raw);

        List<Integer> captured = new ArrayList<>();
        for (Army army : attackers) {
            ArmyBattleRecord record = attackerRecords.get(army.getId());
            applyResolution(army, record, record.getRoll() - defenderBest, winner == BattleSide.ATTACKER,
                    opts.getAttackerSeed(), rules);
            if (record.isCommanderCaptured()) {
                captured.add(army.getCommanderId());
            }
        }
        for (Army army : defenders) {
            ArmyBattleRecord record = defenderRecords.get(army.getId());
            applyResolution(army, record, record.getRoll() - attackerBest, winner == BattleSide.DEFENDER,
                    opts.getDefenderSeed(), rules);
            if (record.isCommanderCaptured()) {
                captured.add(army.getCommanderId());
            }
        }

        boolean attackerLost = winner == BattleSide.DEFENDER;
        List<Army> losers = attackerLost ? attackers : defenders;
        Map<Integer, ArmyBattleRecord> loserRecords = attackerLost ? attackerRecords : defenderRecords;
        String loserSeed = attackerLost ? opts.getAttackerSeed() : opts.getDefenderSeed();
        for (Army army : losers) {
            applyRetreat(army, loserRecords.get(army.getId()), rollDifference, loserSeed, rules);
        }

        log.debug("Battle resolved: {} wins by {} (attacker best {}, defender best {})",
                winner, rollDifference, attackerBest, defenderBest);
        return new BattleResult(winner, attackerRecords, defenderRecords, rollDifference, captured);
    }

    // ── rolls ───────────────────────────────────────────────────────────

    private ArmyBattleRecord rollFor(Army army, String seed, Map<Integer, Integer> fixedRolls,
                                     Map<Integer, Integer> perArmy, int sideModifier,
                                     double ownStrength, double enemyStrength, RulesConfig rules) {
        Integer fixed = fixedRolls != null ? fixedRolls.get(army.getId()) : null;
        int base = fixed != null ? fixed : rng.rollDice(seed + ":" + army.getId(), "2d6").total();

        Map<String, Integer> modifiers = new LinkedHashMap<>();
        putIfNonZero(modifiers, "numeric", numericAdvantage(ownStrength, enemyStrength, rules));
        putIfNonZero(modifiers, "morale",
                Math.max(-2, Math.min(2, Math.floorDiv(army.getMoraleCurrent() - army.getMoraleResting(), 2))));
        putIfNonZero(modifiers, "exhaustion", army.hasStatusEffect(Army.EFFECT_SICK_OR_EXHAUSTED) ? -1 : 0);
        putIfNonZero(modifiers, "order", perArmy != null ? perArmy.getOrDefault(army.getId(), 0) : 0);
        putIfNonZero(modifiers, "side", sideModifier);

        int total = base + modifiers.values().stream().mapToInt(Integer::intValue).sum();
        return ArmyBattleRecord.builder().roll(total).modifiers(modifiers).build();
    }

    private static int numericAdvantage(double own, double enemy, RulesConfig rules) {
        if (enemy <= 0) {
            return 3;
        }
        double ratio = own / enemy;
        if (ratio <= 1) {
            return 0;
        }
        return (int) ((ratio - 1) / rules.getBattle().getMultiSideNumericBonusRatio());
    }

    private static double sideStrength(List<Army> armies, Map<Integer, UnitType> unitTypes) {
        double total = 0;
        for (Army army : armies) {
            double strength = 0;
            for (Detachment detachment : army.getDetachments()) {
                UnitType type = unitTypes != null ? unitTypes.get(detachment.getUnitTypeId()) : null;
                strength += detachment.getSoldiers() * (type != null ? type.getBattleMultiplier() : 1.0);
            }
            total += Math.max(1.0, strength);
        }
        return total;
    }

    private static int bestRoll(Map<Integer, ArmyBattleRecord> records) {
        return records.values().stream().mapToInt(ArmyBattleRecord::getRoll).max().orElse(0);
    }

    private static void putIfNonZero(Map<String, Integer> modifiers, String name, int value) {
        if (value != 0) {
            modifiers.put(name, value);
        }
    }

    // ── consequences ────────────────────────────────────────────────────

    private void applyResolution(Army army, ArmyBattleRecord record, int difference, boolean winning,
                                 String seed, RulesConfig rules) {
        Casualties row = Casualties.forDifference(Math.abs(difference));
        double casualty = winning ? row.winnerPct() : row.loserPct();
        record.setCasualtyPct(casualty);
        army.applyLosses(casualty);

        int moraleDelta = winning ? row.winnerMorale() : row.loserMorale();
        record.setMoraleDelta(moraleDelta);
        moraleService.adjustMorale(army, moraleDelta);

        if (army.getMoraleCurrent() <= rules.getBattle().getRoutThreshold()) {
            army.setStatus(ArmyStatus.ROUTED);
            record.setRouted(true);
        }

        int captureTarget = 0;
        if (!winning && difference <= -MAJOR_CAPTURE_DIFF) {
            captureTarget = rules.getBattle().getCaptureChanceMajor();
        } else if (!winning && difference <= -MINOR_CAPTURE_DIFF) {
            captureTarget = rules.getBattle().getCaptureChanceMinor();
        }
        if (captureTarget > 0
                && rng.rollDice(seed + ":commander-capture:" + army.getId(), "1d6").total() <= captureTarget) {
            record.setCommanderCaptured(true);
        }
    }

    private void applyRetreat(Army army, ArmyBattleRecord record, int rollDifference, String seed,
                              RulesConfig rules) {
        RulesConfig.Battle battle = rules.getBattle();
        if (record.isRouted()) {
            int roll = rng.rollDice(seed + ":retreat:" + army.getId(), "1d" + battle.getRetreatHexesMax()).total();
            record.setRetreatHexes(Math.max(battle.getRetreatHexesMin(), Math.min(battle.getRetreatHexesMax(), roll)));
            int lossDie = rng.rollDice(seed + ":retreat-supplies:" + army.getId(),
                    "1d" + battle.getRetreatSupplyLossDie()).total();
            double lossFraction = lossDie * battle.getRetreatSupplyLossMultiplier() / 100.0;
            army.setSuppliesCurrent(Math.max(0, (int) (army.getSuppliesCurrent() * (1 - lossFraction))));
            return;
        }
        if (rollDifference > 0 && rng.rollDice(seed + ":fallback:" + army.getId(), "1d2").total() == 1) {
            record.setRetreatHexes(battle.getRetreatHexesMin());
        }
    }

    /**
     * Casualty and morale table keyed by the magnitude of an army's roll
     * difference against the enemy's best roll.
     */
    private record Casualties(double winnerPct, double loserPct, int winnerMorale, int loserMorale) {

        static Casualties forDifference(int magnitude) {
            if (magnitude >= 6) {
                return new Casualties(0.05, 0.20, 2, -2);
            }
            if (magnitude >= 4) {
                return new Casualties(0.05, 0.15, 2, -2);
            }
            if (magnitude >= 2) {
                return new Casualties(0.05, 0.10, 1, -2);
            }
            if (magnitude == 1) {
                return new Casualties(0.10, 0.10, 0, -1);
            }
            return new Casualties(0.05, 0.05, -1, 0);
        }
    }
}
