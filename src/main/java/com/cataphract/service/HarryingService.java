package com.cataphract.service;

import com.cataphract.config.RulesConfig;
import com.cataphract.dto.HarryingResult;
import com.cataphract.model.Army;
import com.cataphract.model.ArmyStatus;
import com.cataphract.model.Campaign;
import com.cataphract.model.Detachment;
import com.cataphract.model.UnitType;
import com.cataphract.rng.SeededRng;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Service responsible for detachments harrying an enemy army.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class HarryingService {

    public static final String OBJECTIVE_KILL = "kill";
    public static final String OBJECTIVE_TORCH = "torch";
    public static final String OBJECTIVE_STEAL = "steal";

    private static final int BASE_SUCCESS_THRESHOLD = 2;
    private static final double HARRIED_MOVEMENT_PENALTY = 0.5;

    private final SeededRng rng;

    /**
     * Resolves one attempt. Success is {@code 1d6 <= 2 + modifier}, where
     * skirmishers add one and cavalry adds two. Both armies are marked
     * whatever the outcome.
     *
     * @throws IllegalArgumentException for an empty or soldierless party, or an unknown objective
     */
    public HarryingResult resolve(Campaign campaign, Army attacker, Army target, List<Detachment> detached,
                                  String objective, String seed, RulesConfig rules) {
        if (detached == null || detached.isEmpty()) {
            throw new IllegalArgumentException("harrying requires at least one detachment");
        }
        int soldiers = detached.stream().mapToInt(Detachment::getSoldiers).sum();
        if (soldiers <= 0) {
            throw new IllegalArgumentException("harrying detachment has no soldiers");
        }
        String goal = objective != null ? objective.toLowerCase() : OBJECTIVE_KILL;
        if (!List.of(OBJECTIVE_KILL, OBJECTIVE_TORCH, OBJECTIVE_STEAL).contains(goal)) {
            throw new IllegalArgumentException("unknown harrying objective: " + goal);
        }

        int modifier = modifierFor(campaign.getUnitTypes(), detached);
        int roll = rng.rollDice(seed, "1d6").total();
        boolean success = roll <= Math.min(6, BASE_SUCCESS_THRESHOLD + modifier);

        markHarried(attacker, target, campaign.getCurrentDay(), goal);

        HarryingResult result = success
                ? succeed(attacker, target, soldiers, goal, roll, modifier, seed)
                : fail(detached, soldiers, roll, modifier);
        log.debug("Army {} harried army {}: {}", attacker.getId(), target.getId(), result.getDetail());
        return result;
    }

    private HarryingResult succeed(Army attacker, Army target, int soldiers, String objective,
                                   int roll, int modifier, String seed) {
        HarryingResult.HarryingResultBuilder result = HarryingResult.builder()
                .success(true).roll(roll).modifier(modifier);

        switch (objective) {
            case OBJECTIVE_KILL -> {
                int casualties = Math.max(1, soldiers * 20 / 100);
                inflictCasualties(target, casualties);
                return result.inflictedCasualties(casualties)
                        .detail("harrying success: inflicted " + casualties + " casualties")
                        .build();
            }
            case OBJECTIVE_TORCH -> {
                int burnRoll = Math.max(1, rng.rollDice(seed + ":torch", "2d6").total() + modifier);
                int burned = Math.min(soldiers * burnRoll, target.getSuppliesCurrent());
                target.setSuppliesCurrent(target.getSuppliesCurrent() - burned);
                return result.suppliesBurned(burned)
                        .detail("harrying success: torched " + burned + " supplies")
                        .build();
            }
            default -> {
                int stealRoll = Math.max(1, rng.rollDice(seed + ":steal", "1d6").total() + modifier);
                int haul = soldiers * stealRoll;
                int loot = Math.min(haul, target.getLootCarried());
                target.setLootCarried(target.getLootCarried() - loot);
                attacker.setLootCarried(attacker.getLootCarried() + loot);

                int supplies = 0;
                int remaining = haul - loot;
                if (remaining > 0) {
                    supplies = Math.min(remaining, Math.min(target.getSuppliesCurrent(), attacker.getFreeSupplyCapacity()));
                    target.setSuppliesCurrent(target.getSuppliesCurrent() - supplies);
                    attacker.setSuppliesCurrent(attacker.getSuppliesCurrent() + supplies);
                }
                String detail = "harrying success: stole " + loot + " loot";
                if (supplies > 0) {
                    detail += " and " + supplies + " supplies";
                }
                return result.lootStolen(loot).suppliesStolen(supplies).detail(detail).build();
            }
        }
    }

    private static HarryingResult fail(List<Detachment> detached, int soldiers, int roll, int modifier) {
        int losses = Math.max(1, soldiers / 5);
        int remaining = losses;
        for (Detachment detachment : detached) {
            if (remaining <= 0) {
                break;
            }
            int loss = Math.min(detachment.getSoldiers(), remaining);
            detachment.setSoldiers(detachment.getSoldiers() - loss);
            remaining -= loss;
        }
        return HarryingResult.builder()
                .success(false)
                .roll(roll)
                .modifier(modifier)
                .attackerLosses(losses)
                .detail("harrying failed: detachment lost " + losses + " soldiers")
                .build();
    }

    private static void markHarried(Army attacker, Army target, int day, String objective) {
        attacker.setStatus(ArmyStatus.HARRYING);
        attacker.setMovementPointsRemaining(0.0);

        Map<String, Object> harried = new LinkedHashMap<>();
        harried.put("day", day);
        harried.put("objective", objective);
        harried.put("penalty", HARRIED_MOVEMENT_PENALTY);
        target.putStatusEffect(Army.EFFECT_HARRIED, harried);
        target.setMovementPointsRemaining(Math.min(target.getMovementPointsRemaining(), HARRIED_MOVEMENT_PENALTY));
    }

    /**
     * Casualties come out of detachments in order, then out of camp followers.
     */
    private static void inflictCasualties(Army target, int casualties) {
        int remaining = casualties;
        for (Detachment detachment : target.getDetachments()) {
            if (remaining <= 0) {
                break;
            }
            int loss = Math.min(detachment.getSoldiers(), remaining);
            detachment.setSoldiers(detachment.getSoldiers() - loss);
            remaining -= loss;
        }
        if (remaining > 0) {
            target.setNoncombatantCount(Math.max(0, target.getNoncombatantCount() - remaining));
        }
    }

    private static int modifierFor(Map<Integer, UnitType> unitTypes, List<Detachment> detached) {
        boolean skirmisher = detached.stream().anyMatch(d -> {
            UnitType type = unitTypes.get(d.getUnitTypeId());
            return type != null && type.hasAbility("skirmisher");
        });
        boolean cavalry = detached.stream().anyMatch(d -> {
            UnitType type = unitTypes.get(d.getUnitTypeId());
            return type != null && type.isCavalry();
        });
        return (skirmisher ? 1 : 0) + (cavalry ? 2 : 0);
    }
}
