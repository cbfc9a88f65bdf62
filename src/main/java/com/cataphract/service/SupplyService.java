package com.cataphract.service;

import com.cataphract.config.RulesConfig;
import com.cataphract.dto.ForageOutcome;
import com.cataphract.dto.SupplySnapshot;
import com.cataphract.dto.TorchOutcome;
import com.cataphract.model.Army;
import com.cataphract.model.Campaign;
import com.cataphract.model.Commander;
import com.cataphract.model.Detachment;
import com.cataphract.model.Hex;
import com.cataphract.model.HexAllegiance;
import com.cataphract.model.HexCoord;
import com.cataphract.model.UnitType;
import com.cataphract.rng.SeededRng;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Service responsible for army logistics: capacity and consumption
 * snapshots, foraging and torching.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SupplyService {

    public static final String ABILITY_OFFROAD_FULL_SPEED = "offroad_full_speed";
    public static final String ABILITY_FORAGES_AS_CAVALRY = "acts_as_cavalry_for_foraging";

    private static final Set<String> BAD_WEATHER = Set.of("bad", "storm");
    private static final String VERY_BAD_WEATHER = "very_bad";

    private final SeededRng rng;

    // ── snapshot ────────────────────────────────────────────────────────

    public SupplySnapshot snapshot(Campaign campaign, Army army, RulesConfig rules) {
        RulesConfig.Supply supply = rules.getSupply();
        Map<Integer, UnitType> unitTypes = campaign.getUnitTypes();
        Commander commander = campaign.getCommanders().get(army.getCommanderId());

        int soldiers = army.getTotalSoldiers();
        int cavalry = army.getDetachments().stream()
                .filter(d -> isCavalry(unitTypes, d))
                .mapToInt(Detachment::getSoldiers)
                .sum();
        int wagons = army.getTotalWagons();
        int infantry = soldiers - cavalry;
        int noncombatants = (int) (soldiers * noncombatantRatio(army, unitTypes, commander, rules));

        int capacity = (infantry + noncombatants) * supply.getInfantryCapacity()
                + cavalry * supply.getCavalryCapacity()
                + wagons * supply.getWagonCapacity();
        if (hasTrait(commander, "logistician")) {
            capacity = (int) (capacity * 1.20);
        }
        int consumption = (infantry + noncombatants) * supply.getInfantryConsumption()
                + cavalry * supply.getCavalryConsumption()
                + wagons * supply.getWagonConsumption();

        double column = Math.max((infantry + noncombatants) / 5000.0, Math.max(cavalry / 2000.0, wagons / 50.0));
        if (hasTrait(commander, "logistician")) {
            column *= 0.5;
        }

        return SupplySnapshot.builder()
                .totalSoldiers(soldiers)
                .totalCavalry(cavalry)
                .totalWagons(wagons)
                .noncombatants(noncombatants)
                .capacity(Math.max(0, capacity))
                .consumption(consumption)
                .columnLengthMiles(column)
                .build();
    }

    /**
     * Copies capacity, consumption, camp followers and column length onto the army.
     */
    public SupplySnapshot refresh(Campaign campaign, Army army, RulesConfig rules) {
        SupplySnapshot snapshot = snapshot(campaign, army, rules);
        army.setSuppliesCapacity(snapshot.getCapacity());
        army.setDailySupplyConsumption(snapshot.getConsumption());
        army.setNoncombatantCount(snapshot.getNoncombatants());
        army.setColumnLengthMiles(snapshot.getColumnLengthMiles());
        return snapshot;
    }

    // ── foraging & torching ─────────────────────────────────────────────

    /**
     * Forages the given hexes. Every hex is checked independently; a failing
     * hex is recorded with its reason and the rest still proceed.
     */
    public ForageOutcome forage(Campaign campaign, Army army, List<Integer> hexIds, String weather,
                                String seed, RulesConfig rules) {
        Hex armyHex = campaign.getHexes().get(army.getCurrentHexId());
        if (armyHex == null) {
            return ForageOutcome.builder()
                    .foragedHexes(List.of())
                    .failedHexes(Map.of(army.getCurrentHexId(), "army hex missing"))
                    .build();
        }
        Commander commander = campaign.getCommanders().get(army.getCommanderId());
        int range = foragingRange(army, campaign.getUnitTypes(), commander, weather, rules);

        int gained = 0;
        boolean revolt = false;
        List<Integer> foraged = new ArrayList<>();
        Map<Integer, String> failed = new LinkedHashMap<>();

        for (Integer hexId : hexIds) {
            Hex target = campaign.getHexes().get(hexId);
            String reason = forageRejection(armyHex, target, range);
            if (reason != null) {
                failed.put(hexId, reason);
                continue;
            }

            revolt |= forageRevolts(campaign, army, commander, target, seed + ":revolt:" + hexId, rules);

            int yield = target.getSettlement() * rules.getSupply().getForagingMultiplier();
            if (hasTrait(commander, "raider")) {
                yield = (int) (yield * 1.10);
            }
            target.setForagingTimesRemaining(target.getForagingTimesRemaining() - 1);
            target.setLastForagedDay(campaign.getCurrentDay());
            gained += yield;
            foraged.add(hexId);
        }

        if (gained > 0) {
            int capacity = army.getSuppliesCapacity() > 0
                    ? army.getSuppliesCapacity()
                    : snapshot(campaign, army, rules).getCapacity();
            army.setSuppliesCurrent(Math.min(capacity, army.getSuppliesCurrent() + gained));
        }

        log.debug("Army {} foraged {} hex(es) for {} supplies", army.getId(), foraged.size(), gained);
        return ForageOutcome.builder()
                .success(!foraged.isEmpty())
                .suppliesGained(gained)
                .foragedHexes(foraged)
                .failedHexes(failed)
                .revoltTriggered(revolt)
                .build();
    }

    /**
     * Burns each target hex and every hex within the torching range around it.
     */
    public TorchOutcome torch(Campaign campaign, Army army, List<Integer> hexIds, String weather,
                              String seed, RulesConfig rules) {
        Hex armyHex = campaign.getHexes().get(army.getCurrentHexId());
        if (armyHex == null) {
            return TorchOutcome.builder()
                    .torchedHexes(List.of())
                    .failedHexes(Map.of(army.getCurrentHexId(), "army hex missing"))
                    .build();
        }
        Commander commander = campaign.getCommanders().get(army.getCommanderId());
        int range = foragingRange(army, campaign.getUnitTypes(), commander, weather, rules);

        boolean revolt = false;
        List<Integer> torched = new ArrayList<>();
        Map<Integer, String> failed = new LinkedHashMap<>();

        for (Integer hexId : hexIds) {
            Hex target = campaign.getHexes().get(hexId);
            if (target == null) {
                failed.put(hexId, "hex not found");
                continue;
            }
            if (armyHex.distanceTo(target) > range) {
                failed.put(hexId, "hex out of range");
                continue;
            }

            int chance = rules.getSupply().getTorchRevoltChance();
            if (classifyTerritory(campaign, commander, target, rules) == HexAllegiance.HOSTILE) {
                chance += rules.getSupply().getTorchRevoltHostileModifier();
            }
            revolt |= rollRevolt(commander, chance, seed + ":revolt:" + hexId);

            for (HexCoord coord : target.getCoord().withinRange(range)) {
                campaign.findHexAt(coord).ifPresent(h -> h.burn(campaign.getCurrentDay()));
            }
            torched.add(hexId);
        }

        log.debug("Army {} torched {} hex(es)", army.getId(), torched.size());
        return TorchOutcome.builder()
                .success(!torched.isEmpty())
                .torchedHexes(torched)
                .failedHexes(failed)
                .revoltTriggered(revolt)
                .build();
    }

    public HexAllegiance classifyTerritory(Campaign campaign, Commander commander, Hex hex, RulesConfig rules) {
        Integer factionId = hex.getControllingFactionId();
        if (factionId == null) {
            return HexAllegiance.NEUTRAL;
        }
        if (commander != null && commander.getFactionId() == factionId) {
            Integer changed = hex.getLastControlChangeDay();
            if (changed != null && campaign.getCurrentDay() - changed <= rules.getSupply().getRecentlyConqueredDays()) {
                return HexAllegiance.RECENTLY_CONQUERED;
            }
            return HexAllegiance.FRIENDLY;
        }
        return HexAllegiance.HOSTILE;
    }

    /**
     * Hexes an army can reach for foraging or torching: one, plus one for
     * cavalry and one more for an outrider leading cavalry, less the weather.
     */
    public int foragingRange(Army army, Map<Integer, UnitType> unitTypes, Commander commander,
                             String weather, RulesConfig rules) {
        RulesConfig.Visibility visibility = rules.getVisibility();
        boolean hasCavalry = army.getDetachments().stream().anyMatch(d -> {
            UnitType type = unitTypes.get(d.getUnitTypeId());
            return type != null && (type.isCavalry() || type.hasAbility(ABILITY_FORAGES_AS_CAVALRY));
        });

        int range = visibility.getBaseRadius();
        if (hasCavalry) {
            range += visibility.getCavalryBonus();
            if (hasTrait(commander, "outrider")) {
                range += visibility.getOutriderBonus();
            }
        }

        int penalty = 0;
        if (weather != null && BAD_WEATHER.contains(weather)) {
            penalty = visibility.getBadWeatherPenalty();
        } else if (VERY_BAD_WEATHER.equals(weather)) {
            penalty = visibility.getVeryBadWeatherPenalty();
        }
        if (hasTrait(commander, "ranger")) {
            penalty = 0;
        }
        return Math.max(0, range - penalty);
    }

    // ── helpers ─────────────────────────────────────────────────────────

    private static String forageRejection(Hex armyHex, Hex target, int range) {
        if (target == null) {
            return "hex not found";
        }
        if (armyHex.distanceTo(target) > range) {
            return "hex out of range";
        }
        if (target.isTorched()) {
            return "hex torched";
        }
        if (target.getForagingTimesRemaining() <= 0) {
            return "foraging exhausted";
        }
        if (target.getSettlement() <= 0) {
            return "no settlement";
        }
        return null;
    }

    /**
     * Only a hex foraged again within the cooldown can revolt.
     */
    private boolean forageRevolts(Campaign campaign, Army army, Commander commander, Hex target,
                                  String seed, RulesConfig rules) {
        RulesConfig.Supply supply = rules.getSupply();
        Integer lastForaged = target.getLastForagedDay();
        if (lastForaged == null || campaign.getCurrentDay() - lastForaged > supply.getRevoltCooldownDays()) {
            return false;
        }
        int chance = supply.getForageRevoltChanceRepeat();
        if (classifyTerritory(campaign, commander, target, rules) == HexAllegiance.HOSTILE) {
            chance += supply.getForageRevoltHostileModifier();
        }
        boolean revolt = rollRevolt(commander, chance, seed);
        if (revolt) {
            log.info("Foraging by army {} triggered a revolt in hex {}", army.getId(), target.getId());
        }
        return revolt;
    }

    private boolean rollRevolt(Commander commander, int chance, String seed) {
        if (hasTrait(commander, "honorable")) {
            chance = Math.max(0, chance - 1);
        }
        return rng.rollDice(seed, "1d6").total() <= chance;
    }

    private static double noncombatantRatio(Army army, Map<Integer, UnitType> unitTypes, Commander commander,
                                            RulesConfig rules) {
        boolean exclusiveSkirmishers = army.getTotalWagons() == 0
                && !army.getDetachments().isEmpty()
                && army.getDetachments().stream().allMatch(d -> {
                    UnitType type = unitTypes.get(d.getUnitTypeId());
                    return type != null
                            && type.hasAbility(ABILITY_OFFROAD_FULL_SPEED)
                            && type.hasAbility(ABILITY_FORAGES_AS_CAVALRY);
                });
        if (exclusiveSkirmishers) {
            return rules.getSupply().getExclusiveSkirmisherRatio();
        }
        if (hasTrait(commander, "spartan")) {
            return rules.getSupply().getSpartanRatio();
        }
        return rules.getSupply().getBaseNoncombatantRatio();
    }

    private static boolean isCavalry(Map<Integer, UnitType> unitTypes, Detachment detachment) {
        UnitType type = unitTypes.get(detachment.getUnitTypeId());
        return type != null && type.isCavalry();
    }

    private static boolean hasTrait(Commander commander, String trait) {
        return commander != null && commander.hasTrait(trait);
    }
}
