package com.cataphract.service;

import com.cataphract.config.RulesConfig;
import com.cataphract.dto.RecruitmentCompletion;
import com.cataphract.dto.RecruitmentStart;
import com.cataphract.dto.SupplySnapshot;
import com.cataphract.model.Army;
import com.cataphract.model.ArmyStatus;
import com.cataphract.model.Campaign;
import com.cataphract.model.Commander;
import com.cataphract.model.Detachment;
import com.cataphract.model.Faction;
import com.cataphract.model.Hex;
import com.cataphract.model.RecruitmentProject;
import com.cataphract.model.Stronghold;
import com.cataphract.model.StrongholdType;
import com.cataphract.model.UnitType;
import com.cataphract.rng.SeededRng;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Service responsible for mustering new armies around a stronghold.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RecruitmentService {

    private static final int STARTING_SUPPLY_DAYS = 14;
    private static final String REBEL_COLOR = "#777777";
    private static final int REBEL_LEADER_AGE = 30;
    private static final int MIN_REBEL_INFANTRY = 500;

    private final SeededRng rng;
    private final SupplyService supplyService;

    /**
     * Opens a recruitment project over every hex whose nearest stronghold is
     * this one. Hexes recruited within the cooldown may revolt and spawn a
     * rebel army.
     *
     * @throws IllegalArgumentException when the area yields no recruits
     */
    public RecruitmentStart start(Campaign campaign, Stronghold stronghold, Commander commander, Hex rallyHex,
                                  int pendingOrderId, String seed, RulesConfig rules) {
        List<Hex> eligible = eligibleHexes(campaign, stronghold);
        if (eligible.isEmpty()) {
            throw new IllegalArgumentException("no eligible hexes for recruitment");
        }

        int infantryRaw = eligible.stream().mapToInt(Hex::getSettlement).sum();
        if (infantryRaw <= 0) {
            throw new IllegalArgumentException("recruitment area has zero settlement");
        }
        double cavalryRaw = 0;
        double wagonRaw = 0;
        for (Hex hex : eligible) {
            if (hex.isGoodCountry()) {
                cavalryRaw += hex.getSettlement() * 0.25;
                wagonRaw += hex.getSettlement() * 0.05;
            }
        }

        int infantry = (int) (Math.round(infantryRaw / 100.0) * 100);
        if (infantry <= 0) {
            throw new IllegalArgumentException("recruitment yielded too few infantry");
        }
        double scale = (double) infantry / infantryRaw;
        int cavalry = (int) Math.round(cavalryRaw * scale);
        int wagons = (int) Math.round(wagonRaw * scale);
        int noncombatants = (int) (infantry * rules.getSupply().getBaseNoncombatantRatio());

        List<Army> revolts = new ArrayList<>();
        for (Hex hex : eligible) {
            if (shouldRevolt(campaign, hex, seed, rules)) {
                revolts.add(spawnRevolt(campaign, hex, seed, rules));
            }
            hex.setLastRecruitedDay(campaign.getCurrentDay());
        }

        int completesOn = campaign.getCurrentDay() + rules.getRecruitment().getMusterDurationDays();
        RecruitmentProject project = RecruitmentProject.builder()
                .id(campaign.getNextRecruitmentId())
                .strongholdId(stronghold.getId())
                .factionId(commander.getFactionId())
                .commanderId(commander.getId())
                .rallyHexId(rallyHex.getId())
                .startedOnDay(campaign.getCurrentDay())
                .completesOnDay(completesOn)
                .infantry(infantry)
                .cavalry(cavalry)
                .wagons(wagons)
                .noncombatants(noncombatants)
                .sourceHexIds(eligible.stream().map(Hex::getId).collect(Collectors.toList()))
                .pendingOrderId(pendingOrderId)
                .revoltTriggered(!revolts.isEmpty())
                .build();
        campaign.getRecruitments().put(project.getId(), project);

        log.info("Recruitment {} started at stronghold {}: {} infantry, {} cavalry, completes day {}",
                project.getId(), stronghold.getId(), infantry, cavalry, completesOn);
        return RecruitmentStart.builder()
                .project(project)
                .revolts(revolts)
                .detail(String.format("recruitment underway; infantry=%d, cavalry=%d, wagons=%d, completes day %d",
                        infantry, cavalry, wagons, completesOn))
                .build();
    }

    /**
     * Creates the army at the rally hex with two weeks of supplies and
     * closes the project.
     *
     * @throws IllegalArgumentException if the commander or rally hex has gone missing
     */
    public RecruitmentCompletion complete(Campaign campaign, RecruitmentProject project, String armyName,
                                          UnitType infantryType, UnitType cavalryType, RulesConfig rules) {
        Commander commander = campaign.getCommanders().get(project.getCommanderId());
        if (commander == null) {
            throw new IllegalArgumentException("assigned commander not found");
        }
        if (!campaign.getHexes().containsKey(project.getRallyHexId())) {
            throw new IllegalArgumentException("rally hex not found");
        }

        int detachmentId = campaign.getNextDetachmentId();
        List<Detachment> detachments = new ArrayList<>();
        detachments.add(Detachment.builder()
                .id(detachmentId)
                .unitTypeId(infantryType.getId())
                .soldiers(project.getInfantry())
                .wagons(project.getWagons())
                .name(armyName + " Infantry")
                .build());
        if (project.getCavalry() > 0 && cavalryType != null) {
            detachments.add(Detachment.builder()
                    .id(detachmentId + 1)
                    .unitTypeId(cavalryType.getId())
                    .soldiers(project.getCavalry())
                    .name(armyName + " Cavalry")
                    .build());
        }

        Army army = newArmy(campaign.getNextArmyId(), armyName, commander.getId(), project.getRallyHexId(),
                detachments, rules);
        army.setNoncombatantCount(project.getNoncombatants());
        campaign.getArmies().put(army.getId(), army);
        commander.setCurrentHexId(project.getRallyHexId());
        provision(campaign, army, rules);
        campaign.getRecruitments().remove(project.getId());

        String detail = "army " + armyName + " raised with " + project.getInfantry() + " infantry";
        if (project.getCavalry() > 0) {
            detail += " and " + project.getCavalry() + " cavalry";
        }
        log.info("Recruitment {} completed: army {} ({})", project.getId(), army.getId(), armyName);
        return new RecruitmentCompletion(army, detail);
    }

    // ── eligibility ─────────────────────────────────────────────────────

    /**
     * Hexes controlled by the stronghold's faction, settled, and with no
     * nearer stronghold. Ties go to the higher-ranked stronghold, then the lower id.
     */
    List<Hex> eligibleHexes(Campaign campaign, Stronghold stronghold) {
        Hex home = campaign.getHexes().get(stronghold.getHexId());
        if (home == null) {
            return List.of();
        }
        int priority = priorityOf(stronghold.getType());
        List<Hex> eligible = new ArrayList<>();

        for (Hex hex : campaign.getHexes().values()) {
            if (hex.getSettlement() <= 0
                    || !Objects.equals(hex.getControllingFactionId(), stronghold.getControllingFactionId())) {
                continue;
            }
            int distance = hex.distanceTo(home);
            boolean claimedElsewhere = campaign.getStrongholds().values().stream()
                    .filter(other -> other.getId() != stronghold.getId())
                    .anyMatch(other -> {
                        Hex otherHex = campaign.getHexes().get(other.getHexId());
                        if (otherHex == null) {
                            return false;
                        }
                        int otherDistance = hex.distanceTo(otherHex);
                        if (otherDistance != distance) {
                            return otherDistance < distance;
                        }
                        int otherPriority = priorityOf(other.getType());
                        return otherPriority > priority
                                || (otherPriority == priority && other.getId() < stronghold.getId());
                    });
            if (!claimedElsewhere) {
                eligible.add(hex);
            }
        }
        return eligible;
    }

    private static int priorityOf(StrongholdType type) {
        if (type == null) {
            return 0;
        }
        return switch (type) {
            case FORTRESS -> 3;
            case CITY -> 2;
            case TOWN -> 1;
        };
    }

    // ── revolts ─────────────────────────────────────────────────────────

    private boolean shouldRevolt(Campaign campaign, Hex hex, String seed, RulesConfig rules) {
        RulesConfig.Recruitment recruitment = rules.getRecruitment();
        Integer lastRecruited = hex.getLastRecruitedDay();
        if (lastRecruited == null
                || campaign.getCurrentDay() - lastRecruited > recruitment.getRecruitmentCooldownDays()) {
            return false;
        }
        int chance = recruitment.getRevoltChance();
        Integer changed = hex.getLastControlChangeDay();
        if (changed != null && campaign.getCurrentDay() - changed <= recruitment.getRecentlyConqueredDays()) {
            chance = Math.min(6, chance * 2);
        }
        if (chance <= 0) {
            return false;
        }
        return rng.rollDice(seed + ":recruit-revolt:" + hex.getId(), "1d6").total() <= chance;
    }

    private Army spawnRevolt(Campaign campaign, Hex hex, String seed, RulesConfig rules) {
        Faction faction = Faction.builder()
                .id(campaign.getNextFactionId())
                .name("Rebels of Hex " + hex.getId())
                .color(REBEL_COLOR)
                .build();
        campaign.getFactions().put(faction.getId(), faction);

        int commanderId = campaign.getNextCommanderId();
        Commander leader = Commander.builder()
                .id(commanderId)
                .name("Rebel Leader " + commanderId)
                .factionId(faction.getId())
                .age(REBEL_LEADER_AGE)
                .currentHexId(hex.getId())
                .build();
        campaign.getCommanders().put(leader.getId(), leader);

        RulesConfig.RevoltOutcome outcome = rules.getRevoltOutcome();
        int roll = rng.rollDice(seed + ":revolt-size:" + hex.getId(), "1d" + outcome.getInfantryDieSize()).total();
        int infantry = Math.max(MIN_REBEL_INFANTRY, roll * outcome.getInfantryMultiplier());

        List<Detachment> detachments = new ArrayList<>();
        detachments.add(Detachment.builder()
                .id(campaign.getNextDetachmentId())
                .unitTypeId(defaultInfantryType(campaign))
                .soldiers(infantry)
                .build());

        Army army = newArmy(campaign.getNextArmyId(), faction.getName(), leader.getId(), hex.getId(), detachments, rules);
        army.setNoncombatantCount((int) (infantry * rules.getSupply().getBaseNoncombatantRatio()));
        army.putStatusEffect(Army.EFFECT_REVOLT, true);
        campaign.getArmies().put(army.getId(), army);
        provision(campaign, army, rules);

        log.info("Recruitment revolt in hex {}: rebel army {} with {} infantry", hex.getId(), army.getId(), infantry);
        return army;
    }

    // ── helpers ─────────────────────────────────────────────────────────

    private static Army newArmy(int id, String name, int commanderId, int hexId, List<Detachment> detachments,
                                RulesConfig rules) {
        Map<String, Object> effects = new LinkedHashMap<>();
        return Army.builder()
                .id(id)
                .name(name)
                .commanderId(commanderId)
                .currentHexId(hexId)
                .detachments(detachments)
                .status(ArmyStatus.IDLE)
                .moraleCurrent(rules.getMorale().getDefaultResting())
                .moraleResting(rules.getMorale().getDefaultResting())
                .moraleMax(rules.getMorale().getDefaultMax())
                .statusEffects(effects)
                .build();
    }

    private void provision(Campaign campaign, Army army, RulesConfig rules) {
        SupplySnapshot snapshot = supplyService.snapshot(campaign, army, rules);
        army.setSuppliesCapacity(snapshot.getCapacity());
        army.setDailySupplyConsumption(snapshot.getConsumption());
        army.setColumnLengthMiles(snapshot.getColumnLengthMiles());
        army.setSuppliesCurrent(snapshot.getConsumption() * STARTING_SUPPLY_DAYS);
    }

    private static int defaultInfantryType(Campaign campaign) {
        return campaign.getUnitTypes().values().stream()
                .filter(t -> UnitType.INFANTRY.equalsIgnoreCase(t.getCategory()))
                .map(UnitType::getId)
                .findFirst()
                .orElseGet(() -> campaign.getUnitTypes().keySet().stream().findFirst().orElse(1));
    }
}
