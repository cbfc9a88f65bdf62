package com.cataphract.order.handler;

import com.cataphract.battle.BattleOptions;
import com.cataphract.battle.BattleResolver;
import com.cataphract.battle.BattleResult;
import com.cataphract.battle.BattleSide;
import com.cataphract.config.RulesConfig;
import com.cataphract.dto.MoraleCheck;
import com.cataphract.model.Army;
import com.cataphract.model.ArmyStatus;
import com.cataphract.model.Campaign;
import com.cataphract.model.Commander;
import com.cataphract.model.CommanderStatus;
import com.cataphract.model.Order;
import com.cataphract.model.OrderEvent;
import com.cataphract.model.Siege;
import com.cataphract.model.SiegeStatus;
import com.cataphract.model.Stronghold;
import com.cataphract.order.OrderContext;
import com.cataphract.order.OrderOutcome;
import com.cataphract.order.OrderPayloadParser;
import com.cataphract.order.payload.AssaultPayload;
import com.cataphract.order.payload.BesiegePayload;
import com.cataphract.rng.SeededRng;
import com.cataphract.service.MoraleService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Executes {@code besiege} and {@code assault} orders, including the
 * capture of a stronghold whose garrison loses an assault.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SiegeOrderHandler {

    private final OrderPayloadParser parser;
    private final BattleResolver battleResolver;
    private final MoraleService moraleService;
    private final SeededRng rng;

    public OrderOutcome besiege(OrderContext context, Order order, Army army) {
        if (army == null) {
            return OrderOutcome.failed("besiege order requires an army");
        }
        BesiegePayload payload = parser.parse(order, BesiegePayload.class);
        Campaign campaign = context.campaign();
        Stronghold stronghold = campaign.getStrongholds().get(payload.strongholdId());
        if (stronghold == null) {
            return OrderOutcome.failed("stronghold not found");
        }

        campaign.findSiegeByStronghold(stronghold.getId()).ifPresentOrElse(
                siege -> {
                    if (!siege.getAttackerArmyIds().contains(army.getId())) {
                        siege.getAttackerArmyIds().add(army.getId());
                    }
                },
                () -> {
                    Siege siege = Siege.builder()
                            .id(campaign.getNextSiegeId())
                            .strongholdId(stronghold.getId())
                            .attackerArmyIds(new ArrayList<>(List.of(army.getId())))
                            .defenderArmyId(stronghold.getGarrisonArmyId())
                            .startedOnDay(campaign.getCurrentDay())
                            .currentThreshold(stronghold.getCurrentThreshold())
                            .siegeEnginesCount(payload.siegeEngines())
                            .build();
                    campaign.getSieges().put(siege.getId(), siege);
                    log.info("Siege {} opened against stronghold {}", siege.getId(), stronghold.getId());
                });

        army.setStatus(ArmyStatus.BESIEGING);
        return OrderOutcome.completed("besieging stronghold " + stronghold.getId());
    }

    /**
     * Storms a stronghold's garrison. The attacker fights at -1 and the
     * defender gets the walls' bonus less the besiegers' engines. Whoever
     * loses suffers a further round of attrition.
     */
    public OrderOutcome assault(OrderContext context, Order order, Army army) {
        if (army == null) {
            return OrderOutcome.failed("assault order requires an army");
        }
        AssaultPayload payload = parser.parse(order, AssaultPayload.class);
        Campaign campaign = context.campaign();
        RulesConfig rules = context.rules();

        Stronghold stronghold = campaign.getStrongholds().get(payload.strongholdId());
        if (stronghold == null) {
            return OrderOutcome.failed("stronghold not found");
        }
        Army defender = stronghold.getGarrisonArmyId() != null
                ? campaign.getArmies().get(stronghold.getGarrisonArmyId())
                : null;
        if (defender == null) {
            return OrderOutcome.failed("stronghold has no garrison army");
        }
        Siege siege = campaign.findSiegeByStronghold(stronghold.getId()).orElse(null);
        int engines = siege != null ? siege.getSiegeEnginesCount() : 0;

        Map<Integer, Integer> attackerFixed = new HashMap<>();
        if (payload.attackerFixedRoll() != null) {
            attackerFixed.put(army.getId(), payload.attackerFixedRoll());
        }
        Map<Integer, Integer> defenderFixed = new HashMap<>();
        if (payload.defenderFixedRoll() != null) {
            defenderFixed.put(defender.getId(), payload.defenderFixedRoll());
        }
        BattleOptions options = BattleOptions.builder()
                .attackerModifier(-1 + payload.attackerModifier())
                .defenderModifier(Math.max(0, stronghold.getDefensiveBonus() - engines) + payload.defenderModifier())
                .attackerFixedRolls(attackerFixed)
                .defenderFixedRolls(defenderFixed)
                .attackerSeed(context.seed(rng, "assault:" + order.getId() + ":attacker"))
                .defenderSeed(context.seed(rng, "assault:" + order.getId() + ":defender"))
                .build();

        army.setStatus(ArmyStatus.IN_BATTLE);
        defender.setStatus(ArmyStatus.IN_BATTLE);
        BattleResult result = battleResolver.resolveBattle(List.of(army), List.of(defender),
                campaign.getUnitTypes(), options, rules);
        boolean attackerWon = result.winner() == BattleSide.ATTACKER;
        (attackerWon ? defender : army).applyLosses(rules.getBattle().getAssaultAttritionFraction());

        List<String> detail = new ArrayList<>();
        detail.add("assault result: " + result.winner().name().toLowerCase());
        List<OrderEvent> events = new ArrayList<>();
        if (attackerWon) {
            captureStronghold(context, army, defender, stronghold, siege, payload.pillageAuthorised(), detail, events);
        }

        if (army.getStatus() != ArmyStatus.ROUTED) {
            army.setStatus(ArmyStatus.IDLE);
        }
        if (attackerWon) {
            defender.setStatus(ArmyStatus.ROUTED);
        } else if (defender.getStatus() != ArmyStatus.ROUTED) {
            defender.setStatus(ArmyStatus.IDLE);
        }
        log.info("Army {} assaulted stronghold {}: {} won", army.getId(), stronghold.getId(), result.winner());
        return OrderOutcome.completed(String.join("; ", detail), events);
    }

    // ── capture ─────────────────────────────────────────────────────────

    private void captureStronghold(OrderContext context, Army attacker, Army defender, Stronghold stronghold,
                                   Siege siege, boolean pillage, List<String> detail, List<OrderEvent> events) {
        Campaign campaign = context.campaign();
        Commander commander = campaign.getCommanders().get(attacker.getCommanderId());

        if (commander != null) {
            stronghold.setControllingFactionId(commander.getFactionId());
        }
        stronghold.setGatesOpen(true);
        stronghold.setGarrisonArmyId(attacker.getId());
        if (siege != null) {
            siege.setStatus(SiegeStatus.SUCCESSFUL_ASSAULT);
        }

        captureSupplies(context, attacker, stronghold, siege, detail, events);
        gainCampFollowers(attacker, stronghold, detail, events);
        if (pillage) {
            pillage(context.rules(), attacker, stronghold, detail, events);
        } else {
            checkDiscipline(context, attacker, commander, detail, events);
        }
        resolveDefendingCommander(context, defender, commander, detail, events);
    }

    private void captureSupplies(OrderContext context, Army attacker, Stronghold stronghold, Siege siege,
                                 List<String> detail, List<OrderEvent> events) {
        if (stronghold.getType() == null) {
            return;
        }
        int weeks = siege != null ? siege.getWeeksElapsed() : 0;
        int roll = rng.rollDice(context.seed(rng, "capture-supply:" + stronghold.getId() + ":" + weeks), "1d6").total();
        int gain = Math.max(0, roll - weeks) * stronghold.getType().getCaptureSupplyMultiplier();
        if (gain <= 0) {
            return;
        }
        int loaded = attacker.loadSupplies(gain);
        int stored = gain - loaded;
        stronghold.setSuppliesHeld(stronghold.getSuppliesHeld() + stored);

        detail.add(loaded > 0 ? "captured " + gain + " supplies (" + loaded + " loaded)" : "captured " + gain + " supplies");
        events.add(OrderEvent.of("capture_supplies", "amount", gain, "loaded", loaded, "stored", stored));
    }

    private void gainCampFollowers(Army attacker, Stronghold stronghold, List<String> detail, List<OrderEvent> events) {
        if (stronghold.getType() == null) {
            return;
        }
        int pool = attacker.getNoncombatantCount() > 0 ? attacker.getNoncombatantCount() : attacker.getTotalSoldiers();
        int gain = (int) Math.max(1, Math.round(pool * stronghold.getType().getNoncombatantRatio()));
        attacker.setNoncombatantCount(attacker.getNoncombatantCount() + gain);

        detail.add("gained " + gain + " camp followers");
        events.add(OrderEvent.of("noncombatant_gain", "amount", gain));
    }

    private void pillage(RulesConfig rules, Army attacker, Stronghold stronghold,
                         List<String> detail, List<OrderEvent> events) {
        int loot = stronghold.getLootHeld() / 2;
        stronghold.setLootHeld(stronghold.getLootHeld() - loot);
        attacker.setLootCarried(attacker.getLootCarried() + loot);

        int supplies = stronghold.getSuppliesHeld() / 2;
        stronghold.setSuppliesHeld(stronghold.getSuppliesHeld() - supplies);
        int loaded = attacker.loadSupplies(supplies);
        moraleService.adjustMorale(attacker, rules.getBattle().getPillageMoraleBonus());

        detail.add("pillage authorised (" + loot + " loot, " + loaded + " supplies)");
        events.add(OrderEvent.of("pillage", "loot", loot, "supplies", loaded));
    }

    private void checkDiscipline(OrderContext context, Army attacker, Commander commander,
                                 List<String> detail, List<OrderEvent> events) {
        String seed = context.seed(rng, "discipline:" + attacker.getId());
        MoraleCheck check = moraleService.rollMoraleCheck(attacker.getMoraleCurrent(), seed);
        if (check.success()) {
            return;
        }
        moraleService.applyMoraleConsequence(attacker, check.roll(), commander, seed + ":consequence",
                context.campaign().getCurrentDay());
        detail.add("discipline check failed");
        events.add(OrderEvent.of("discipline_failed", "roll", check.roll()));
    }

    private void resolveDefendingCommander(OrderContext context, Army defender, Commander victor,
                                           List<String> detail, List<OrderEvent> events) {
        Commander commander = context.campaign().getCommanders().get(defender.getCommanderId());
        if (commander == null) {
            return;
        }
        int roll = rng.rollDice(context.seed(rng, "assault-escape:" + commander.getId()), "1d6").total();
        if (roll <= context.rules().getBattle().getCommanderEscapeThreshold()) {
            commander.setStatus(CommanderStatus.ESCAPED);
            commander.setCurrentHexId(null);
            detail.add("defender commander escaped");
            events.add(OrderEvent.of("commander_escaped", "commander_id", commander.getId()));
            return;
        }
        commander.setStatus(CommanderStatus.CAPTURED);
        if (victor != null) {
            commander.setCapturedByFactionId(victor.getFactionId());
        }
        detail.add("defender commander captured");
        events.add(OrderEvent.of("commander_captured", "commander_id", commander.getId()));
    }
}
