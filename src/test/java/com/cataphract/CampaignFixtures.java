package com.cataphract;

import com.cataphract.battle.BattleResolver;
import com.cataphract.config.RulesConfig;
import com.cataphract.model.Army;
import com.cataphract.model.Campaign;
import com.cataphract.model.Commander;
import com.cataphract.model.DayPart;
import com.cataphract.model.Detachment;
import com.cataphract.model.Faction;
import com.cataphract.model.Hex;
import com.cataphract.model.Ship;
import com.cataphract.model.Stronghold;
import com.cataphract.model.StrongholdType;
import com.cataphract.model.UnitType;
import com.cataphract.order.OrderDispatcher;
import com.cataphract.order.OrderPayloadParser;
import com.cataphract.order.handler.CommandOrderHandler;
import com.cataphract.order.handler.MovementOrderHandler;
import com.cataphract.order.handler.NavalOrderHandler;
import com.cataphract.order.handler.RecruitmentOrderHandler;
import com.cataphract.order.handler.SiegeOrderHandler;
import com.cataphract.order.handler.SustainmentOrderHandler;
import com.cataphract.rng.SeededRng;
import com.cataphract.service.HarryingService;
import com.cataphract.service.MessagingService;
import com.cataphract.service.MoraleService;
import com.cataphract.service.MovementService;
import com.cataphract.service.NavalService;
import com.cataphract.service.OperationsService;
import com.cataphract.service.RecruitmentService;
import com.cataphract.service.SupplyService;
import jakarta.validation.Validation;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Small two-faction campaign used across the engine tests.
 * <p>
 * Six hexes in a row (q = 0..5): faction 1 holds hexes 1-3, faction 2
 * holds 4-6 and the town of Harrow on hex 5. Army 1 (1000 spearmen) stands
 * on hex 1, army 2 (800 spearmen) garrisons Harrow.
 */
public final class CampaignFixtures {

    public static final int INFANTRY = 1;
    public static final int CAVALRY = 2;

    private CampaignFixtures() {
    }

    public static Campaign campaign() {
        Campaign campaign = Campaign.builder()
                .id(1)
                .name("Test Campaign")
                .currentDay(0)
                .currentPart(DayPart.MORNING)
                .build();

        campaign.getFactions().put(1, Faction.builder().id(1).name("Aster").color("#1f4e9c").build());
        campaign.getFactions().put(2, Faction.builder().id(2).name("Free Cities").color("#b3261e").build());

        int[] settlement = {60, 40, 20, 10, 80, 50};
        for (int i = 0; i < settlement.length; i++) {
            int id = i + 1;
            campaign.getHexes().put(id, Hex.builder()
                    .id(id).q(i).r(0)
                    .settlement(settlement[i])
                    .goodCountry(id <= 2)
                    .road(true)
                    .controllingFactionId(id <= 3 ? 1 : 2)
                    .build());
        }

        campaign.getUnitTypes().put(INFANTRY, UnitType.builder()
                .id(INFANTRY).name("Spearmen").category(UnitType.INFANTRY).supplyCostPerDay(1).build());
        campaign.getUnitTypes().put(CAVALRY, UnitType.builder()
                .id(CAVALRY).name("Lancers").category(UnitType.CAVALRY).battleMultiplier(2.0)
                .supplyCostPerDay(10).specialAbilities(Set.of()).build());

        campaign.getCommanders().put(1, Commander.builder().id(1).name("Aldric").factionId(1).age(41)
                .currentHexId(1).build());
        campaign.getCommanders().put(2, Commander.builder().id(2).name("Mira").factionId(2).age(36)
                .currentHexId(5).build());
        campaign.getCommanders().put(3, Commander.builder().id(3).name("Corvin").factionId(1).age(28)
                .currentHexId(1).build());

        campaign.getArmies().put(1, army(1, 1, 1, 1, 1000, 5000, 30000));
        campaign.getArmies().put(2, army(2, 2, 5, 2, 800, 4000, 20000));

        campaign.getStrongholds().put(1, Stronghold.builder()
                .id(1).name("Harrow").hexId(5).type(StrongholdType.TOWN)
                .controllingFactionId(2).defensiveBonus(2)
                .threshold(10).currentThreshold(10)
                .garrisonArmyId(2).suppliesHeld(10000).lootHeld(1000)
                .build());

        campaign.getShips().put(1, Ship.builder().id(1).name("Grey Gull").controllingFactionId(1)
                .currentHexId(1).build());
        return campaign;
    }

    public static Army army(int id, int commanderId, int hexId, int detachmentId, int soldiers,
                            int supplies, int capacity) {
        List<Detachment> detachments = new ArrayList<>();
        detachments.add(Detachment.builder().id(detachmentId).unitTypeId(INFANTRY).soldiers(soldiers)
                .name("Detachment " + detachmentId).build());
        return Army.builder()
                .id(id)
                .name("Army " + id)
                .commanderId(commanderId)
                .currentHexId(hexId)
                .detachments(detachments)
                .suppliesCurrent(supplies)
                .suppliesCapacity(capacity)
                .build();
    }

    public static OrderPayloadParser parser() {
        return new OrderPayloadParser(Validation.buildDefaultValidatorFactory().getValidator());
    }

    /**
     * A dispatcher wired to real handlers and services sharing one dice source.
     */
    public static OrderDispatcher dispatcher(SeededRng rng) {
        OrderPayloadParser parser = parser();
        MoraleService morale = new MoraleService(rng);
        SupplyService supply = new SupplyService(rng);
        return new OrderDispatcher(
                new MovementOrderHandler(parser, new MovementService(rng), supply, rng),
                new SustainmentOrderHandler(parser, supply, morale, rng),
                new SiegeOrderHandler(parser, new BattleResolver(rng, morale), morale, rng),
                new NavalOrderHandler(parser, new NavalService()),
                new CommandOrderHandler(parser, new MessagingService(rng), new OperationsService(rng),
                        new HarryingService(rng), rng),
                new RecruitmentOrderHandler(parser, new RecruitmentService(rng, supply), rng));
    }

    public static RulesConfig rules() {
        return new RulesConfig();
    }
}
