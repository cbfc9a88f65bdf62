package com.cataphract.service;

import com.cataphract.CampaignFixtures;
import com.cataphract.config.RulesConfig;
import com.cataphract.dto.RecruitmentCompletion;
import com.cataphract.dto.RecruitmentStart;
import com.cataphract.model.Army;
import com.cataphract.model.Campaign;
import com.cataphract.model.Hex;
import com.cataphract.model.Stronghold;
import com.cataphract.model.StrongholdType;
import com.cataphract.rng.SeededRng;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for RecruitmentService.
 */
class RecruitmentServiceTest {

    private RecruitmentService recruitmentService;
    private RulesConfig rules;
    private Campaign campaign;
    private Stronghold astergard;

    @BeforeEach
    void setUp() {
        SeededRng rng = new SeededRng();
        recruitmentService = new RecruitmentService(rng, new SupplyService(rng));
        rules = CampaignFixtures.rules();
        campaign = CampaignFixtures.campaign();
        astergard = Stronghold.builder().id(2).name("Astergard").hexId(1).type(StrongholdType.CITY)
                .controllingFactionId(1).threshold(15).currentThreshold(15).build();
        campaign.getStrongholds().put(2, astergard);
    }

    @Nested
    @DisplayName("eligibleHexes()")
    class EligibilityTests {

        @Test
        @DisplayName("should take the faction's settled hexes nearest this stronghold")
        void shouldPickOwnHexes() {
            List<Integer> ids = recruitmentService.eligibleHexes(campaign, astergard).stream()
                    .map(Hex::getId).toList();

            assertEquals(List.of(1, 2, 3), ids);
        }

        @Test
        @DisplayName("should leave a hex to a nearer stronghold")
        void shouldRespectNearerStronghold() {
            campaign.getStrongholds().put(3, Stronghold.builder().id(3).name("Hillfort").hexId(3)
                    .type(StrongholdType.FORTRESS).controllingFactionId(1).build());

            List<Integer> ids = recruitmentService.eligibleHexes(campaign, astergard).stream()
                    .map(Hex::getId).toList();

            // hex 2 is equidistant; the fortress outranks the city
            assertEquals(List.of(1), ids);
        }
    }

    @Nested
    @DisplayName("start() / complete()")
    class MusterTests {

        @Test
        @DisplayName("should open a thirty-day project sized by settlement")
        void shouldStartProject() {
            RecruitmentStart start = recruitmentService.start(campaign, astergard, campaign.getCommanders().get(3),
                    campaign.getHexes().get(1), 7, "recruit", rules);

            assertEquals(100, start.getProject().getInfantry());
            assertEquals(21, start.getProject().getCavalry());
            assertEquals(30, start.getProject().getCompletesOnDay());
            assertEquals(7, start.getProject().getPendingOrderId());
            assertTrue(start.getRevolts().isEmpty());
            assertEquals(0, campaign.getHexes().get(1).getLastRecruitedDay());
            assertTrue(campaign.getRecruitments().containsKey(start.getProject().getId()));
        }

        @Test
        @DisplayName("should refuse a stronghold with no settled hexes")
        void shouldRefuseEmptyArea() {
            campaign.getHexes().values().forEach(h -> h.setSettlement(0));

            assertThrows(IllegalArgumentException.class, () -> recruitmentService.start(campaign, astergard,
                    campaign.getCommanders().get(3), campaign.getHexes().get(1), 7, "recruit", rules));
        }

        @Test
        @DisplayName("should raise a provisioned army and close the project")
        void shouldCompleteProject() {
            RecruitmentStart start = recruitmentService.start(campaign, astergard, campaign.getCommanders().get(3),
                    campaign.getHexes().get(1), 7, "recruit", rules);

            RecruitmentCompletion completion = recruitmentService.complete(campaign, start.getProject(), "Levy",
                    campaign.getUnitTypes().get(CampaignFixtures.INFANTRY),
                    campaign.getUnitTypes().get(CampaignFixtures.CAVALRY), rules);

            Army army = completion.army();
            assertEquals(3, army.getId());
            assertEquals(3, army.getCommanderId());
            assertEquals(121, army.getTotalSoldiers());
            assertEquals(army.getDailySupplyConsumption() * 14, army.getSuppliesCurrent());
            assertTrue(campaign.getRecruitments().isEmpty());
            assertEquals("army Levy raised with 100 infantry and 21 cavalry", completion.detail());
        }

        @Test
        @DisplayName("should spawn rebels when a hex is recruited again within the cooldown")
        void shouldSpawnRevoltsOnRepeat() {
            campaign.getHexes().values().forEach(h -> h.setLastRecruitedDay(0));
            rules.getRecruitment().setRevoltChance(6);

            RecruitmentStart start = recruitmentService.start(campaign, astergard, campaign.getCommanders().get(3),
                    campaign.getHexes().get(1), 7, "recruit", rules);

            assertEquals(3, start.getRevolts().size());
            assertTrue(start.getProject().isRevoltTriggered());
            assertTrue(start.getRevolts().get(0).hasStatusEffect(Army.EFFECT_REVOLT));
            assertEquals(5, campaign.getFactions().size());
        }
    }
}
