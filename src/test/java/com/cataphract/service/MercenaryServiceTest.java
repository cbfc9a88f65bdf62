package com.cataphract.service;

import com.cataphract.CampaignFixtures;
import com.cataphract.config.RulesConfig;
import com.cataphract.dto.MercenaryUpkeepResult;
import com.cataphract.model.Army;
import com.cataphract.model.Campaign;
import com.cataphract.model.Detachment;
import com.cataphract.model.MercenaryContract;
import com.cataphract.model.MercenaryContractStatus;
import com.cataphract.rng.SeededRng;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for MercenaryService.
 */
class MercenaryServiceTest {

    private MercenaryService mercenaryService;
    private RulesConfig rules;
    private Campaign campaign;
    private Army army;

    @BeforeEach
    void setUp() {
        SeededRng rng = new SeededRng();
        mercenaryService = new MercenaryService(rng, new MoraleService(rng));
        rules = CampaignFixtures.rules();
        campaign = CampaignFixtures.campaign();
        campaign.setCurrentDay(10);
        army = campaign.getArmies().get(1);
    }

    private MercenaryContract contract(int id, int lastUpkeepDay) {
        MercenaryContract contract = MercenaryContract.builder()
                .id(id)
                .companyId(1)
                .commanderId(1)
                .armyId(1)
                .lastUpkeepDay(lastUpkeepDay)
                .build();
        campaign.getMercenaryContracts().put(id, contract);
        return contract;
    }

    @Nested
    @DisplayName("dailyUpkeepCost()")
    class UpkeepCostTests {

        @Test
        @DisplayName("should charge the default rate per soldier by category")
        void shouldUseDefaultRates() {
            army.getDetachments().add(Detachment.builder().id(9).unitTypeId(CampaignFixtures.CAVALRY)
                    .soldiers(100).build());

            // 1000 infantry at 1, 100 cavalry at 3
            assertEquals(1300, mercenaryService.dailyUpkeepCost(campaign, contract(1, 9), army, rules));
        }

        @Test
        @DisplayName("should prefer negotiated rates")
        void shouldUseNegotiatedRates() {
            MercenaryContract contract = contract(1, 9);
            contract.setNegotiatedRates(new LinkedHashMap<>(Map.of(MercenaryContract.RATE_INFANTRY, 2)));

            assertEquals(2000, mercenaryService.dailyUpkeepCost(campaign, contract, army, rules));
        }
    }

    @Nested
    @DisplayName("processDailyUpkeep()")
    class ProcessUpkeepTests {

        @Test
        @DisplayName("should pay every day owed from carried loot")
        void shouldPayFromLoot() {
            army.setLootCarried(5000);
            MercenaryContract contract = contract(1, 7);
            contract.setStatus(MercenaryContractStatus.UNPAID);
            contract.setDaysUnpaid(2);

            List<MercenaryUpkeepResult> results = mercenaryService.processDailyUpkeep(campaign, rules);

            assertEquals(List.of(new MercenaryUpkeepResult(1, 1, 3000, true, false)), results);
            assertEquals(2000, army.getLootCarried());
            assertEquals(10, contract.getLastUpkeepDay());
            assertEquals(0, contract.getDaysUnpaid());
            assertEquals(MercenaryContractStatus.ACTIVE, contract.getStatus());
        }

        @Test
        @DisplayName("should cost morale when the loot runs short")
        void shouldPenaliseUnpaidUpkeep() {
            army.setLootCarried(500);
            MercenaryContract contract = contract(1, 9);

            MercenaryUpkeepResult result = mercenaryService.processDailyUpkeep(campaign, rules).get(0);

            assertFalse(result.paid());
            assertFalse(result.deserted());
            assertEquals(500, army.getLootCarried());
            assertEquals(8, army.getMoraleCurrent());
            assertEquals(1, contract.getDaysUnpaid());
            assertEquals(10, contract.getLastUpkeepDay());
            assertEquals(MercenaryContractStatus.UNPAID, contract.getStatus());
        }

        @Test
        @DisplayName("should let some unpaid companies desert after the grace period")
        void shouldDesertPastGracePeriod() {
            int deserted = 0;
            for (int id = 1; id <= 60; id++) {
                setUp();
                MercenaryContract contract = contract(id, 9);
                contract.setDaysUnpaid(3);

                MercenaryUpkeepResult result = mercenaryService.processDailyUpkeep(campaign, rules).get(0);

                if (result.deserted()) {
                    deserted++;
                    assertEquals(MercenaryContractStatus.TERMINATED, contract.getStatus());
                    assertTrue(army.hasStatusEffect(Army.EFFECT_MERCENARIES_DESERTED));
                    assertEquals(7, army.getMoraleCurrent());
                } else {
                    assertEquals(MercenaryContractStatus.UNPAID, contract.getStatus());
                    assertEquals(8, army.getMoraleCurrent());
                }
            }
            assertTrue(deserted > 0 && deserted < 60, "deserted " + deserted + " of 60");
        }

        @Test
        @DisplayName("should not roll desertion within the grace period")
        void shouldKeepCompanyWithinGrace() {
            for (int id = 1; id <= 20; id++) {
                setUp();
                MercenaryContract contract = contract(id, 9);
                contract.setDaysUnpaid(2);

                assertFalse(mercenaryService.processDailyUpkeep(campaign, rules).get(0).deserted());
                assertEquals(MercenaryContractStatus.UNPAID, contract.getStatus());
            }
        }

        @Test
        @DisplayName("should skip settled, ended and unattached contracts")
        void shouldSkipIneligibleContracts() {
            army.setLootCarried(100000);
            contract(1, 10);
            contract(2, 5).setStatus(MercenaryContractStatus.TERMINATED);
            contract(3, 5).setArmyId(null);
            contract(4, 5).setArmyId(42);

            assertTrue(mercenaryService.processDailyUpkeep(campaign, rules).isEmpty());
            assertEquals(100000, army.getLootCarried());
        }
    }
}
