package com.cataphract.service;

import com.cataphract.CampaignFixtures;
import com.cataphract.config.RulesConfig;
import com.cataphract.dto.HarryingResult;
import com.cataphract.model.Army;
import com.cataphract.model.ArmyStatus;
import com.cataphract.model.Campaign;
import com.cataphract.model.Detachment;
import com.cataphract.rng.SeededRng;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for HarryingService.
 */
class HarryingServiceTest {

    private HarryingService harryingService;
    private RulesConfig rules;
    private Campaign campaign;
    private Army attacker;
    private Army target;

    @BeforeEach
    void setUp() {
        harryingService = new HarryingService(new SeededRng());
        rules = CampaignFixtures.rules();
        campaign = CampaignFixtures.campaign();
        attacker = campaign.getArmies().get(1);
        target = campaign.getArmies().get(2);
    }

    @Test
    @DisplayName("should reject an unknown objective before touching either army")
    void shouldRejectUnknownObjective() {
        List<Detachment> party = attacker.getDetachments();

        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> harryingService.resolve(campaign, attacker, target, party, "ambush", "h", rules));

        assertTrue(ex.getMessage().contains("ambush"));
        assertFalse(target.hasStatusEffect(Army.EFFECT_HARRIED));
        assertEquals(ArmyStatus.IDLE, attacker.getStatus());
    }

    @Test
    @DisplayName("should reject an empty party")
    void shouldRejectEmptyParty() {
        assertThrows(IllegalArgumentException.class,
                () -> harryingService.resolve(campaign, attacker, target, List.of(), "kill", "h", rules));
    }

    @Test
    @DisplayName("should mark both armies whatever the outcome")
    void shouldMarkBothArmies() {
        HarryingResult result = harryingService.resolve(campaign, attacker, target,
                attacker.getDetachments(), "kill", "1:0:morning:harry:1", rules);

        assertEquals(ArmyStatus.HARRYING, attacker.getStatus());
        assertTrue(target.isHarriedOn(0));
        assertFalse(target.isHarriedOn(1));
        if (result.isSuccess()) {
            assertEquals(200, result.getInflictedCasualties());
            assertEquals(600, target.getTotalSoldiers());
        } else {
            assertEquals(200, result.getAttackerLosses());
            assertEquals(800, attacker.getTotalSoldiers());
        }
    }

    @Test
    @DisplayName("should add two to the success target for cavalry")
    void shouldFavourCavalry() {
        attacker.getDetachments().get(0).setUnitTypeId(CampaignFixtures.CAVALRY);
        target.setSuppliesCurrent(100);

        for (int i = 0; i < 10; i++) {
            HarryingResult result = harryingService.resolve(campaign, attacker, target,
                    attacker.getDetachments(), "torch", "torch:" + i, rules);
            assertEquals(2, result.getModifier());
            assertEquals(result.getRoll() <= 4, result.isSuccess());
        }
    }
}
