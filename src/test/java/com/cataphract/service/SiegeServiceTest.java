package com.cataphract.service;

import com.cataphract.CampaignFixtures;
import com.cataphract.dto.SiegeAdvanceResult;
import com.cataphract.model.Siege;
import com.cataphract.model.SiegeStatus;
import com.cataphract.rng.SeededRng;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for SiegeService.
 */
class SiegeServiceTest {

    private final SiegeService siegeService = new SiegeService(new SeededRng());

    private Siege siege(int threshold, int engines, List<String> modifiers) {
        return Siege.builder()
                .id(1)
                .strongholdId(1)
                .currentThreshold(threshold)
                .siegeEnginesCount(engines)
                .thresholdModifiers(new ArrayList<>(modifiers))
                .build();
    }

    @Test
    @DisplayName("should lower the threshold by one each week and by one per engine")
    void shouldLowerThreshold() {
        Siege siege = siege(10, 2, List.of());

        SiegeAdvanceResult result = siegeService.advanceSiege(siege, "siege:1", CampaignFixtures.rules());

        assertEquals(1, siege.getWeeksElapsed());
        assertEquals(7, siege.getCurrentThreshold());
        assertEquals(7, result.threshold());
        assertEquals(result.roll() > 7, result.gatesOpened());
    }

    @Test
    @DisplayName("should apply named weekly modifiers")
    void shouldApplyModifiers() {
        Siege siege = siege(10, 0, List.of(Siege.MODIFIER_DISEASE, Siege.MODIFIER_RESUPPLY));

        siegeService.advanceSiege(siege, "siege:1", CampaignFixtures.rules());

        // -1 weekly, -1 disease, +2 resupply
        assertEquals(10, siege.getCurrentThreshold());
    }

    @Test
    @DisplayName("should never drop the threshold below zero and then open the gates")
    void shouldOpenGatesAtZero() {
        Siege siege = siege(1, 5, List.of());

        SiegeAdvanceResult result = siegeService.advanceSiege(siege, "siege:1", CampaignFixtures.rules());

        assertEquals(0, siege.getCurrentThreshold());
        assertTrue(result.gatesOpened());
        assertEquals(SiegeStatus.GATES_OPENED, siege.getStatus());
    }
}
