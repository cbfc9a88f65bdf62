package com.cataphract.service;

import com.cataphract.CampaignFixtures;
import com.cataphract.config.RulesConfig;
import com.cataphract.dto.MovementOptions;
import com.cataphract.dto.MovementValidation;
import com.cataphract.model.Army;
import com.cataphract.model.Campaign;
import com.cataphract.model.Detachment;
import com.cataphract.model.MovementType;
import com.cataphract.rng.SeededRng;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for MovementService.
 */
class MovementServiceTest {

    private MovementService movementService;
    private RulesConfig rules;
    private Campaign campaign;
    private Army army;

    @BeforeEach
    void setUp() {
        movementService = new MovementService(new SeededRng());
        rules = CampaignFixtures.rules();
        campaign = CampaignFixtures.campaign();
        army = campaign.getArmies().get(1);
    }

    private double miles(MovementType type, boolean onRoad, List<String> traits, int weather, double column) {
        return movementService.calculateDailyMovementMiles(campaign.getUnitTypes(), army, type,
                new MovementOptions(onRoad, traits, weather, column), rules);
    }

    @Nested
    @DisplayName("calculateDailyMovementMiles()")
    class AllowanceTests {

        @Test
        @DisplayName("should use road and off-road speeds per movement type")
        void shouldUseBaseSpeeds() {
            assertEquals(12, miles(MovementType.STANDARD, true, List.of(), 0, 1));
            assertEquals(6, miles(MovementType.STANDARD, false, List.of(), 0, 1));
            assertEquals(18, miles(MovementType.FORCED, true, List.of(), 0, 1));
            assertEquals(6, miles(MovementType.NIGHT, true, List.of(), 0, 1));
            assertEquals(0, miles(MovementType.NIGHT, false, List.of(), 0, 1));
        }

        @Test
        @DisplayName("should double forced marches for an all-cavalry army")
        void shouldDoubleCavalryForcedMarch() {
            army.getDetachments().get(0).setUnitTypeId(CampaignFixtures.CAVALRY);

            assertEquals(36, miles(MovementType.FORCED, true, List.of(), 0, 1));
        }

        @Test
        @DisplayName("should apply weather unless the commander is a ranger")
        void shouldApplyWeather() {
            assertEquals(10, miles(MovementType.STANDARD, true, List.of(), -2, 1));
            assertEquals(12, miles(MovementType.STANDARD, true, List.of("Ranger"), -2, 1));
        }

        @Test
        @DisplayName("should cap a long column")
        void shouldCapLongColumn() {
            assertEquals(6, miles(MovementType.STANDARD, true, List.of(), 0, 7));
            assertEquals(12, miles(MovementType.FORCED, true, List.of(), 0, 7));
        }
    }

    @Nested
    @DisplayName("validateMovementOrder()")
    class ValidationTests {

        @Test
        @DisplayName("should refuse off-road legs for an army with wagons")
        void shouldRefuseWagonsOffRoad() {
            army.getDetachments().add(Detachment.builder().id(5).unitTypeId(1).soldiers(10).wagons(3).build());

            MovementValidation validation = movementService.validateMovementOrder(campaign.getUnitTypes(), army,
                    List.of(true), List.of(false), false);

            assertFalse(validation.valid());
            assertEquals("Cannot travel off-road with wagons", validation.error());
        }

        @Test
        @DisplayName("should refuse a night march off-road")
        void shouldRefuseNightOffRoad() {
            MovementValidation validation = movementService.validateMovementOrder(campaign.getUnitTypes(), army,
                    List.of(false, true), List.of(false, false), true);

            assertEquals("Cannot night march off-road", validation.error());
        }

        @Test
        @DisplayName("should accept an on-road day march")
        void shouldAcceptRoadMarch() {
            assertTrue(movementService.validateMovementOrder(campaign.getUnitTypes(), army,
                    List.of(false), List.of(true), false).valid());
        }
    }
}
