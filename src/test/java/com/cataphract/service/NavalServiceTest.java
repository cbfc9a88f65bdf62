package com.cataphract.service;

import com.cataphract.CampaignFixtures;
import com.cataphract.config.RulesConfig;
import com.cataphract.dto.NavalActionResult;
import com.cataphract.model.Army;
import com.cataphract.model.Campaign;
import com.cataphract.model.NavalStatus;
import com.cataphract.model.Ship;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for NavalService.
 */
class NavalServiceTest {

    private NavalService navalService;
    private RulesConfig rules;
    private Campaign campaign;
    private Army army;
    private Ship ship;

    @BeforeEach
    void setUp() {
        navalService = new NavalService();
        rules = CampaignFixtures.rules();
        campaign = CampaignFixtures.campaign();
        army = campaign.getArmies().get(1);
        ship = campaign.getShips().get(1);
    }

    @Nested
    @DisplayName("embark() / disembark()")
    class EmbarkationTests {

        @Test
        @DisplayName("should link army and ship sharing a hex")
        void shouldEmbark() {
            NavalActionResult result = navalService.embark(army, ship, rules);

            assertTrue(result.success());
            assertEquals(1, army.getEmbarkedShipId());
            assertEquals(1, ship.getEmbarkedArmyId());
            assertEquals(NavalStatus.TRANSPORTING, ship.getStatus());
        }

        @Test
        @DisplayName("should refuse when army and ship are apart")
        void shouldRefuseDistantShip() {
            ship.setCurrentHexId(3);

            NavalActionResult result = navalService.embark(army, ship, rules);

            assertFalse(result.success());
            assertEquals("army and ship must share a hex", result.detail());
        }

        @Test
        @DisplayName("should refuse to disembark while the ship is en route")
        void shouldRefuseDisembarkEnRoute() {
            navalService.embark(army, ship, rules);

            NavalActionResult result = navalService.disembark(army, ship, rules);

            assertFalse(result.success());
            assertEquals("ship is still en route", result.detail());
        }

        @Test
        @DisplayName("should land the army on the ship's hex")
        void shouldDisembark() {
            navalService.embark(army, ship, rules);
            ship.setTravelDaysRemaining(0);
            ship.setCurrentHexId(3);

            NavalActionResult result = navalService.disembark(army, ship, rules);

            assertTrue(result.success());
            assertNull(army.getEmbarkedShipId());
            assertEquals(3, army.getCurrentHexId());
            assertEquals(NavalStatus.AVAILABLE, ship.getStatus());
        }
    }

    @Nested
    @DisplayName("setCourse() / advanceShips()")
    class CourseTests {

        @Test
        @DisplayName("should price each leg by hex distance")
        void shouldSetCourse() {
            NavalActionResult result = navalService.setCourse(campaign, ship, List.of(3, 5), rules);

            assertTrue(result.success());
            // 2 + 2 hexes of 6 miles at 48 miles a day
            assertEquals(0.5, ship.getTravelDaysRemaining(), 1e-9);
        }

        @Test
        @DisplayName("should refuse an unknown hex in the route")
        void shouldRefuseUnknownHex() {
            NavalActionResult result = navalService.setCourse(campaign, ship, List.of(42), rules);

            assertFalse(result.success());
            assertEquals("route references unknown hex", result.detail());
        }

        @Test
        @DisplayName("should deliver the ship and its army at the end of the route")
        void shouldArriveWithArmy() {
            navalService.embark(army, ship, rules);
            navalService.setCourse(campaign, ship, List.of(2), rules);

            List<Integer> arrived = navalService.advanceShips(campaign, 1.0);

            assertEquals(List.of(1), arrived);
            assertEquals(2, ship.getCurrentHexId());
            assertEquals(2, army.getCurrentHexId());
            assertTrue(ship.getCurrentRoute().isEmpty());
        }
    }
}
