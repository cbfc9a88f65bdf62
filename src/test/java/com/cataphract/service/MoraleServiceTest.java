package com.cataphract.service;

import com.cataphract.CampaignFixtures;
import com.cataphract.dto.MoraleCheck;
import com.cataphract.dto.MoraleConsequenceReport;
import com.cataphract.model.Army;
import com.cataphract.model.Commander;
import com.cataphract.model.Detachment;
import com.cataphract.model.MoraleConsequence;
import com.cataphract.rng.SeededRng;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for MoraleService.
 */
class MoraleServiceTest {

    private MoraleService moraleService;
    private Army army;

    @BeforeEach
    void setUp() {
        moraleService = new MoraleService(new SeededRng());
        army = CampaignFixtures.army(1, 1, 1, 1, 1000, 5000, 30000);
    }

    @Nested
    @DisplayName("adjustMorale()")
    class AdjustTests {

        @Test
        @DisplayName("should never exceed the army's maximum")
        void shouldClampToMax() {
            moraleService.adjustMorale(army, 10);
            assertEquals(12, army.getMoraleCurrent());
        }

        @Test
        @DisplayName("should never drop below zero")
        void shouldClampToZero() {
            moraleService.adjustMorale(army, -20);
            assertEquals(0, army.getMoraleCurrent());
        }
    }

    @Nested
    @DisplayName("rollMoraleCheck()")
    class CheckTests {

        @Test
        @DisplayName("should always pass at morale 12 and always fail at morale 1")
        void shouldCompareRollToMorale() {
            MoraleCheck pass = moraleService.rollMoraleCheck(12, "check:high");
            MoraleCheck fail = moraleService.rollMoraleCheck(1, "check:low");

            assertTrue(pass.success());
            assertFalse(fail.success());
            assertEquals(1, fail.morale());
        }
    }

    @Nested
    @DisplayName("applyMoraleConsequence()")
    class ConsequenceTests {

        @Test
        @DisplayName("should leave the army untouched on a roll of 12")
        void shouldDoNothingOnTwelve() {
            MoraleConsequenceReport report = moraleService.applyMoraleConsequence(army, 12, null, "c", 0);

            assertEquals(MoraleConsequence.NO_CONSEQUENCES, report.consequence());
            assertEquals(1000, army.getTotalSoldiers());
        }

        @Test
        @DisplayName("should lose 30% of soldiers to mass desertion")
        void shouldApplyMassDesertion() {
            MoraleConsequenceReport report = moraleService.applyMoraleConsequence(army, 3, null, "c", 0);

            assertEquals(MoraleConsequence.MASS_DESERTION, report.consequence());
            assertEquals(700, army.getTotalSoldiers());
        }

        @Test
        @DisplayName("should shift a poet's result two places towards the mild end")
        void shouldShiftForPoet() {
            Commander poet = Commander.builder().id(9).traits(List.of("poet")).build();

            MoraleConsequenceReport report = moraleService.applyMoraleConsequence(army, 10, poet, "c", 0);

            assertEquals(MoraleConsequence.NO_CONSEQUENCES, report.consequence());
        }

        @Test
        @DisplayName("should keep at least one detachment when detachments defect")
        void shouldKeepOneDetachment() {
            army.getDetachments().add(Detachment.builder().id(2).unitTypeId(1).soldiers(300).build());

            moraleService.applyMoraleConsequence(army, 2, null, "mutiny", 0);

            assertFalse(army.getDetachments().isEmpty());
        }
    }
}
