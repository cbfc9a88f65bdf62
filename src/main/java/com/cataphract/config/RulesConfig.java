package com.cataphract.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Tunable rule constants, bound from {@code campaign.rules.*}.
 * <p>
 * Defaults reproduce the published rule set, so {@code new RulesConfig()}
 * is a complete configuration for unit tests.
 */
@Component
@ConfigurationProperties(prefix = "campaign.rules")
@Data
public class RulesConfig {

    private Supply supply = new Supply();
    private Morale morale = new Morale();
    private Movement movement = new Movement();
    private Visibility visibility = new Visibility();
    private RevoltOutcome revoltOutcome = new RevoltOutcome();
    private Battle battle = new Battle();
    private Siege siege = new Siege();
    private Naval naval = new Naval();
    private Messaging messaging = new Messaging();
    private Recruitment recruitment = new Recruitment();
    private Operations operations = new Operations();
    private Mercenaries mercenaries = new Mercenaries();

    @Data
    public static class Supply {
        private int infantryCapacity = 15;
        private int noncombatantCapacity = 15;
        private int cavalryCapacity = 75;
        private int wagonCapacity = 1000;
        private int infantryConsumption = 1;
        private int noncombatantConsumption = 1;
        private int cavalryConsumption = 10;
        private int wagonConsumption = 10;
        private double baseNoncombatantRatio = 0.25;
        private double spartanRatio = 0.125;
        private double exclusiveSkirmisherRatio = 0.10;
        private int foragingMultiplier = 500;
        private int foragingLimitPerSeason = 5;
        /** Out of 6. */
        private int torchRevoltChance = 1;
        /** Out of 6, when the hex was foraged within the cooldown. */
        private int forageRevoltChanceRepeat = 2;
        private int torchRevoltHostileModifier = 1;
        private int forageRevoltHostileModifier = 1;
        private int revoltCooldownDays = 365;
        private int recentlyConqueredDays = 90;
    }

    @Data
    public static class Morale {
        private int defaultResting = 9;
        private int defaultMax = 12;
        private int forcedMarchMoraleLossPerWeek = 1;
        private int starvationMoraleLossPerDay = 1;
        private int starvationDissolutionDays = 14;
    }

    @Data
    public static class Movement {
        private int roadStandardMilesPerDay = 12;
        private int roadForcedMilesPerDay = 18;
        private int offroadStandardMilesPerDay = 6;
        private int offroadForcedMilesPerDay = 9;
        private int nightMilesPerDay = 6;
        private int nightForcedMilesPerDay = 12;
        private int cavalryForcedMultiplier = 2;
        private double columnLengthThreshold = 6.0;
        private int columnCappedStandardSpeed = 6;
        private int columnCappedForcedSpeed = 12;
        /** Out of 6. */
        private int nightWrongPathChance = 2;
    }

    @Data
    public static class Visibility {
        private int baseRadius = 1;
        private int cavalryBonus = 1;
        private int outriderBonus = 1;
        private int badWeatherPenalty = 1;
        private int veryBadWeatherPenalty = 2;
    }

    @Data
    public static class RevoltOutcome {
        private int infantryDieSize = 20;
        private int infantryMultiplier = 500;
    }

    @Data
    public static class Battle {
        private int routThreshold = 2;
        private int retreatHexesMin = 1;
        private int retreatHexesMax = 6;
        private int retreatSupplyLossDie = 6;
        private int retreatSupplyLossMultiplier = 10;
        /** Out of 6, when losing by 4 or 5. */
        private int captureChanceMinor = 1;
        /** Out of 6, when losing by 6 or more. */
        private int captureChanceMajor = 2;
        private double multiSideNumericBonusRatio = 0.1;
        private double assaultAttritionFraction = 0.10;
        /** Defending commander escapes a fallen stronghold on 1d6 at or below this. */
        private int commanderEscapeThreshold = 3;
        private int pillageMoraleBonus = 2;
    }

    @Data
    public static class Siege {
        private int townThreshold = 10;
        private int cityThreshold = 15;
        private int fortressThreshold = 20;
        /** Applied every week. */
        private int defaultModifier = -1;
        private int diseaseModifier = -1;
        private int resupplyModifier = 2;
        private int attackedModifier = 1;
        private int siegeEngineReductionPerDetachment = 1;
        private int starvationThreshold = 0;
    }

    @Data
    public static class Naval {
        private int friendlyMilesPerDay = 48;
        private int hostileMilesPerDay = 36;
        private int embarkDays = 1;
        private int disembarkDays = 1;
    }

    @Data
    public static class Messaging {
        private int friendlySuccessNumerator = 19;
        private int friendlySuccessDenominator = 20;
        private int hostileSuccessNumerator = 5;
        private int hostileSuccessDenominator = 6;
        private int friendlyMilesPerDay = 48;
        private int hostileMilesPerDay = 36;
        private int neutralMilesPerDay = 42;
    }

    @Data
    public static class Recruitment {
        private int musterDurationDays = 30;
        private int recruitmentCooldownDays = 365;
        /** Out of 6. */
        private int revoltChance = 1;
        private int recentlyConqueredDays = 90;
    }

    @Data
    public static class Operations {
        private int baseSuccessTarget = 7;
        private int simpleModifier = 2;
        private int complexModifier = -2;
        private int hostileTerritoryModifier = -1;
        private int lootCostDefault = 100;
    }

    @Data
    public static class Mercenaries {
        private int infantryUpkeepPerDay = 1;
        private int cavalryUpkeepPerDay = 3;
        private int graceDaysWithoutPay = 3;
        private int moralePenaltyUnpaid = 1;
        /** Desertion chance, numerator over denominator. */
        private int desertionChanceNumerator = 1;
        private int desertionChanceDenominator = 6;
    }
}
