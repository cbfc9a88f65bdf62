package com.cataphract.service;

import com.cataphract.config.RulesConfig;
import com.cataphract.dto.MovementOptions;
import com.cataphract.dto.MovementValidation;
import com.cataphract.model.Army;
import com.cataphract.model.MovementType;
import com.cataphract.model.UnitType;
import com.cataphract.rng.SeededRng;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Service responsible for march validation and daily movement allowances.
 */
@Service
@RequiredArgsConstructor
public class MovementService {

    private static final String RANGER = "ranger";

    private final SeededRng rng;

    /**
     * Rejects off-road legs with wagons, night marches off-road and river
     * fords with wagons, in that order.
     */
    public MovementValidation validateMovementOrder(Map<Integer, UnitType> unitTypes, Army army,
                                                    List<Boolean> offRoadLegs, List<Boolean> fordLegs,
                                                    boolean isNight) {
        boolean anyOffRoad = offRoadLegs.stream().anyMatch(Boolean.TRUE::equals);
        boolean anyFord = fordLegs.stream().anyMatch(Boolean.TRUE::equals);
        int wagons = army.getTotalWagons();

        if (anyOffRoad && wagons > 0) {
            return MovementValidation.invalid("Cannot travel off-road with wagons");
        }
        if (isNight && anyOffRoad) {
            return MovementValidation.invalid("Cannot night march off-road");
        }
        if (anyFord && wagons > 0) {
            return MovementValidation.invalid("Cannot ford rivers with wagons");
        }
        return MovementValidation.ok();
    }

    /**
     * Miles the army may cover in one day with the given movement type.
     */
    public double calculateDailyMovementMiles(Map<Integer, UnitType> unitTypes, Army army,
                                              MovementType movementType, MovementOptions options,
                                              RulesConfig rules) {
        RulesConfig.Movement movement = rules.getMovement();
        int speed = switch (movementType) {
            case STANDARD -> options.onRoad() ? movement.getRoadStandardMilesPerDay() : movement.getOffroadStandardMilesPerDay();
            case FORCED -> options.onRoad() ? movement.getRoadForcedMilesPerDay() : movement.getOffroadForcedMilesPerDay();
            case NIGHT -> options.onRoad() ? movement.getNightMilesPerDay() : 0;
        };

        if (movementType == MovementType.FORCED && isCavalryOnly(unitTypes, army)) {
            speed *= movement.getCavalryForcedMultiplier();
        }
        if (!options.hasTrait(RANGER)) {
            speed += options.weatherModifier();
        }
        speed = Math.max(0, speed);

        if (options.columnLengthMiles() > movement.getColumnLengthThreshold()) {
            if (movementType == MovementType.STANDARD) {
                return Math.min(speed, movement.getColumnCappedStandardSpeed());
            }
            if (movementType == MovementType.FORCED) {
                return Math.min(speed, movement.getColumnCappedForcedSpeed());
            }
        }
        return speed;
    }

    public boolean shouldTakeWrongFork(String seed, RulesConfig rules) {
        double chance = rules.getMovement().getNightWrongPathChance() / 6.0;
        return rng.checkSuccess(seed, chance, "1d6").success();
    }

    private static boolean isCavalryOnly(Map<Integer, UnitType> unitTypes, Army army) {
        return army.getDetachments().stream().allMatch(d -> {
            UnitType type = unitTypes.get(d.getUnitTypeId());
            return type != null && type.isCavalry();
        });
    }
}
