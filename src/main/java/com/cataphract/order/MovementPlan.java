package com.cataphract.order;

import com.cataphract.model.MovementType;
import com.cataphract.order.payload.MoveLeg;

import java.util.List;

/**
 * Legs actually travelled by a move order and where the army ends up.
 * A wrong fork at night cuts the plan short at the diversion.
 */
public record MovementPlan(
        MovementType movementType,
        List<MoveLeg> legs,
        double totalFraction,
        int finalHexId,
        boolean diverted,
        String diversionDetail
) {

    public boolean anyNightLeg() {
        return legs.stream().anyMatch(MoveLeg::isNight);
    }
}
