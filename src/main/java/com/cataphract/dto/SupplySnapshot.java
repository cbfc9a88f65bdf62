package com.cataphract.dto;

import lombok.Builder;
import lombok.Data;

/**
 * Capacity, consumption and column length derived from an army's detachments.
 */
@Data
@Builder
public class SupplySnapshot {
    private int totalSoldiers;
    private int totalCavalry;
    private int totalWagons;
    private int noncombatants;
    private int capacity;
    private int consumption;
    private double columnLengthMiles;
}
