package com.cataphract.model;

/**
 * Kind of stronghold. Each kind carries the supply multiplier used when its
 * stores are captured and the share of its population that follows a victor.
 */
public enum StrongholdType {
    TOWN(10_000, 0.10),
    CITY(100_000, 0.15),
    FORTRESS(1_000, 0.05);

    private final int captureSupplyMultiplier;
    private final double noncombatantRatio;

    StrongholdType(int captureSupplyMultiplier, double noncombatantRatio) {
        this.captureSupplyMultiplier = captureSupplyMultiplier;
        this.noncombatantRatio = noncombatantRatio;
    }

    public int getCaptureSupplyMultiplier() {
        return captureSupplyMultiplier;
    }

    public double getNoncombatantRatio() {
        return noncombatantRatio;
    }
}
