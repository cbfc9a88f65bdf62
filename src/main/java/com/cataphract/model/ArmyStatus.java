package com.cataphract.model;

/**
 * Lifecycle tag of an army.
 */
public enum ArmyStatus {
    IDLE,
    MARCHING,
    FORCED_MARCH,
    NIGHT_MARCH,
    RESTING,
    FORAGING,
    TORCHING,
    BESIEGING,
    IN_BATTLE,
    HARRYING,
    GARRISONED,
    ROUTED;

    /**
     * Statuses that are reset to IDLE at the start of every day.
     */
    public boolean isMarching() {
        return this == MARCHING || this == FORCED_MARCH || this == NIGHT_MARCH;
    }
}
