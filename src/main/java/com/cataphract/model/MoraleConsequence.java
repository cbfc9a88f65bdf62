package com.cataphract.model;

/**
 * Result table for a failed morale check, indexed by the 2d6 roll.
 */
public enum MoraleConsequence {
    MUTINY(2),
    MASS_DESERTION(3),
    DETACHMENTS_DEFECT(4),
    MAJOR_DESERTION(5),
    ARMY_SPLITS(6),
    RANDOM_DETACHMENT_DEFECTS(7),
    DESERTION(8),
    DETACHMENTS_DEPART(9),
    CAMP_FOLLOWERS(10),
    DETACHMENT_DEPARTS(11),
    NO_CONSEQUENCES(12);

    private final int roll;

    MoraleConsequence(int roll) {
        this.roll = roll;
    }

    public int getRoll() {
        return roll;
    }

    /**
     * Rolls outside 2..12 are clamped onto the table.
     */
    public static MoraleConsequence forRoll(int roll) {
        int clamped = Math.max(2, Math.min(12, roll));
        return values()[clamped - 2];
    }
}
