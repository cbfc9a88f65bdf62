package com.cataphract.model;

/**
 * The four fixed sub-divisions of a campaign day, in execution order.
 */
public enum DayPart {
    MORNING,
    MIDDAY,
    EVENING,
    NIGHT;

    /**
     * Lower-case label used inside seed strings.
     */
    public String label() {
        return name().toLowerCase();
    }

    public boolean isNight() {
        return this == NIGHT;
    }
}
