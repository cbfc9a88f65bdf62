package com.cataphract.dto;

import lombok.Builder;
import lombok.Data;

/**
 * Result of a harrying attempt against an enemy army.
 */
@Data
@Builder
public class HarryingResult {
    private boolean success;
    private int roll;
    private int modifier;
    private String detail;
    private int inflictedCasualties;
    private int attackerLosses;
    private int suppliesBurned;
    private int suppliesStolen;
    private int lootStolen;
}
