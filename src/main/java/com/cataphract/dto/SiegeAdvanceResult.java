package com.cataphract.dto;

/**
 * One week of siege progress: the new threshold and the gate roll against it.
 */
public record SiegeAdvanceResult(int siegeId, int threshold, int roll, boolean gatesOpened) {
}
