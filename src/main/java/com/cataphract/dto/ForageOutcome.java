package com.cataphract.dto;

import lombok.Builder;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of a foraging action. Failed hexes map to the reason they were skipped.
 */
@Data
@Builder
public class ForageOutcome {
    private boolean success;
    private int suppliesGained;
    private List<Integer> foragedHexes;
    @Builder.Default
    private Map<Integer, String> failedHexes = new LinkedHashMap<>();
    private boolean revoltTriggered;
}
