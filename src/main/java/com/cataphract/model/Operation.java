package com.cataphract.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A covert operation (intelligence, assassination or sabotage).
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Operation {

    private int id;
    private int commanderId;
    private OperationType operationType;

    @Builder.Default
    private Map<String, Object> targetDescriptor = new LinkedHashMap<>();

    private int lootCost;

    @Builder.Default
    private String complexity = "standard";

    /** 2d6 target the roll had to meet, filled in on resolution. */
    private int successTarget;

    private Integer executedOnDay;

    @Builder.Default
    private OperationOutcome outcome = OperationOutcome.PENDING;

    private Integer roll;

    @Builder.Default
    private TerritoryType territoryType = TerritoryType.FRIENDLY;

    private int difficultyModifier;
}
