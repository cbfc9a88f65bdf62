package com.cataphract.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A town, city or fortress occupying a hex.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Stronghold {

    private int id;
    private String name;
    private int hexId;
    private StrongholdType type;
    private Integer controllingFactionId;
    private int defensiveBonus;
    private int threshold;
    private int currentThreshold;
    private boolean gatesOpen;
    private Integer garrisonArmyId;
    private int suppliesHeld;
    private int lootHeld;
}
