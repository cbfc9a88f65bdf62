package com.cataphract.dto;

import com.cataphract.config.ScenarioDefinition;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DTO for exposing the available starting scenarios.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ScenarioInfoDTO {

    private String id;
    private String name;
    private String description;
    private int factionCount;
    private int armyCount;
    private int hexCount;

    public static ScenarioInfoDTO fromDefinition(ScenarioDefinition def) {
        return ScenarioInfoDTO.builder()
                .id(def.id())
                .name(def.name())
                .description(def.description())
                .factionCount(def.campaign().getFactions().size())
                .armyCount(def.campaign().getArmies().size())
                .hexCount(def.campaign().getHexes().size())
                .build();
    }
}
