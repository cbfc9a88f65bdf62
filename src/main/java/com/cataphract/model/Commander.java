package com.cataphract.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A commander leading armies on behalf of a faction.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Commander {

    private int id;
    private String name;
    private int factionId;
    private int age;

    /** Trait names, e.g. "ranger", "poet", "logistician". */
    @Builder.Default
    private List<String> traits = new ArrayList<>();

    private Integer currentHexId;

    @Builder.Default
    private CommanderStatus status = CommanderStatus.ACTIVE;

    private Integer capturedByFactionId;

    public boolean hasTrait(String trait) {
        return traits != null && traits.stream().anyMatch(t -> t.equalsIgnoreCase(trait));
    }
}
