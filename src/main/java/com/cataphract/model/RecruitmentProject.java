package com.cataphract.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A muster in progress around a stronghold.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RecruitmentProject {

    private int id;
    private int strongholdId;
    private int factionId;
    private int commanderId;
    private int rallyHexId;
    private int startedOnDay;
    private int completesOnDay;
    private int infantry;
    private int cavalry;
    private int wagons;
    private int noncombatants;

    @Builder.Default
    private List<Integer> sourceHexIds = new ArrayList<>();

    private int pendingOrderId;
    private boolean revoltTriggered;
}
