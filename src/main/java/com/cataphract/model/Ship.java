package com.cataphract.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Ship {

    private int id;
    private String name;
    private int controllingFactionId;
    private int currentHexId;

    @Builder.Default
    private NavalStatus status = NavalStatus.AVAILABLE;

    @Builder.Default
    private int morale = 9;

    private Integer embarkedArmyId;
    private double movementPointsRemaining;

    @Builder.Default
    private List<Integer> currentRoute = new ArrayList<>();

    private double travelDaysRemaining;
}
