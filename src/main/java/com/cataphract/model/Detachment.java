package com.cataphract.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A single-unit-type group of soldiers inside an army.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Detachment {

    private int id;
    private int unitTypeId;
    private int soldiers;
    private int wagons;
    private int engines;
    private String name;

    /**
     * Applies a fractional loss, never dropping below one soldier.
     */
    public void applyLoss(double fraction) {
        soldiers = Math.max(1, (int) (soldiers * (1 - fraction)));
    }
}
