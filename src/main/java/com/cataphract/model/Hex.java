package com.cataphract.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One six-mile map tile.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Hex {

    private int id;
    private int q;
    private int r;

    @Builder.Default
    private String terrain = "flatland";

    private int settlement;
    private boolean goodCountry;
    private boolean road;

    @Builder.Default
    private int foragingTimesRemaining = 5;

    private boolean torched;
    private Integer lastForagedDay;
    private Integer lastRecruitedDay;
    private Integer lastTorchedDay;
    private Integer lastControlChangeDay;
    private Integer controllingFactionId;

    @JsonIgnore
    public HexCoord getCoord() {
        return new HexCoord(q, r);
    }

    public int distanceTo(Hex other) {
        return getCoord().distanceTo(other.getCoord());
    }

    /**
     * Marks this hex as burnt: no foraging until the seasonal reset.
     */
    public void burn(int day) {
        this.torched = true;
        this.foragingTimesRemaining = 0;
        this.lastTorchedDay = day;
    }
}
