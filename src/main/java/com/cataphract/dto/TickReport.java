package com.cataphract.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Everything a daily tick did to a campaign, broadcast once the tick ends.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TickReport {
    private int campaignId;
    /** The day that was resolved; the campaign now sits on {@code day + 1}. */
    private int day;
    @Builder.Default
    private List<OrderExecutionRecord> orders = new ArrayList<>();
    @Builder.Default
    private List<Integer> deliveredMessageIds = new ArrayList<>();
    @Builder.Default
    private List<Integer> arrivedShipIds = new ArrayList<>();
    @Builder.Default
    private List<SiegeAdvanceResult> sieges = new ArrayList<>();
    @Builder.Default
    private List<Integer> starvingArmyIds = new ArrayList<>();
    @Builder.Default
    private List<MercenaryUpkeepResult> mercenaryUpkeep = new ArrayList<>();
}
